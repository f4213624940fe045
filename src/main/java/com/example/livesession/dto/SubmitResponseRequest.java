package com.example.livesession.dto;

import com.example.livesession.model.ResponsePayload;
import jakarta.validation.constraints.NotBlank;

import java.time.Instant;

/** @param clientTimestamp informational; scoring uses the server receipt time */
public record SubmitResponseRequest(
        @NotBlank String roundId,
        String optionId,
        String text,
        Double latitude,
        Double longitude,
        Instant clientTimestamp
) {

    public ResponsePayload toPayload() {
        return new ResponsePayload(optionId, text, latitude, longitude);
    }
}
