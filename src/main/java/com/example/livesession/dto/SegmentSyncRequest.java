package com.example.livesession.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record SegmentSyncRequest(
        @NotNull @Min(0) Integer segmentIndex,
        String segmentId,
        String segmentName,
        @NotNull @JsonProperty("isPlaying") Boolean isPlaying
) { }
