package com.example.livesession.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Pins dropped in a pin-on-map round. Target and radius are only filled once the round is closed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MapPinsData(
        String roundId,
        String questionId,
        Double targetLatitude,
        Double targetLongitude,
        Double acceptanceRadiusMeters,
        Double averageDistanceMeters,
        List<Pin> pins
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Pin(String participantId, String displayName, double latitude, double longitude,
                      Double distanceMeters, Boolean correct, int pointsAwarded) { }
}
