package com.example.livesession.model;

import java.time.Instant;

/**
 * An accepted, scored response. At most one exists per (participantId, roundId).
 *
 * @param receivedAt      server receipt time; the only clock used for scoring
 * @param clientTimestamp what the client claimed, kept for diagnostics only
 * @param distanceMeters  distance to the target for pin-on-map rounds, otherwise null
 */
public record ParticipantResponse(
        String participantId,
        String displayName,
        String sessionId,
        String roundId,
        String questionId,
        ResponsePayload payload,
        Instant receivedAt,
        Instant clientTimestamp,
        long elapsedMillis,
        boolean correct,
        int basePoints,
        int speedBonus,
        int pointsAwarded,
        Double distanceMeters
) {
}
