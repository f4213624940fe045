package com.example.livesession.model;

/**
 * A single row of the leaderboard. Derived from participant state, never stored on its own.
 *
 * @param accuracy            percentage of answered rounds that were correct, null before the first answer
 * @param averageResponseTime seconds, null before the first answer
 */
public record LeaderboardEntry(
        String participantId,
        String displayName,
        int score,
        int rank,
        Double accuracy,
        Double averageResponseTime,
        boolean connected
) {
}
