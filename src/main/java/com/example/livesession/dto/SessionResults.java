package com.example.livesession.dto;

import com.example.livesession.model.LeaderboardEntry;
import com.example.livesession.model.SessionStatus;

import java.time.Instant;
import java.util.List;

/**
 * Whole-session summary, also what the archive stores for ended sessions.
 *
 * @param completionRate percentage of (participant, asked question) pairs that got a response
 */
public record SessionResults(
        String sessionId,
        String code,
        String name,
        SessionStatus status,
        Instant startedAt,
        Instant endedAt,
        Long durationSeconds,
        int totalParticipants,
        int questionsAsked,
        int totalQuestions,
        double averageScore,
        double completionRate,
        List<LeaderboardEntry> leaderboard,
        List<RoundResults> rounds
) { }
