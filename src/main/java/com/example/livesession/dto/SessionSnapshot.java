package com.example.livesession.dto;

import com.example.livesession.model.AnswerFeedback;
import com.example.livesession.model.LeaderboardEntry;
import com.example.livesession.model.MapFocus;
import com.example.livesession.model.SegmentState;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Everything a (re)connecting client needs to render the session without replaying events.
 * Events with {@code seq} greater than {@code session.seq} are newer than this snapshot.
 *
 * @param currentRound   last activated round, open or closed; null before the first activation
 * @param hasAnswered    only set when the snapshot is taken for a participant
 * @param yourFeedback   the participant's feedback for the current round, if answered
 * @param leaderboard    empty for participants while the leaderboard is hidden
 * @param segment        last segment the presenter synced, if any
 * @param shownResults   results of the round the presenter last put on screen
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionSnapshot(
        SessionView session,
        RoundView currentRound,
        Boolean hasAnswered,
        AnswerFeedback yourFeedback,
        ParticipantView you,
        List<LeaderboardEntry> leaderboard,
        MapFocus focus,
        boolean mapLocked,
        String mapLayer,
        SegmentState segment,
        RoundResults shownResults,
        Instant serverTime
) { }
