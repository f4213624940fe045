package com.example.livesession.event;

import com.example.livesession.dto.QuestionView;
import com.example.livesession.dto.RoundResults;
import com.example.livesession.model.CloseReason;
import com.example.livesession.model.LeaderboardEntry;
import com.example.livesession.model.QuestionType;
import com.example.livesession.model.SessionStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Payload shapes of the events in {@link EventType}. */
public final class EventPayloads {

    private EventPayloads() {}

    public record StatusChanged(SessionStatus status, SessionStatus previousStatus, long seq) { }

    /**
     * Used for both ParticipantJoined and ParticipantLeft.
     *
     * @param reason joined, reconnected, left or disconnected
     */
    public record ParticipantPresence(String participantId, String displayName, String reason,
                                      int totalParticipants, int connectedParticipants) { }

    public record QuestionActivated(String roundId, String questionId, QuestionType questionType,
                                    QuestionView question, int points, int timeLimitSeconds,
                                    Instant activatedAt, Instant endsAt, int index, int total) { }

    /** @param reason extended or resumed */
    public record TimeExtended(String roundId, long extendedBySeconds, Instant endsAt, String reason) { }

    public record QuestionSkipped(String roundId, String questionId, Instant skippedAt) { }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record QuestionClosed(String roundId, String questionId, CloseReason reason, String correctAnswer,
                                 String explanation, int totalResponses, int correctResponses, Instant closedAt) { }

    public record ResponseSubmitted(String roundId, String participantId, int totalResponses, int totalParticipants) { }

    public record LeaderboardUpdated(List<LeaderboardEntry> entries) { }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TeacherFocusChanged(double latitude, double longitude, double zoom, Double bearing, Double pitch,
                                      Instant updatedAt) { }

    public record MapLockStateSync(@JsonProperty("isLocked") boolean isLocked, Instant syncedAt) { }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SegmentSync(int segmentIndex, String segmentId, String segmentName,
                              @JsonProperty("isPlaying") boolean isPlaying, Instant syncedAt) { }

    public record MapLayerSync(String layerKey, Instant syncedAt) { }

    /** Results the presenter put on screen for a closed round. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record QuestionResults(String roundId, String questionId, List<RoundResults.ResponseRow> results,
                                  Map<String, Integer> optionCounts, String correctAnswer, Instant showedAt) { }

    public record SessionEnded(Instant endedAt, List<LeaderboardEntry> finalLeaderboard) { }
}
