package com.example.livesession.service;

import com.example.livesession.dto.MapPinsData;
import com.example.livesession.dto.RoundResults;
import com.example.livesession.dto.SessionResults;
import com.example.livesession.dto.WordCloudData;
import com.example.livesession.model.LeaderboardEntry;
import com.example.livesession.model.ParticipantResponse;
import com.example.livesession.model.QuestionOption;
import com.example.livesession.model.QuestionRound;
import com.example.livesession.model.Session;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only aggregates over rounds and sessions. Answers stay hidden while a round is open.
 * Caller holds the session lock.
 */
@Component
public class SessionAnalytics {

    public RoundResults roundResults(QuestionRound round) {
        boolean reveal = round.isClosed();
        List<ParticipantResponse> responses = round.getResponses();

        Map<String, Integer> optionCounts = null;
        if (round.getType().usesOptions()) {
            optionCounts = new LinkedHashMap<>();
            for (QuestionOption o : round.getQuestion().participantOptions()) optionCounts.put(o.id(), 0);
            for (ParticipantResponse r : responses) {
                String id = r.payload().optionId();
                if (id != null) optionCounts.merge(id.trim(), 1, Integer::sum);
            }
        }

        List<RoundResults.ResponseRow> rows = new ArrayList<>();
        long totalMillis = 0;
        for (ParticipantResponse r : responses) {
            totalMillis += r.elapsedMillis();
            rows.add(new RoundResults.ResponseRow(
                    r.participantId(),
                    r.displayName(),
                    reveal ? r.correct() : null,
                    reveal ? r.pointsAwarded() : 0,
                    r.elapsedMillis() / 1000.0,
                    reveal ? r.distanceMeters() : null));
        }

        int total = responses.size();
        int correct = round.correctCount();
        return new RoundResults(
                round.getId(),
                round.getQuestionId(),
                round.getQuestion().text(),
                round.getType(),
                round.getIndex(),
                round.isClosed(),
                round.getCloseReason(),
                round.getActivatedAt(),
                round.getClosedAt(),
                total,
                reveal ? correct : 0,
                (reveal && total > 0) ? percent(correct, total) : null,
                total > 0 ? Math.round((double) totalMillis / total) / 1000.0 : null,
                optionCounts,
                reveal ? round.getQuestion().correctAnswerDisplay() : null,
                rows);
    }

    /** Responses are trimmed, lower-cased and whitespace-collapsed before counting. */
    public WordCloudData wordCloud(QuestionRound round) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        int total = 0;
        for (ParticipantResponse r : round.getResponses()) {
            String word = normalizeWord(r.payload().text());
            if (word.isEmpty()) continue;
            counts.merge(word, 1, Integer::sum);
            total++;
        }

        List<WordCloudData.Entry> words = new ArrayList<>();
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            words.add(new WordCloudData.Entry(e.getKey(), e.getValue(), percent(e.getValue(), total)));
        }
        words.sort(Comparator.comparingInt(WordCloudData.Entry::count).reversed()
                .thenComparing(WordCloudData.Entry::word));
        return new WordCloudData(round.getId(), round.getQuestionId(), total, List.copyOf(words));
    }

    public MapPinsData mapPins(QuestionRound round) {
        boolean reveal = round.isClosed();
        List<MapPinsData.Pin> pins = new ArrayList<>();
        double distanceSum = 0;
        int withDistance = 0;
        for (ParticipantResponse r : round.getResponses()) {
            if (!r.payload().hasCoordinate()) continue;
            if (r.distanceMeters() != null) {
                distanceSum += r.distanceMeters();
                withDistance++;
            }
            pins.add(new MapPinsData.Pin(
                    r.participantId(),
                    r.displayName(),
                    r.payload().latitude(),
                    r.payload().longitude(),
                    reveal ? r.distanceMeters() : null,
                    reveal ? r.correct() : null,
                    reveal ? r.pointsAwarded() : 0));
        }

        var q = round.getQuestion();
        return new MapPinsData(
                round.getId(),
                round.getQuestionId(),
                reveal && q.target() != null ? q.target().latitude() : null,
                reveal && q.target() != null ? q.target().longitude() : null,
                reveal ? q.acceptanceRadiusMeters() : null,
                reveal && withDistance > 0 ? distanceSum / withDistance : null,
                List.copyOf(pins));
    }

    /**
     * @param leaderboard final leaderboard for ended sessions, the live one otherwise
     */
    public SessionResults sessionResults(Session session, List<LeaderboardEntry> leaderboard) {
        List<RoundResults> rounds = new ArrayList<>();
        int responseCount = 0;
        for (QuestionRound r : session.getRounds()) {
            rounds.add(roundResults(r));
            responseCount += r.responseCount();
        }

        int participants = leaderboard.size();
        double averageScore = 0;
        if (participants > 0) {
            long sum = 0;
            for (LeaderboardEntry e : leaderboard) sum += e.score();
            averageScore = Math.round(sum * 10.0 / participants) / 10.0;
        }
        long expected = (long) participants * rounds.size();
        double completion = expected > 0 ? percent(Math.min(responseCount, expected), expected) : 0d;

        Long duration = null;
        if (session.getStartedAt() != null) {
            var end = session.getEndedAt() != null ? session.getEndedAt() : session.getLastActivityAt();
            duration = Math.max(0L, Duration.between(session.getStartedAt(), end).getSeconds());
        }

        return new SessionResults(
                session.getId(),
                session.getCode(),
                session.getName(),
                session.getStatus(),
                session.getStartedAt(),
                session.getEndedAt(),
                duration,
                participants,
                rounds.size(),
                session.getQuestions().size(),
                averageScore,
                completion,
                leaderboard,
                List.copyOf(rounds));
    }

    static String normalizeWord(String raw) {
        if (raw == null) return "";
        return raw.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static double percent(long part, long whole) {
        return Math.round(part * 1000.0 / whole) / 10.0;
    }
}
