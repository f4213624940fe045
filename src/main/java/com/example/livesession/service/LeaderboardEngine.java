package com.example.livesession.service;

import com.example.livesession.model.LeaderboardEntry;
import com.example.livesession.model.Participant;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Ranks participants. Pure function of participant state: recomputing without
 * intervening changes yields an equal list.
 *
 * <p>Order: score descending, then earliest first correct answer (none sorts last).
 * Ranks are dense and shared only when both keys are equal; within a shared rank the
 * list is ordered by display name, then id.</p>
 */
@Component
public class LeaderboardEngine {

    private static final Comparator<Instant> FIRST_CORRECT =
            Comparator.nullsLast(Comparator.<Instant>naturalOrder());

    static final Comparator<Participant> ORDER =
            Comparator.comparingInt(Participant::getScore).reversed()
                    .thenComparing(Participant::getFirstCorrectAt, FIRST_CORRECT)
                    .thenComparing(Participant::getDisplayName, String.CASE_INSENSITIVE_ORDER)
                    .thenComparing(Participant::getId);

    public List<LeaderboardEntry> compute(Collection<Participant> participants) {
        if (participants == null || participants.isEmpty()) return List.of();

        List<Participant> sorted = new ArrayList<>(participants);
        sorted.sort(ORDER);

        List<LeaderboardEntry> out = new ArrayList<>(sorted.size());
        int rank = 0;
        Participant prev = null;
        for (Participant p : sorted) {
            if (prev == null || !sameRank(prev, p)) rank++;
            out.add(new LeaderboardEntry(
                    p.getId(),
                    p.getDisplayName(),
                    p.getScore(),
                    rank,
                    p.accuracy(),
                    p.averageResponseSeconds(),
                    p.isConnected()));
            prev = p;
        }
        return List.copyOf(out);
    }

    /** First {@code limit} entries; a non-positive limit returns everything. */
    public List<LeaderboardEntry> top(List<LeaderboardEntry> entries, int limit) {
        if (limit <= 0 || entries.size() <= limit) return entries;
        return List.copyOf(entries.subList(0, limit));
    }

    private static boolean sameRank(Participant a, Participant b) {
        return a.getScore() == b.getScore() && Objects.equals(a.getFirstCorrectAt(), b.getFirstCorrectAt());
    }
}
