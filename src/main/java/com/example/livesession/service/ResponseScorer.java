package com.example.livesession.service;

import com.example.livesession.model.QuestionRound;
import org.springframework.stereotype.Component;

/**
 * Points for one response: the full point value when correct, plus up to 50% for speed.
 * Elapsed time is measured by the server and excludes pauses.
 */
@Component
public class ResponseScorer {

    static final double MAX_SPEED_BONUS_RATIO = 0.5;

    public Score score(QuestionRound round, boolean correct, long elapsedMillis, boolean speedBonusEnabled) {
        int base = correct ? Math.max(0, round.getPointValue()) : 0;
        long limit = round.effectiveLimitMillis();
        long elapsed = Math.min(Math.max(0L, elapsedMillis), Math.max(0L, limit));

        int bonus = 0;
        if (speedBonusEnabled && base > 0 && limit > 0) {
            double fractionLeft = 1d - ((double) elapsed / (double) limit);
            bonus = (int) Math.floor(base * MAX_SPEED_BONUS_RATIO * fractionLeft);
            if (bonus < 0) bonus = 0;
        }
        return new Score(base, bonus, Math.max(0, base + bonus), elapsed);
    }

    /** @param elapsedMillis elapsed time after clamping to the round's limit */
    public record Score(int basePoints, int speedBonus, int total, long elapsedMillis) { }
}
