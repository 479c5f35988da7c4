package com.tabulator.ranking;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Turns a raw criterion score into its locked weighted contribution.
 *
 * The criterion percentage is its point ceiling ({@code round(percentage * 100)}), not a
 * multiplier: a legal raw score is stored unchanged in magnitude, rounded to three decimals.
 */
@Component
public class WeightedScoreCalculator {

    public static final int SCORE_SCALE = 3;

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    public BigDecimal maxRawScore(BigDecimal percentage) {
        if (percentage == null || percentage.signum() <= 0 || percentage.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("Criterion percentage must be in (0, 1]: " + percentage);
        }
        return percentage.multiply(ONE_HUNDRED).setScale(0, RoundingMode.HALF_UP);
    }

    public boolean isWithinRange(BigDecimal rawScore, BigDecimal percentage) {
        return rawScore != null
                && rawScore.signum() >= 0
                && rawScore.compareTo(maxRawScore(percentage)) <= 0;
    }

    public BigDecimal weighted(BigDecimal rawScore, BigDecimal percentage) {
        if (!isWithinRange(rawScore, percentage)) {
            throw new IllegalArgumentException(
                    "Raw score " + rawScore + " outside [0, " + maxRawScore(percentage) + "]"
            );
        }
        return rawScore.setScale(SCORE_SCALE, RoundingMode.HALF_UP);
    }

    public BigDecimal total(Collection<BigDecimal> weightedScores) {
        BigDecimal sum = BigDecimal.ZERO;
        for (BigDecimal weightedScore : weightedScores) {
            sum = sum.add(weightedScore);
        }
        return sum.setScale(SCORE_SCALE, RoundingMode.HALF_UP);
    }
}
