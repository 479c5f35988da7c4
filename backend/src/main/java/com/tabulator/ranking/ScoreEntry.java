package com.tabulator.ranking;

import java.math.BigDecimal;
import java.util.UUID;

public record ScoreEntry(
        UUID judgeId,
        UUID contestantId,
        UUID categoryId,
        UUID criterionId,
        BigDecimal rawScore,
        BigDecimal weightedScore
) {
}
