package com.tabulator.ranking;

import java.math.BigDecimal;
import java.util.UUID;

public record JudgeRank(
        UUID judgeId,
        UUID categoryId,
        UUID contestantId,
        BigDecimal totalScore,
        BigDecimal rank
) {
}
