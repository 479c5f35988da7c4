package com.tabulator.ranking;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public record ContestantInsight(
        UUID contestantId,
        BigDecimal overallPlacement,
        BigDecimal totalPoints,
        BigDecimal gapToLeader,
        BigDecimal averageRank,
        BigDecimal consistency,
        UUID strongestCategoryId,
        UUID weakestCategoryId,
        List<CategoryStanding> categoryStandings
) {
}
