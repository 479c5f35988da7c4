package com.tabulator.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public final class InsightResponses {

    private InsightResponses() {
    }

    public record CategoryStandingView(
            UUID categoryId,
            String categorySlug,
            String categoryLabel,
            BigDecimal placement,
            BigDecimal rankSum,
            boolean strongest,
            boolean weakest
    ) {
    }

    public record ContestantInsightView(
            UUID contestantId,
            Integer contestantNumber,
            String contestantName,
            BigDecimal overallPlacement,
            String title,
            BigDecimal totalPoints,
            BigDecimal gapToLeader,
            BigDecimal averageRank,
            BigDecimal consistency,
            String strongestCategory,
            String weakestCategory,
            List<CategoryStandingView> categoryStandings
    ) {
    }

    public record DivisionInsights(
            String division,
            List<ContestantInsightView> contestants
    ) {
    }

    public record HeadToHeadView(
            String division,
            UUID contestantA,
            UUID contestantB,
            List<String> categoriesWonByA,
            List<String> categoriesWonByB,
            List<String> tiedCategories,
            BigDecimal overallPlacementA,
            BigDecimal overallPlacementB,
            BigDecimal totalPointsA,
            BigDecimal totalPointsB,
            UUID overallLeaderId
    ) {
    }
}
