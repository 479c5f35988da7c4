package com.tabulator.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class RankingResponses {

    private RankingResponses() {
    }

    public record JudgeRankRow(
            UUID judgeId,
            UUID categoryId,
            UUID contestantId,
            Integer contestantNumber,
            String contestantName,
            BigDecimal totalScore,
            BigDecimal rank
    ) {
    }

    public record JudgeCategoryRanking(
            String division,
            UUID judgeId,
            UUID categoryId,
            String categorySlug,
            List<JudgeRankRow> rows
    ) {
    }

    public record CategoryRankingRow(
            UUID contestantId,
            Integer contestantNumber,
            String contestantName,
            BigDecimal rankSum,
            int judgeCount,
            BigDecimal placement
    ) {
    }

    public record CategoryRanking(
            String division,
            UUID categoryId,
            String categorySlug,
            String categoryLabel,
            List<CategoryRankingRow> rows
    ) {
    }

    public record OverallRankingRow(
            UUID contestantId,
            Integer contestantNumber,
            String contestantName,
            BigDecimal totalPoints,
            int categoriesCounted,
            BigDecimal placement,
            String title
    ) {
    }

    public record OverallRanking(
            String division,
            OffsetDateTime computedAt,
            List<OverallRankingRow> rows
    ) {
    }

    @JsonPropertyOrder({
            "division", "contestantNumber", "contestantName", "totalPoints",
            "categoriesCounted", "placement", "title"
    })
    public record OverallExportRow(
            String division,
            String contestantNumber,
            String contestantName,
            String totalPoints,
            String categoriesCounted,
            String placement,
            String title
    ) {
    }

    @JsonPropertyOrder({
            "division", "categorySlug", "categoryLabel", "contestantNumber", "contestantName",
            "rankSum", "judgeCount", "placement"
    })
    public record CategoryExportRow(
            String division,
            String categorySlug,
            String categoryLabel,
            String contestantNumber,
            String contestantName,
            String rankSum,
            String judgeCount,
            String placement
    ) {
    }

    @JsonPropertyOrder({
            "division", "judgeUsername", "contestantNumber", "contestantName", "categorySlug",
            "criterionSlug", "rawScore", "weightedScore", "locked"
    })
    public record ScoreExportRow(
            String division,
            String judgeUsername,
            String contestantNumber,
            String contestantName,
            String categorySlug,
            String criterionSlug,
            String rawScore,
            String weightedScore,
            String locked
    ) {
    }
}
