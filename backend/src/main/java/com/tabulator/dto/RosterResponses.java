package com.tabulator.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

public final class RosterResponses {

    private RosterResponses() {
    }

    public record CategorySummary(
            UUID categoryId,
            String slug,
            String label,
            BigDecimal weight,
            Integer sortOrder
    ) {
    }

    public record CriterionSummary(
            UUID criterionId,
            UUID categoryId,
            String slug,
            String label,
            BigDecimal percentage,
            BigDecimal maxRawScore,
            Integer sortOrder
    ) {
    }

    public record ContestantSummary(
            UUID contestantId,
            Integer number,
            String fullName,
            String division,
            boolean active,
            OffsetDateTime createdAt
    ) {
    }

    public record JudgeSummary(
            UUID judgeId,
            String fullName,
            String username,
            String division,
            boolean active,
            OffsetDateTime createdAt
    ) {
    }
}
