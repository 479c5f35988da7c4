package com.tabulator.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public final class ScoringRequests {

    private ScoringRequests() {
    }

    public record SubmitScoresRequest(
            @NotNull(message = "contestantId is required")
            UUID contestantId,

            @NotNull(message = "categoryId is required")
            UUID categoryId,

            @NotEmpty(message = "scores must contain one entry per criterion")
            List<@Valid @NotNull(message = "scores must not contain null entries") CriterionScore> scores
    ) {
    }

    public record CriterionScore(
            @NotNull(message = "criterionId is required")
            UUID criterionId,

            @NotNull(message = "rawScore is required")
            @DecimalMin(value = "0.0", inclusive = true, message = "rawScore must be non-negative")
            @Digits(integer = 3, fraction = 3, message = "rawScore supports up to 3 decimal places")
            BigDecimal rawScore
    ) {
    }

    public record LockRequest(
            @NotNull(message = "contestantId is required")
            UUID contestantId,

            @NotNull(message = "categoryId is required")
            UUID categoryId
    ) {
    }

    public record UnlockRequest(
            @NotNull(message = "judgeId is required")
            UUID judgeId,

            @NotNull(message = "categoryId is required")
            UUID categoryId,

            @NotNull(message = "contestantId is required")
            UUID contestantId
    ) {
    }
}
