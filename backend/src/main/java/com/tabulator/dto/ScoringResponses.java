package com.tabulator.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class ScoringResponses {

    private ScoringResponses() {
    }

    public record ScoreRow(
            UUID scoreId,
            UUID judgeId,
            UUID contestantId,
            UUID categoryId,
            UUID criterionId,
            BigDecimal rawScore,
            BigDecimal weightedScore,
            OffsetDateTime updatedAt
    ) {
    }

    public record SubmissionResult(
            UUID judgeId,
            UUID contestantId,
            UUID categoryId,
            BigDecimal totalScore,
            boolean locked,
            List<ScoreRow> scores
    ) {
    }

    public record LockState(
            UUID judgeId,
            UUID categoryId,
            UUID contestantId,
            boolean locked,
            boolean created
    ) {
    }

    public record LockSummary(
            UUID lockId,
            UUID judgeId,
            UUID categoryId,
            UUID contestantId,
            OffsetDateTime lockedAt
    ) {
    }

    public record UnlockResult(
            UUID judgeId,
            UUID categoryId,
            UUID contestantId,
            boolean removed
    ) {
    }

    public record ScoreHistoryEntry(
            UUID historyId,
            UUID scoreId,
            UUID judgeId,
            UUID contestantId,
            UUID categoryId,
            UUID criterionId,
            BigDecimal oldRawScore,
            BigDecimal newRawScore,
            BigDecimal oldWeightedScore,
            BigDecimal newWeightedScore,
            String changeType,
            OffsetDateTime createdAt
    ) {
    }
}
