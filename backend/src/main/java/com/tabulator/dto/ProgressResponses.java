package com.tabulator.dto;

import java.util.List;
import java.util.UUID;

public final class ProgressResponses {

    private ProgressResponses() {
    }

    public record JudgeCategoryProgress(
            UUID categoryId,
            String categorySlug,
            int lockedContestants,
            int totalContestants,
            boolean complete
    ) {
    }

    public record JudgeProgress(
            UUID judgeId,
            String judgeName,
            String division,
            int lockedSubmissions,
            int expectedSubmissions,
            List<JudgeCategoryProgress> categories
    ) {
    }

    public record ScoringProgress(
            int lockedSubmissions,
            int expectedSubmissions,
            List<JudgeProgress> judges
    ) {
    }
}
