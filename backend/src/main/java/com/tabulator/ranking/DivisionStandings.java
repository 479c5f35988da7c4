package com.tabulator.ranking;

import com.tabulator.model.Division;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Computed tables for one division. Both maps are keyed by category id in category sort order.
 */
public record DivisionStandings(
        Division division,
        Map<UUID, List<JudgeRank>> judgeRanksByCategory,
        Map<UUID, List<CategoryPlacement>> categoryPlacements,
        List<OverallPlacement> overall
) {

    public List<CategoryPlacement> placementsFor(UUID categoryId) {
        return categoryPlacements.getOrDefault(categoryId, List.of());
    }

    public List<JudgeRank> judgeRanksFor(UUID judgeId, UUID categoryId) {
        return judgeRanksByCategory.getOrDefault(categoryId, List.of()).stream()
                .filter(rank -> rank.judgeId().equals(judgeId))
                .toList();
    }

    public Optional<OverallPlacement> overallFor(UUID contestantId) {
        return overall.stream()
                .filter(placement -> placement.contestantId().equals(contestantId))
                .findFirst();
    }
}
