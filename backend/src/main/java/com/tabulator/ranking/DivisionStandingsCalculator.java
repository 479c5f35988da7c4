package com.tabulator.ranking;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Runs the per-judge, per-category and overall stages over one division's snapshot.
 */
@Component
public class DivisionStandingsCalculator {

    private final JudgeCategoryRanker judgeCategoryRanker;
    private final CategoryRankSumAggregator categoryRankSumAggregator;
    private final OverallRankSumAggregator overallRankSumAggregator;

    public DivisionStandingsCalculator(
            JudgeCategoryRanker judgeCategoryRanker,
            CategoryRankSumAggregator categoryRankSumAggregator,
            OverallRankSumAggregator overallRankSumAggregator
    ) {
        this.judgeCategoryRanker = judgeCategoryRanker;
        this.categoryRankSumAggregator = categoryRankSumAggregator;
        this.overallRankSumAggregator = overallRankSumAggregator;
    }

    public DivisionStandings calculate(ScoringSnapshot snapshot) {
        Comparator<UUID> contestantOrder = snapshot.contestantOrder();
        Set<UUID> contestantIds = snapshot.contestants().stream()
                .map(ContestantRef::contestantId)
                .collect(Collectors.toSet());

        // category -> judge -> locked contestants; TreeMap keeps judge iteration stable
        Map<UUID, Map<UUID, Set<UUID>>> lockedByCategory = new HashMap<>();
        for (LockKey lock : snapshot.locks()) {
            if (!snapshot.judgeIds().contains(lock.judgeId()) || !contestantIds.contains(lock.contestantId())) {
                continue;
            }
            lockedByCategory
                    .computeIfAbsent(lock.categoryId(), ignored -> new TreeMap<>())
                    .computeIfAbsent(lock.judgeId(), ignored -> new HashSet<>())
                    .add(lock.contestantId());
        }

        Map<UUID, List<JudgeRank>> judgeRanksByCategory = new LinkedHashMap<>();
        Map<UUID, List<CategoryPlacement>> placementsByCategory = new LinkedHashMap<>();
        List<CategoryPlacement> allPlacements = new ArrayList<>();

        for (CategoryRef category : snapshot.categories()) {
            UUID categoryId = category.categoryId();
            List<JudgeRank> judgeRanks = new ArrayList<>();
            lockedByCategory.getOrDefault(categoryId, Map.of()).forEach((judgeId, locked) ->
                    judgeRanks.addAll(judgeCategoryRanker.rank(
                            judgeId,
                            categoryId,
                            snapshot.scores(),
                            locked,
                            contestantOrder
                    ))
            );

            List<CategoryPlacement> placements =
                    categoryRankSumAggregator.aggregate(categoryId, judgeRanks, contestantOrder);
            judgeRanksByCategory.put(categoryId, List.copyOf(judgeRanks));
            placementsByCategory.put(categoryId, placements);
            allPlacements.addAll(placements);
        }

        List<OverallPlacement> overall = overallRankSumAggregator.aggregate(allPlacements, contestantOrder);
        return new DivisionStandings(
                snapshot.division(),
                judgeRanksByCategory,
                placementsByCategory,
                overall
        );
    }
}
