package com.tabulator.ranking;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Sums each contestant's per-judge ranks within one category and places contestants by
 * ascending rank-sum. A judge who did not rank a contestant contributes nothing.
 */
@Component
public class CategoryRankSumAggregator {

    public List<CategoryPlacement> aggregate(UUID categoryId, Collection<JudgeRank> judgeRanks) {
        return aggregate(categoryId, judgeRanks, Comparator.naturalOrder());
    }

    public List<CategoryPlacement> aggregate(
            UUID categoryId,
            Collection<JudgeRank> judgeRanks,
            Comparator<UUID> contestantOrder
    ) {
        Map<UUID, RankSum> sums = new LinkedHashMap<>();
        for (JudgeRank judgeRank : judgeRanks) {
            if (!categoryId.equals(judgeRank.categoryId())) {
                continue;
            }
            sums.merge(
                    judgeRank.contestantId(),
                    new RankSum(judgeRank.contestantId(), judgeRank.rank(), 1),
                    RankSum::plus
            );
        }

        return TieAveragingRanker.rank(
                        sums.values(),
                        RankSum::sum,
                        TieAveragingRanker.Direction.ASCENDING,
                        Comparator.comparing(RankSum::contestantId, contestantOrder)
                ).stream()
                .map(entry -> new CategoryPlacement(
                        categoryId,
                        entry.item().contestantId(),
                        entry.item().sum(),
                        entry.item().judgeCount(),
                        entry.rank()
                ))
                .toList();
    }

    private record RankSum(UUID contestantId, BigDecimal sum, int judgeCount) {
        RankSum plus(RankSum other) {
            return new RankSum(contestantId, sum.add(other.sum), judgeCount + other.judgeCount);
        }
    }
}
