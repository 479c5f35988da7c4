package com.tabulator.ranking;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Ranks the contestants one judge has locked in one category by that judge's summed weighted
 * score, highest first. Unlocked contestants receive no rank from the judge.
 */
@Component
public class JudgeCategoryRanker {

    public List<JudgeRank> rank(
            UUID judgeId,
            UUID categoryId,
            Collection<ScoreEntry> scores,
            Set<UUID> lockedContestantIds
    ) {
        return rank(judgeId, categoryId, scores, lockedContestantIds, Comparator.naturalOrder());
    }

    public List<JudgeRank> rank(
            UUID judgeId,
            UUID categoryId,
            Collection<ScoreEntry> scores,
            Set<UUID> lockedContestantIds,
            Comparator<UUID> contestantOrder
    ) {
        Map<UUID, BigDecimal> totals = new LinkedHashMap<>();
        for (UUID contestantId : lockedContestantIds) {
            totals.put(contestantId, BigDecimal.ZERO.setScale(WeightedScoreCalculator.SCORE_SCALE));
        }
        for (ScoreEntry score : scores) {
            if (!judgeId.equals(score.judgeId())
                    || !categoryId.equals(score.categoryId())
                    || !totals.containsKey(score.contestantId())) {
                continue;
            }
            totals.merge(score.contestantId(), score.weightedScore(), BigDecimal::add);
        }

        List<TieAveragingRanker.Ranked<Map.Entry<UUID, BigDecimal>>> ranked = TieAveragingRanker.rank(
                totals.entrySet(),
                Map.Entry::getValue,
                TieAveragingRanker.Direction.DESCENDING,
                Map.Entry.<UUID, BigDecimal>comparingByKey(contestantOrder)
        );

        return ranked.stream()
                .map(entry -> new JudgeRank(
                        judgeId,
                        categoryId,
                        entry.item().getKey(),
                        entry.item().getValue(),
                        entry.rank()
                ))
                .toList();
    }
}
