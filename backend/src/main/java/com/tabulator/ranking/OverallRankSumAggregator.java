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
 * Sums each contestant's category placements into total points and places contestants by
 * ascending total. Category weights play no part.
 */
@Component
public class OverallRankSumAggregator {

    public List<OverallPlacement> aggregate(Collection<CategoryPlacement> categoryPlacements) {
        return aggregate(categoryPlacements, Comparator.naturalOrder());
    }

    public List<OverallPlacement> aggregate(
            Collection<CategoryPlacement> categoryPlacements,
            Comparator<UUID> contestantOrder
    ) {
        Map<UUID, Points> points = new LinkedHashMap<>();
        for (CategoryPlacement placement : categoryPlacements) {
            points.merge(
                    placement.contestantId(),
                    new Points(placement.contestantId(), placement.placement(), 1),
                    Points::plus
            );
        }

        return TieAveragingRanker.rank(
                        points.values(),
                        Points::total,
                        TieAveragingRanker.Direction.ASCENDING,
                        Comparator.comparing(Points::contestantId, contestantOrder)
                ).stream()
                .map(entry -> new OverallPlacement(
                        entry.item().contestantId(),
                        entry.item().total(),
                        entry.item().categories(),
                        entry.rank()
                ))
                .toList();
    }

    private record Points(UUID contestantId, BigDecimal total, int categories) {
        Points plus(Points other) {
            return new Points(contestantId, total.add(other.total), categories + other.categories);
        }
    }
}
