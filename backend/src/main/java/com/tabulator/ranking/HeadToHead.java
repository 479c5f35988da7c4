package com.tabulator.ranking;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Category-by-category comparison of two contestants. {@code overallLeaderId} is null when the
 * overall placements are equal or neither contestant is placed.
 */
public record HeadToHead(
        UUID contestantA,
        UUID contestantB,
        List<UUID> categoriesWonByA,
        List<UUID> categoriesWonByB,
        List<UUID> tiedCategories,
        BigDecimal overallPlacementA,
        BigDecimal overallPlacementB,
        BigDecimal totalPointsA,
        BigDecimal totalPointsB,
        UUID overallLeaderId
) {
}
