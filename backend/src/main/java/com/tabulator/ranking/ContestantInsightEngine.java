package com.tabulator.ranking;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only analytics over computed standings: placement spread, strongest and weakest
 * category, distance to the leader, and two-contestant comparisons.
 */
@Component
public class ContestantInsightEngine {

    private static final int INSIGHT_SCALE = 2;

    public List<ContestantInsight> insights(DivisionStandings standings, List<CategoryRef> categories) {
        BigDecimal leaderPoints = standings.overall().stream()
                .map(OverallPlacement::totalPoints)
                .min(BigDecimal::compareTo)
                .orElse(BigDecimal.ZERO);

        List<ContestantInsight> insights = new ArrayList<>(standings.overall().size());
        for (OverallPlacement overall : standings.overall()) {
            insights.add(insightFor(overall, leaderPoints, standings, categories));
        }
        return List.copyOf(insights);
    }

    public HeadToHead headToHead(
            DivisionStandings standings,
            List<CategoryRef> categories,
            UUID contestantA,
            UUID contestantB
    ) {
        if (contestantA.equals(contestantB)) {
            throw new IllegalArgumentException("Head-to-head needs two different contestants");
        }

        List<UUID> wonByA = new ArrayList<>();
        List<UUID> wonByB = new ArrayList<>();
        List<UUID> tied = new ArrayList<>();
        for (CategoryRef category : categories) {
            Optional<CategoryPlacement> placementA = placementOf(standings, category.categoryId(), contestantA);
            Optional<CategoryPlacement> placementB = placementOf(standings, category.categoryId(), contestantB);
            if (placementA.isEmpty() || placementB.isEmpty()) {
                continue;
            }
            int comparison = placementA.get().placement().compareTo(placementB.get().placement());
            if (comparison < 0) {
                wonByA.add(category.categoryId());
            } else if (comparison > 0) {
                wonByB.add(category.categoryId());
            } else {
                tied.add(category.categoryId());
            }
        }

        Optional<OverallPlacement> overallA = standings.overallFor(contestantA);
        Optional<OverallPlacement> overallB = standings.overallFor(contestantB);
        return new HeadToHead(
                contestantA,
                contestantB,
                List.copyOf(wonByA),
                List.copyOf(wonByB),
                List.copyOf(tied),
                overallA.map(OverallPlacement::placement).orElse(null),
                overallB.map(OverallPlacement::placement).orElse(null),
                overallA.map(OverallPlacement::totalPoints).orElse(null),
                overallB.map(OverallPlacement::totalPoints).orElse(null),
                overallLeader(overallA, overallB)
        );
    }

    private ContestantInsight insightFor(
            OverallPlacement overall,
            BigDecimal leaderPoints,
            DivisionStandings standings,
            List<CategoryRef> categories
    ) {
        List<CategoryPlacement> placed = new ArrayList<>();
        for (CategoryRef category : categories) {
            placementOf(standings, category.categoryId(), overall.contestantId()).ifPresent(placed::add);
        }

        CategoryPlacement strongest = null;
        CategoryPlacement weakest = null;
        for (CategoryPlacement placement : placed) {
            if (strongest == null || placement.placement().compareTo(strongest.placement()) < 0) {
                strongest = placement;
            }
            if (weakest == null || placement.placement().compareTo(weakest.placement()) > 0) {
                weakest = placement;
            }
        }

        List<CategoryStanding> standingsByCategory = new ArrayList<>(placed.size());
        for (CategoryPlacement placement : placed) {
            standingsByCategory.add(new CategoryStanding(
                    placement.categoryId(),
                    placement.placement(),
                    placement.rankSum(),
                    placement == strongest,
                    placement == weakest
            ));
        }

        return new ContestantInsight(
                overall.contestantId(),
                overall.placement(),
                overall.totalPoints(),
                overall.totalPoints().subtract(leaderPoints),
                averageRank(placed),
                consistency(placed),
                strongest != null ? strongest.categoryId() : null,
                weakest != null ? weakest.categoryId() : null,
                List.copyOf(standingsByCategory)
        );
    }

    private static Optional<CategoryPlacement> placementOf(
            DivisionStandings standings,
            UUID categoryId,
            UUID contestantId
    ) {
        return standings.placementsFor(categoryId).stream()
                .filter(placement -> placement.contestantId().equals(contestantId))
                .findFirst();
    }

    private static BigDecimal averageRank(List<CategoryPlacement> placed) {
        if (placed.isEmpty()) {
            return BigDecimal.ZERO.setScale(INSIGHT_SCALE);
        }
        BigDecimal sum = placed.stream()
                .map(CategoryPlacement::placement)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(placed.size()), INSIGHT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Population standard deviation of category placements; lower means steadier.
     */
    static BigDecimal consistency(List<CategoryPlacement> placed) {
        if (placed.size() < 2) {
            return BigDecimal.ZERO.setScale(INSIGHT_SCALE);
        }
        double mean = placed.stream()
                .mapToDouble(placement -> placement.placement().doubleValue())
                .average()
                .orElse(0.0);
        double variance = placed.stream()
                .mapToDouble(placement -> Math.pow(placement.placement().doubleValue() - mean, 2))
                .sum() / placed.size();
        return BigDecimal.valueOf(Math.sqrt(variance)).setScale(INSIGHT_SCALE, RoundingMode.HALF_UP);
    }

    private static UUID overallLeader(Optional<OverallPlacement> a, Optional<OverallPlacement> b) {
        if (a.isPresent() && b.isPresent()) {
            int comparison = a.get().placement().compareTo(b.get().placement());
            if (comparison == 0) {
                return null;
            }
            return comparison < 0 ? a.get().contestantId() : b.get().contestantId();
        }
        if (a.isPresent()) {
            return a.get().contestantId();
        }
        return b.map(OverallPlacement::contestantId).orElse(null);
    }
}
