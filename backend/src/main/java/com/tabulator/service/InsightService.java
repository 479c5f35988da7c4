package com.tabulator.service;

import com.tabulator.config.TabulatorProperties;
import com.tabulator.dto.InsightResponses;
import com.tabulator.model.Division;
import com.tabulator.ranking.CategoryRef;
import com.tabulator.ranking.CategoryStanding;
import com.tabulator.ranking.ContestantInsight;
import com.tabulator.ranking.ContestantInsightEngine;
import com.tabulator.ranking.ContestantRef;
import com.tabulator.ranking.DivisionStandings;
import com.tabulator.ranking.DivisionStandingsCalculator;
import com.tabulator.ranking.HeadToHead;
import com.tabulator.ranking.PlacementTitles;
import com.tabulator.ranking.ScoringSnapshot;
import com.tabulator.web.ScoringException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class InsightService {

    private final ScoringSnapshotService scoringSnapshotService;
    private final DivisionStandingsCalculator divisionStandingsCalculator;
    private final ContestantInsightEngine contestantInsightEngine;
    private final TabulatorProperties tabulatorProperties;

    public InsightService(
            ScoringSnapshotService scoringSnapshotService,
            DivisionStandingsCalculator divisionStandingsCalculator,
            ContestantInsightEngine contestantInsightEngine,
            TabulatorProperties tabulatorProperties
    ) {
        this.scoringSnapshotService = scoringSnapshotService;
        this.divisionStandingsCalculator = divisionStandingsCalculator;
        this.contestantInsightEngine = contestantInsightEngine;
        this.tabulatorProperties = tabulatorProperties;
    }

    @Transactional(readOnly = true)
    public InsightResponses.DivisionInsights insights(Division division) {
        ScoringSnapshot snapshot = scoringSnapshotService.load(division);
        DivisionStandings standings = divisionStandingsCalculator.calculate(snapshot);
        Map<UUID, CategoryRef> categories = categoriesById(snapshot);
        Map<UUID, ContestantRef> contestants = snapshot.contestants().stream()
                .collect(Collectors.toMap(ContestantRef::contestantId, Function.identity()));
        String titleholder = tabulatorProperties.getTitles().titleholderFor(division);

        List<InsightResponses.ContestantInsightView> views =
                contestantInsightEngine.insights(standings, snapshot.categories()).stream()
                        .map(insight -> toView(insight, contestants.get(insight.contestantId()), categories,
                                titleholder))
                        .toList();
        return new InsightResponses.DivisionInsights(division.name(), views);
    }

    @Transactional(readOnly = true)
    public InsightResponses.HeadToHeadView headToHead(Division division, UUID contestantA, UUID contestantB) {
        if (contestantA.equals(contestantB)) {
            throw ScoringException.invalidRequest("A contestant cannot be compared with itself");
        }
        ScoringSnapshot snapshot = scoringSnapshotService.load(division);
        Set<UUID> known = snapshot.contestants().stream()
                .map(ContestantRef::contestantId)
                .collect(Collectors.toSet());
        for (UUID contestantId : List.of(contestantA, contestantB)) {
            if (!known.contains(contestantId)) {
                throw ScoringException.notFound("Contestant " + contestantId + " is not an active " + division
                        + " contestant");
            }
        }

        DivisionStandings standings = divisionStandingsCalculator.calculate(snapshot);
        HeadToHead comparison =
                contestantInsightEngine.headToHead(standings, snapshot.categories(), contestantA, contestantB);
        Map<UUID, CategoryRef> categories = categoriesById(snapshot);
        return new InsightResponses.HeadToHeadView(
                division.name(),
                comparison.contestantA(),
                comparison.contestantB(),
                slugs(comparison.categoriesWonByA(), categories),
                slugs(comparison.categoriesWonByB(), categories),
                slugs(comparison.tiedCategories(), categories),
                comparison.overallPlacementA(),
                comparison.overallPlacementB(),
                comparison.totalPointsA(),
                comparison.totalPointsB(),
                comparison.overallLeaderId()
        );
    }

    private static Map<UUID, CategoryRef> categoriesById(ScoringSnapshot snapshot) {
        return snapshot.categories().stream()
                .collect(Collectors.toMap(CategoryRef::categoryId, Function.identity()));
    }

    private static List<String> slugs(List<UUID> categoryIds, Map<UUID, CategoryRef> categories) {
        return categoryIds.stream()
                .map(categoryId -> categories.get(categoryId).slug())
                .toList();
    }

    private static String slugOf(UUID categoryId, Map<UUID, CategoryRef> categories) {
        return categoryId != null ? categories.get(categoryId).slug() : null;
    }

    private static InsightResponses.ContestantInsightView toView(
            ContestantInsight insight,
            ContestantRef contestant,
            Map<UUID, CategoryRef> categories,
            String titleholder
    ) {
        List<InsightResponses.CategoryStandingView> standings = insight.categoryStandings().stream()
                .map(standing -> toStandingView(standing, categories.get(standing.categoryId())))
                .toList();
        return new InsightResponses.ContestantInsightView(
                insight.contestantId(),
                contestant.number(),
                contestant.fullName(),
                insight.overallPlacement(),
                PlacementTitles.titleFor(insight.overallPlacement(), titleholder),
                insight.totalPoints(),
                insight.gapToLeader(),
                insight.averageRank(),
                insight.consistency(),
                slugOf(insight.strongestCategoryId(), categories),
                slugOf(insight.weakestCategoryId(), categories),
                standings
        );
    }

    private static InsightResponses.CategoryStandingView toStandingView(CategoryStanding standing, CategoryRef category) {
        return new InsightResponses.CategoryStandingView(
                standing.categoryId(),
                category.slug(),
                category.label(),
                standing.placement(),
                standing.rankSum(),
                standing.strongest(),
                standing.weakest()
        );
    }
}
