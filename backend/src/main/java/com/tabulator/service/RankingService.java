package com.tabulator.service;

import com.tabulator.config.TabulatorProperties;
import com.tabulator.dto.RankingResponses;
import com.tabulator.model.Division;
import com.tabulator.ranking.CategoryPlacement;
import com.tabulator.ranking.CategoryRef;
import com.tabulator.ranking.ContestantRef;
import com.tabulator.ranking.DivisionStandings;
import com.tabulator.ranking.DivisionStandingsCalculator;
import com.tabulator.ranking.JudgeRank;
import com.tabulator.ranking.OverallPlacement;
import com.tabulator.ranking.PlacementTitles;
import com.tabulator.ranking.ScoringSnapshot;
import com.tabulator.web.ScoringException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Recomputes standings from a fresh snapshot on every call; nothing is cached between requests.
 */
@Service
public class RankingService {

    private final ScoringSnapshotService scoringSnapshotService;
    private final DivisionStandingsCalculator divisionStandingsCalculator;
    private final TabulatorProperties tabulatorProperties;

    public RankingService(
            ScoringSnapshotService scoringSnapshotService,
            DivisionStandingsCalculator divisionStandingsCalculator,
            TabulatorProperties tabulatorProperties
    ) {
        this.scoringSnapshotService = scoringSnapshotService;
        this.divisionStandingsCalculator = divisionStandingsCalculator;
        this.tabulatorProperties = tabulatorProperties;
    }

    @Transactional(readOnly = true)
    public RankingResponses.OverallRanking overall(Division division) {
        ScoringSnapshot snapshot = scoringSnapshotService.load(division);
        DivisionStandings standings = divisionStandingsCalculator.calculate(snapshot);
        Map<UUID, ContestantRef> contestants = contestantsById(snapshot);
        String titleholder = tabulatorProperties.getTitles().titleholderFor(division);

        List<RankingResponses.OverallRankingRow> rows = standings.overall().stream()
                .map(placement -> toOverallRow(placement, contestants.get(placement.contestantId()), titleholder))
                .toList();
        return new RankingResponses.OverallRanking(division.name(), OffsetDateTime.now(), rows);
    }

    @Transactional(readOnly = true)
    public List<RankingResponses.CategoryRanking> categories(Division division) {
        ScoringSnapshot snapshot = scoringSnapshotService.load(division);
        DivisionStandings standings = divisionStandingsCalculator.calculate(snapshot);
        Map<UUID, ContestantRef> contestants = contestantsById(snapshot);

        return snapshot.categories().stream()
                .map(category -> toCategoryRanking(division, category, standings.placementsFor(category.categoryId()),
                        contestants))
                .toList();
    }

    @Transactional(readOnly = true)
    public RankingResponses.CategoryRanking category(Division division, UUID categoryId) {
        ScoringSnapshot snapshot = scoringSnapshotService.load(division);
        CategoryRef category = requireCategory(snapshot, categoryId);
        DivisionStandings standings = divisionStandingsCalculator.calculate(snapshot);
        return toCategoryRanking(division, category, standings.placementsFor(categoryId), contestantsById(snapshot));
    }

    @Transactional(readOnly = true)
    public RankingResponses.JudgeCategoryRanking judgeCategory(Division division, UUID judgeId, UUID categoryId) {
        ScoringSnapshot snapshot = scoringSnapshotService.load(division);
        CategoryRef category = requireCategory(snapshot, categoryId);
        if (!snapshot.judgeIds().contains(judgeId)) {
            throw ScoringException.notFound("Judge " + judgeId + " is not an active " + division + " judge");
        }
        DivisionStandings standings = divisionStandingsCalculator.calculate(snapshot);
        Map<UUID, ContestantRef> contestants = contestantsById(snapshot);

        List<RankingResponses.JudgeRankRow> rows = standings.judgeRanksFor(judgeId, categoryId).stream()
                .map(rank -> toJudgeRankRow(rank, contestants.get(rank.contestantId())))
                .toList();
        return new RankingResponses.JudgeCategoryRanking(division.name(), judgeId, categoryId, category.slug(), rows);
    }

    private static CategoryRef requireCategory(ScoringSnapshot snapshot, UUID categoryId) {
        return snapshot.categories().stream()
                .filter(category -> category.categoryId().equals(categoryId))
                .findFirst()
                .orElseThrow(() -> ScoringException.notFound("Category not found: " + categoryId));
    }

    private static Map<UUID, ContestantRef> contestantsById(ScoringSnapshot snapshot) {
        return snapshot.contestants().stream()
                .collect(Collectors.toMap(ContestantRef::contestantId, Function.identity()));
    }

    private static RankingResponses.CategoryRanking toCategoryRanking(
            Division division,
            CategoryRef category,
            List<CategoryPlacement> placements,
            Map<UUID, ContestantRef> contestants
    ) {
        List<RankingResponses.CategoryRankingRow> rows = placements.stream()
                .map(placement -> {
                    ContestantRef contestant = contestants.get(placement.contestantId());
                    return new RankingResponses.CategoryRankingRow(
                            placement.contestantId(),
                            contestant.number(),
                            contestant.fullName(),
                            placement.rankSum(),
                            placement.judgeCount(),
                            placement.placement()
                    );
                })
                .toList();
        return new RankingResponses.CategoryRanking(
                division.name(),
                category.categoryId(),
                category.slug(),
                category.label(),
                rows
        );
    }

    private static RankingResponses.OverallRankingRow toOverallRow(
            OverallPlacement placement,
            ContestantRef contestant,
            String titleholder
    ) {
        return new RankingResponses.OverallRankingRow(
                placement.contestantId(),
                contestant.number(),
                contestant.fullName(),
                placement.totalPoints(),
                placement.categoriesCounted(),
                placement.placement(),
                PlacementTitles.titleFor(placement.placement(), titleholder)
        );
    }

    private static RankingResponses.JudgeRankRow toJudgeRankRow(JudgeRank rank, ContestantRef contestant) {
        return new RankingResponses.JudgeRankRow(
                rank.judgeId(),
                rank.categoryId(),
                rank.contestantId(),
                contestant.number(),
                contestant.fullName(),
                rank.totalScore(),
                rank.rank()
        );
    }
}
