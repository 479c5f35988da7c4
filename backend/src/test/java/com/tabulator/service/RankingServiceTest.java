package com.tabulator.service;

import com.tabulator.config.TabulatorProperties;
import com.tabulator.dto.RankingResponses;
import com.tabulator.model.Division;
import com.tabulator.ranking.ScoringFixtures;
import com.tabulator.web.ScoringException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static com.tabulator.ranking.ScoringFixtures.C1;
import static com.tabulator.ranking.ScoringFixtures.C2;
import static com.tabulator.ranking.ScoringFixtures.C3;
import static com.tabulator.ranking.ScoringFixtures.J2;
import static com.tabulator.ranking.ScoringFixtures.RUNWAY;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RankingServiceTest {

    @Mock
    private ScoringSnapshotService scoringSnapshotService;

    private RankingService rankingService;

    @BeforeEach
    void setUp() {
        TabulatorProperties properties = new TabulatorProperties();
        properties.getTitles().getTitleholders().put(Division.FEMALE, "Miss Campus");
        rankingService = new RankingService(scoringSnapshotService, ScoringFixtures.calculator(), properties);
    }

    @Test
    void overall_ordersByPlacementAndAssignsTitles() {
        when(scoringSnapshotService.load(Division.FEMALE)).thenReturn(ScoringFixtures.fullSnapshot());

        RankingResponses.OverallRanking ranking = rankingService.overall(Division.FEMALE);

        assertEquals("FEMALE", ranking.division());
        List<RankingResponses.OverallRankingRow> rows = ranking.rows();
        assertEquals(List.of(C2, C1, C3), rows.stream().map(RankingResponses.OverallRankingRow::contestantId).toList());
        assertEquals("Miss Campus", rows.get(0).title());
        assertEquals("1st Runner Up", rows.get(1).title());
        assertEquals("2nd Runner Up", rows.get(2).title());
        assertEquals("Bea Santos", rows.get(0).contestantName());
        assertEquals(0, new BigDecimal("3").compareTo(rows.get(0).totalPoints()));
    }

    @Test
    void overall_divisionWithoutConfiguredTitleUsesDefault() {
        when(scoringSnapshotService.load(Division.MALE)).thenReturn(ScoringFixtures.fullSnapshot());

        RankingResponses.OverallRanking ranking = rankingService.overall(Division.MALE);

        assertEquals("Winner", ranking.rows().get(0).title());
    }

    @Test
    void categories_followCategorySortOrder() {
        when(scoringSnapshotService.load(Division.FEMALE)).thenReturn(ScoringFixtures.fullSnapshot());

        List<RankingResponses.CategoryRanking> rankings = rankingService.categories(Division.FEMALE);

        assertEquals(List.of("runway", "speech"),
                rankings.stream().map(RankingResponses.CategoryRanking::categorySlug).toList());
        RankingResponses.CategoryRankingRow leader = rankings.get(0).rows().get(0);
        assertEquals(C1, leader.contestantId());
        assertEquals(0, new BigDecimal("2.5").compareTo(leader.rankSum()));
        assertEquals(2, leader.judgeCount());
    }

    @Test
    void category_unknownCategoryIsNotFound() {
        when(scoringSnapshotService.load(Division.FEMALE)).thenReturn(ScoringFixtures.fullSnapshot());

        ScoringException ex = assertThrows(ScoringException.class,
                () -> rankingService.category(Division.FEMALE, UUID.randomUUID()));

        assertEquals(HttpStatus.NOT_FOUND, ex.getStatus());
    }

    @Test
    void judgeCategory_averagesTiedTotals() {
        when(scoringSnapshotService.load(Division.FEMALE)).thenReturn(ScoringFixtures.fullSnapshot());

        RankingResponses.JudgeCategoryRanking ranking = rankingService.judgeCategory(Division.FEMALE, J2, RUNWAY);

        assertEquals("runway", ranking.categorySlug());
        assertEquals(3, ranking.rows().size());
        assertEquals(new BigDecimal("1.5"), ranking.rows().get(0).rank());
        assertEquals(new BigDecimal("1.5"), ranking.rows().get(1).rank());
        assertEquals(new BigDecimal("3.0"), ranking.rows().get(2).rank());
    }

    @Test
    void judgeCategory_judgeOutsideDivisionIsNotFound() {
        when(scoringSnapshotService.load(Division.FEMALE)).thenReturn(ScoringFixtures.fullSnapshot());

        assertThrows(ScoringException.class,
                () -> rankingService.judgeCategory(Division.FEMALE, UUID.randomUUID(), RUNWAY));
    }
}
