package com.tabulator.service;

import com.tabulator.config.TabulatorProperties;
import com.tabulator.dto.InsightResponses;
import com.tabulator.model.Division;
import com.tabulator.ranking.ContestantInsightEngine;
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
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InsightServiceTest {

    @Mock
    private ScoringSnapshotService scoringSnapshotService;

    private InsightService insightService;

    @BeforeEach
    void setUp() {
        TabulatorProperties properties = new TabulatorProperties();
        properties.getTitles().getTitleholders().put(Division.FEMALE, "Miss Campus");
        insightService = new InsightService(
                scoringSnapshotService,
                ScoringFixtures.calculator(),
                new ContestantInsightEngine(),
                properties
        );
    }

    @Test
    void insights_reportStrongestAndWeakestBySlug() {
        when(scoringSnapshotService.load(Division.FEMALE)).thenReturn(ScoringFixtures.fullSnapshot());

        InsightResponses.DivisionInsights insights = insightService.insights(Division.FEMALE);

        assertEquals(3, insights.contestants().size());
        InsightResponses.ContestantInsightView leader = insights.contestants().get(0);
        assertEquals(C2, leader.contestantId());
        assertEquals("Miss Campus", leader.title());
        assertEquals(0, BigDecimal.ZERO.compareTo(leader.gapToLeader()));

        InsightResponses.ContestantInsightView runnerUp = insights.contestants().get(1);
        assertEquals(C1, runnerUp.contestantId());
        assertEquals("runway", runnerUp.strongestCategory());
        assertEquals("speech", runnerUp.weakestCategory());
        assertEquals(0, BigDecimal.ONE.compareTo(runnerUp.gapToLeader()));
        assertEquals(2, runnerUp.categoryStandings().size());
    }

    @Test
    void headToHead_splitsCategoriesBetweenContestants() {
        when(scoringSnapshotService.load(Division.FEMALE)).thenReturn(ScoringFixtures.fullSnapshot());

        InsightResponses.HeadToHeadView view = insightService.headToHead(Division.FEMALE, C1, C2);

        assertEquals(List.of("runway"), view.categoriesWonByA());
        assertEquals(List.of("speech"), view.categoriesWonByB());
        assertEquals(List.of(), view.tiedCategories());
        assertEquals(C2, view.overallLeaderId());
    }

    @Test
    void headToHead_sameContestantIsInvalidRequest() {
        ScoringException ex = assertThrows(ScoringException.class,
                () -> insightService.headToHead(Division.FEMALE, C1, C1));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatus());
        verify(scoringSnapshotService, never()).load(any());
    }

    @Test
    void headToHead_unknownContestantIsNotFound() {
        when(scoringSnapshotService.load(Division.FEMALE)).thenReturn(ScoringFixtures.fullSnapshot());

        ScoringException ex = assertThrows(ScoringException.class,
                () -> insightService.headToHead(Division.FEMALE, C1, UUID.randomUUID()));

        assertEquals(HttpStatus.NOT_FOUND, ex.getStatus());
    }
}
