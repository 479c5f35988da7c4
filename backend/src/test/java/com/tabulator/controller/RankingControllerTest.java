package com.tabulator.controller;

import com.tabulator.dto.RankingResponses;
import com.tabulator.model.Division;
import com.tabulator.service.RankingService;
import com.tabulator.web.ScoringException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RankingController.class)
class RankingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RankingService rankingService;

    @Test
    void overallAcceptsLowercaseDivision() throws Exception {
        UUID contestantId = UUID.fromString("00000000-0000-0000-0000-000000000c02");
        when(rankingService.overall(Division.FEMALE)).thenReturn(new RankingResponses.OverallRanking(
                "FEMALE",
                OffsetDateTime.now(),
                List.of(new RankingResponses.OverallRankingRow(
                        contestantId, 2, "Bea Santos", new BigDecimal("3.0"), 2, new BigDecimal("1.0"), "Miss Campus"))
        ));

        mockMvc.perform(get("/api/rankings/{division}/overall", "female"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.division").value("FEMALE"))
                .andExpect(jsonPath("$.rows[0].contestantId").value(contestantId.toString()))
                .andExpect(jsonPath("$.rows[0].title").value("Miss Campus"))
                .andExpect(jsonPath("$.rows[0].placement").value(1.0));
    }

    @Test
    void unknownDivisionReturnsBadRequest() throws Exception {
        mockMvc.perform(get("/api/rankings/{division}/overall", "juniors"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_request"));

        verify(rankingService, never()).overall(any());
    }

    @Test
    void unknownCategoryReturnsNotFound() throws Exception {
        UUID categoryId = UUID.randomUUID();
        when(rankingService.category(Division.MALE, categoryId))
                .thenThrow(ScoringException.notFound("Category not found: " + categoryId));

        mockMvc.perform(get("/api/rankings/{division}/categories/{categoryId}", "MALE", categoryId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("not_found"));
    }
}
