package com.tabulator.controller;

import com.tabulator.model.Division;
import com.tabulator.service.RankingExportService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ExportController.class)
class ExportControllerTest {

    private static final String OVERALL_CSV = """
            "division","contestantNumber","contestantName","totalPoints","categoriesCounted","placement","title"
            "MALE","4","Marco Diaz","6","6","1","Mister Campus"
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RankingExportService rankingExportService;

    @Test
    void overallExportIsCsvAttachment() throws Exception {
        when(rankingExportService.overallCsv(Division.MALE)).thenReturn(OVERALL_CSV);

        mockMvc.perform(get("/api/exports/{division}/overall.csv", "male"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("male-overall.csv")))
                .andExpect(content().string(OVERALL_CSV));
    }

    @Test
    void scoresExportWithoutDivisionCoversEveryJudge() throws Exception {
        when(rankingExportService.scoresCsv(null)).thenReturn("division,judgeUsername\n");

        mockMvc.perform(get("/api/exports/scores.csv"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("\"scores.csv\"")));
    }
}
