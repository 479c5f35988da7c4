package com.tabulator.controller;

import com.tabulator.dto.InsightResponses;
import com.tabulator.model.Division;
import com.tabulator.service.InsightService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/insights/{division}")
public class InsightController {

    private final InsightService insightService;

    public InsightController(InsightService insightService) {
        this.insightService = insightService;
    }

    @GetMapping
    public ResponseEntity<InsightResponses.DivisionInsights> insights(@PathVariable Division division) {
        return ResponseEntity.ok(insightService.insights(division));
    }

    @GetMapping("/head-to-head")
    public ResponseEntity<InsightResponses.HeadToHeadView> headToHead(
            @PathVariable Division division,
            @RequestParam UUID contestantA,
            @RequestParam UUID contestantB
    ) {
        return ResponseEntity.ok(insightService.headToHead(division, contestantA, contestantB));
    }
}
