package com.tabulator.controller;

import com.tabulator.dto.RosterResponses;
import com.tabulator.model.Division;
import com.tabulator.service.RosterService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
public class RosterController {

    private final RosterService rosterService;

    public RosterController(RosterService rosterService) {
        this.rosterService = rosterService;
    }

    @GetMapping("/categories")
    public ResponseEntity<List<RosterResponses.CategorySummary>> listCategories() {
        return ResponseEntity.ok(rosterService.listCategories());
    }

    @GetMapping("/categories/{categoryId}/criteria")
    public ResponseEntity<List<RosterResponses.CriterionSummary>> listCriteria(@PathVariable UUID categoryId) {
        return ResponseEntity.ok(rosterService.listCriteria(categoryId));
    }

    @GetMapping("/contestants")
    public ResponseEntity<List<RosterResponses.ContestantSummary>> listContestants(
            @RequestParam(required = false) Division division
    ) {
        return ResponseEntity.ok(rosterService.listContestants(division));
    }

    @GetMapping("/judges")
    public ResponseEntity<List<RosterResponses.JudgeSummary>> listJudges(
            @RequestParam(required = false) Division division
    ) {
        return ResponseEntity.ok(rosterService.listJudges(division));
    }
}
