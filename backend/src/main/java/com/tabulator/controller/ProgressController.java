package com.tabulator.controller;

import com.tabulator.dto.ActivityResponses;
import com.tabulator.dto.ProgressResponses;
import com.tabulator.model.Division;
import com.tabulator.service.ActivityLogService;
import com.tabulator.service.ScoringProgressService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class ProgressController {

    private final ScoringProgressService scoringProgressService;
    private final ActivityLogService activityLogService;

    public ProgressController(ScoringProgressService scoringProgressService, ActivityLogService activityLogService) {
        this.scoringProgressService = scoringProgressService;
        this.activityLogService = activityLogService;
    }

    @GetMapping("/progress")
    public ResponseEntity<ProgressResponses.ScoringProgress> progress(
            @RequestParam(required = false) Division division
    ) {
        return ResponseEntity.ok(scoringProgressService.progress(division));
    }

    @GetMapping("/activity")
    public ResponseEntity<List<ActivityResponses.ActivityEntry>> activity(
            @RequestParam(required = false) Integer limit
    ) {
        return ResponseEntity.ok(activityLogService.recent(limit));
    }
}
