package com.tabulator.controller;

import com.tabulator.dto.RosterRequests;
import com.tabulator.dto.RosterResponses;
import com.tabulator.dto.ScoringRequests;
import com.tabulator.dto.ScoringResponses;
import com.tabulator.service.RosterService;
import com.tabulator.service.ScoreService;
import com.tabulator.service.SubmissionLockService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Administrator routes. Access is enforced by the admin token interceptor.
 */
@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final SubmissionLockService submissionLockService;
    private final RosterService rosterService;
    private final ScoreService scoreService;

    public AdminController(
            SubmissionLockService submissionLockService,
            RosterService rosterService,
            ScoreService scoreService
    ) {
        this.submissionLockService = submissionLockService;
        this.rosterService = rosterService;
        this.scoreService = scoreService;
    }

    @DeleteMapping("/locks")
    public ResponseEntity<ScoringResponses.UnlockResult> unlock(
            @Valid @RequestBody ScoringRequests.UnlockRequest request
    ) {
        return ResponseEntity.ok(submissionLockService.unlock(
                request.judgeId(),
                request.categoryId(),
                request.contestantId()
        ));
    }

    @PostMapping("/contestants")
    public ResponseEntity<RosterResponses.ContestantSummary> createContestant(
            @Valid @RequestBody RosterRequests.CreateContestantRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(rosterService.createContestant(request));
    }

    @PostMapping("/judges")
    public ResponseEntity<RosterResponses.JudgeSummary> createJudge(
            @Valid @RequestBody RosterRequests.CreateJudgeRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(rosterService.createJudge(request));
    }

    @PatchMapping("/judges/{judgeId}")
    public ResponseEntity<RosterResponses.JudgeSummary> updateJudge(
            @PathVariable UUID judgeId,
            @Valid @RequestBody RosterRequests.UpdateJudgeRequest request
    ) {
        return ResponseEntity.ok(rosterService.updateJudge(judgeId, request));
    }

    @GetMapping("/score-history")
    public ResponseEntity<List<ScoringResponses.ScoreHistoryEntry>> scoreHistory(
            @RequestParam(required = false) UUID judgeId,
            @RequestParam(required = false) UUID contestantId
    ) {
        return ResponseEntity.ok(scoreService.listHistory(judgeId, contestantId));
    }
}
