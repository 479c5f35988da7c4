package com.tabulator.controller;

import com.tabulator.dto.ScoringRequests;
import com.tabulator.dto.ScoringResponses;
import com.tabulator.service.ScoreService;
import com.tabulator.service.SubmissionLockService;
import com.tabulator.service.SubmissionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Judge-facing scoring actions: submit a criterion set, retry a lock, read back own scores and locks.
 */
@RestController
@RequestMapping("/api/judges/{judgeId}")
public class JudgeScoringController {

    private final SubmissionService submissionService;
    private final ScoreService scoreService;
    private final SubmissionLockService submissionLockService;

    public JudgeScoringController(
            SubmissionService submissionService,
            ScoreService scoreService,
            SubmissionLockService submissionLockService
    ) {
        this.submissionService = submissionService;
        this.scoreService = scoreService;
        this.submissionLockService = submissionLockService;
    }

    @PostMapping("/submissions")
    public ResponseEntity<ScoringResponses.SubmissionResult> submit(
            @PathVariable UUID judgeId,
            @Valid @RequestBody ScoringRequests.SubmitScoresRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(submissionService.submit(judgeId, request));
    }

    @PostMapping("/locks")
    public ResponseEntity<ScoringResponses.LockState> lock(
            @PathVariable UUID judgeId,
            @Valid @RequestBody ScoringRequests.LockRequest request
    ) {
        ScoringResponses.LockState state = submissionService.retryLock(judgeId, request);
        return ResponseEntity.status(state.created() ? HttpStatus.CREATED : HttpStatus.OK).body(state);
    }

    @GetMapping("/locks")
    public ResponseEntity<List<ScoringResponses.LockSummary>> listLocks(
            @PathVariable UUID judgeId,
            @RequestParam(required = false) UUID categoryId
    ) {
        return ResponseEntity.ok(submissionLockService.listLocks(judgeId, categoryId));
    }

    @GetMapping("/scores")
    public ResponseEntity<List<ScoringResponses.ScoreRow>> listScores(
            @PathVariable UUID judgeId,
            @RequestParam(required = false) UUID categoryId
    ) {
        return ResponseEntity.ok(scoreService.listScores(judgeId, categoryId));
    }
}
