package com.tabulator.service;

import com.tabulator.dto.ScoringRequests;
import com.tabulator.dto.ScoringResponses;
import com.tabulator.ranking.WeightedScoreCalculator;
import com.tabulator.web.ScoringException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * The judge's submit action. Scores are written in one transaction and the lock in a second one;
 * when the lock step fails the stored scores stay visible and unlocked until the idempotent lock
 * endpoint is retried.
 */
@Service
public class SubmissionService {

    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);

    private final ScoreService scoreService;
    private final SubmissionLockService submissionLockService;
    private final WeightedScoreCalculator weightedScoreCalculator;

    public SubmissionService(
            ScoreService scoreService,
            SubmissionLockService submissionLockService,
            WeightedScoreCalculator weightedScoreCalculator
    ) {
        this.scoreService = scoreService;
        this.submissionLockService = submissionLockService;
        this.weightedScoreCalculator = weightedScoreCalculator;
    }

    public ScoringResponses.SubmissionResult submit(UUID judgeId, ScoringRequests.SubmitScoresRequest request) {
        List<ScoringResponses.ScoreRow> stored = scoreService.upsertScores(judgeId, request);

        try {
            submissionLockService.lock(judgeId, request.categoryId(), request.contestantId());
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Scores stored but lock step failed: judge={} category={} contestant={}",
                    judgeId, request.categoryId(), request.contestantId(), ex);
            throw ScoringException.incompleteSubmission(
                    "Scores were stored but the submission is not locked yet; retry the lock request",
                    ex
            );
        }

        List<BigDecimal> weighted = stored.stream()
                .map(ScoringResponses.ScoreRow::weightedScore)
                .toList();
        return new ScoringResponses.SubmissionResult(
                judgeId,
                request.contestantId(),
                request.categoryId(),
                weightedScoreCalculator.total(weighted),
                true,
                stored
        );
    }

    public ScoringResponses.LockState retryLock(UUID judgeId, ScoringRequests.LockRequest request) {
        scoreService.requireCompleteScores(judgeId, request.categoryId(), request.contestantId());
        return submissionLockService.lock(judgeId, request.categoryId(), request.contestantId());
    }
}
