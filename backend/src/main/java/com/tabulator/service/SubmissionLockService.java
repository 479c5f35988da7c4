package com.tabulator.service;

import com.tabulator.dto.ScoringResponses;
import com.tabulator.mapper.TabulatorResponseMapper;
import com.tabulator.model.Judge;
import com.tabulator.model.SubmissionLock;
import com.tabulator.repository.JudgeRepository;
import com.tabulator.repository.SubmissionLockRepository;
import com.tabulator.web.ScoringException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Owns the (judge, category, contestant) lock set. Locking is idempotent; unlocking is reserved for
 * administrators. Every mutation first takes the judge's row lock so it serializes with score writes.
 */
@Service
public class SubmissionLockService {

    private static final Logger log = LoggerFactory.getLogger(SubmissionLockService.class);

    private final SubmissionLockRepository submissionLockRepository;
    private final JudgeRepository judgeRepository;
    private final TabulatorResponseMapper tabulatorResponseMapper;
    private final ApplicationEventPublisher eventPublisher;

    public SubmissionLockService(
            SubmissionLockRepository submissionLockRepository,
            JudgeRepository judgeRepository,
            TabulatorResponseMapper tabulatorResponseMapper,
            ApplicationEventPublisher eventPublisher
    ) {
        this.submissionLockRepository = submissionLockRepository;
        this.judgeRepository = judgeRepository;
        this.tabulatorResponseMapper = tabulatorResponseMapper;
        this.eventPublisher = eventPublisher;
    }

    @Transactional(readOnly = true)
    public boolean isLocked(UUID judgeId, UUID categoryId, UUID contestantId) {
        return submissionLockRepository.existsByJudgeIdAndCategoryIdAndContestantId(judgeId, categoryId, contestantId);
    }

    @Transactional
    public ScoringResponses.LockState lock(UUID judgeId, UUID categoryId, UUID contestantId) {
        Judge judge = lockJudge(judgeId);

        int inserted = submissionLockRepository.insertIfAbsent(UUID.randomUUID(), judgeId, categoryId, contestantId);
        boolean created = inserted > 0;
        if (created) {
            log.info("Submission locked: judge={} category={} contestant={}", judgeId, categoryId, contestantId);
            eventPublisher.publishEvent(event(ScoringChangedEvent.Change.LOCK_CREATED, judge, categoryId, contestantId));
        } else {
            log.debug("Submission already locked: judge={} category={} contestant={}",
                    judgeId, categoryId, contestantId);
        }
        return new ScoringResponses.LockState(judgeId, categoryId, contestantId, true, created);
    }

    @Transactional
    public ScoringResponses.UnlockResult unlock(UUID judgeId, UUID categoryId, UUID contestantId) {
        Judge judge = lockJudge(judgeId);

        int deleted = submissionLockRepository.deleteByNaturalKey(judgeId, categoryId, contestantId);
        boolean removed = deleted > 0;
        if (removed) {
            log.info("Submission unlocked by administrator: judge={} category={} contestant={}",
                    judgeId, categoryId, contestantId);
            eventPublisher.publishEvent(event(ScoringChangedEvent.Change.LOCK_REMOVED, judge, categoryId, contestantId));
        } else {
            log.info("No submission lock to remove: judge={} category={} contestant={}",
                    judgeId, categoryId, contestantId);
        }
        return new ScoringResponses.UnlockResult(judgeId, categoryId, contestantId, removed);
    }

    @Transactional(readOnly = true)
    public List<ScoringResponses.LockSummary> listLocks(UUID judgeId, UUID categoryId) {
        if (!judgeRepository.existsById(judgeId)) {
            throw ScoringException.notFound("Judge not found: " + judgeId);
        }
        List<SubmissionLock> locks = categoryId == null
                ? submissionLockRepository.findByJudgeId(judgeId)
                : submissionLockRepository.findByJudgeIdAndCategoryId(judgeId, categoryId);
        return tabulatorResponseMapper.toLockSummaries(locks);
    }

    private Judge lockJudge(UUID judgeId) {
        return judgeRepository.findByJudgeIdForUpdate(judgeId)
                .orElseThrow(() -> ScoringException.notFound("Judge not found: " + judgeId));
    }

    private static ScoringChangedEvent event(
            ScoringChangedEvent.Change change,
            Judge judge,
            UUID categoryId,
            UUID contestantId
    ) {
        return new ScoringChangedEvent(
                change,
                judge.getDivision(),
                judge.getJudgeId(),
                judge.getFullName(),
                categoryId,
                contestantId,
                0,
                OffsetDateTime.now()
        );
    }
}
