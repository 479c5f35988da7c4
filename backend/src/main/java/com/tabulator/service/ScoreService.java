package com.tabulator.service;

import com.tabulator.dto.ScoringRequests;
import com.tabulator.dto.ScoringResponses;
import com.tabulator.mapper.TabulatorResponseMapper;
import com.tabulator.model.Category;
import com.tabulator.model.Contestant;
import com.tabulator.model.Criterion;
import com.tabulator.model.Judge;
import com.tabulator.model.Score;
import com.tabulator.model.ScoreChangeType;
import com.tabulator.model.ScoreHistory;
import com.tabulator.ranking.WeightedScoreCalculator;
import com.tabulator.repository.CategoryRepository;
import com.tabulator.repository.ContestantRepository;
import com.tabulator.repository.CriterionRepository;
import com.tabulator.repository.JudgeRepository;
import com.tabulator.repository.ScoreHistoryRepository;
import com.tabulator.repository.ScoreRepository;
import com.tabulator.repository.SubmissionLockRepository;
import com.tabulator.web.ScoringException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class ScoreService {

    private static final Logger log = LoggerFactory.getLogger(ScoreService.class);

    private final ScoreRepository scoreRepository;
    private final ScoreHistoryRepository scoreHistoryRepository;
    private final SubmissionLockRepository submissionLockRepository;
    private final JudgeRepository judgeRepository;
    private final ContestantRepository contestantRepository;
    private final CategoryRepository categoryRepository;
    private final CriterionRepository criterionRepository;
    private final WeightedScoreCalculator weightedScoreCalculator;
    private final TabulatorResponseMapper tabulatorResponseMapper;
    private final ApplicationEventPublisher eventPublisher;

    public ScoreService(
            ScoreRepository scoreRepository,
            ScoreHistoryRepository scoreHistoryRepository,
            SubmissionLockRepository submissionLockRepository,
            JudgeRepository judgeRepository,
            ContestantRepository contestantRepository,
            CategoryRepository categoryRepository,
            CriterionRepository criterionRepository,
            WeightedScoreCalculator weightedScoreCalculator,
            TabulatorResponseMapper tabulatorResponseMapper,
            ApplicationEventPublisher eventPublisher
    ) {
        this.scoreRepository = scoreRepository;
        this.scoreHistoryRepository = scoreHistoryRepository;
        this.submissionLockRepository = submissionLockRepository;
        this.judgeRepository = judgeRepository;
        this.contestantRepository = contestantRepository;
        this.categoryRepository = categoryRepository;
        this.criterionRepository = criterionRepository;
        this.weightedScoreCalculator = weightedScoreCalculator;
        this.tabulatorResponseMapper = tabulatorResponseMapper;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Validates a judge's full criterion set for one contestant and category, then inserts or
     * overwrites each score. Refused with {@code already_submitted} once the tuple is locked.
     */
    @Transactional
    public List<ScoringResponses.ScoreRow> upsertScores(UUID judgeId, ScoringRequests.SubmitScoresRequest request) {
        Judge judge = judgeRepository.findByJudgeIdForUpdate(judgeId)
                .orElseThrow(() -> ScoringException.notFound("Judge not found: " + judgeId));
        Contestant contestant = requireContestantFor(judge, request.contestantId());
        Category category = requireActiveCategory(request.categoryId());

        if (submissionLockRepository.existsByJudgeIdAndCategoryIdAndContestantId(
                judgeId, category.getCategoryId(), contestant.getContestantId())) {
            log.warn("Rejected score write to locked submission: judge={} category={} contestant={}",
                    judgeId, category.getCategoryId(), contestant.getContestantId());
            throw ScoringException.alreadySubmitted(
                    "Scores for contestant " + contestant.getNumber() + " in " + category.getLabel()
                            + " were already submitted"
            );
        }

        List<Criterion> criteria = criterionRepository.findByCategoryIdOrderBySortOrderAsc(category.getCategoryId());
        Map<UUID, BigDecimal> weightedByCriterion = validate(category, criteria, request.scores());

        OffsetDateTime now = OffsetDateTime.now();
        Map<UUID, BigDecimal> rawByCriterion = request.scores().stream()
                .collect(Collectors.toMap(
                        ScoringRequests.CriterionScore::criterionId,
                        ScoringRequests.CriterionScore::rawScore
                ));
        List<Score> saved = new ArrayList<>();
        for (Criterion criterion : criteria) {
            UUID criterionId = criterion.getCriterionId();
            saved.add(upsert(
                    judgeId,
                    contestant.getContestantId(),
                    category.getCategoryId(),
                    criterionId,
                    rawByCriterion.get(criterionId).setScale(WeightedScoreCalculator.SCORE_SCALE, RoundingMode.HALF_UP),
                    weightedByCriterion.get(criterionId),
                    now
            ));
        }

        log.info("Stored {} scores: judge={} category={} contestant={}",
                saved.size(), judgeId, category.getSlug(), contestant.getNumber());
        eventPublisher.publishEvent(new ScoringChangedEvent(
                ScoringChangedEvent.Change.SCORES_UPSERTED,
                judge.getDivision(),
                judgeId,
                judge.getFullName(),
                category.getCategoryId(),
                contestant.getContestantId(),
                saved.size(),
                now
        ));
        return tabulatorResponseMapper.toScoreRows(saved);
    }

    /**
     * Ensures the judge holds a stored score for every criterion of the category, so a lock never
     * finalizes a partial submission.
     */
    @Transactional(readOnly = true)
    public void requireCompleteScores(UUID judgeId, UUID categoryId, UUID contestantId) {
        Judge judge = judgeRepository.findById(judgeId)
                .orElseThrow(() -> ScoringException.notFound("Judge not found: " + judgeId));
        requireContestantFor(judge, contestantId);
        Category category = requireActiveCategory(categoryId);

        Set<UUID> scoredCriteria = scoreRepository.findByJudgeIdAndContestantIdAndCategoryId(
                        judgeId, contestantId, category.getCategoryId()).stream()
                .map(Score::getCriterionId)
                .collect(Collectors.toSet());
        boolean complete = criterionRepository.findByCategoryIdOrderBySortOrderAsc(category.getCategoryId()).stream()
                .allMatch(criterion -> scoredCriteria.contains(criterion.getCriterionId()));
        if (!complete) {
            throw ScoringException.invalidRequest(
                    "Scores for every criterion of " + category.getLabel() + " must be stored before locking"
            );
        }
    }

    @Transactional(readOnly = true)
    public List<ScoringResponses.ScoreRow> listScores(UUID judgeId, UUID categoryId) {
        if (!judgeRepository.existsById(judgeId)) {
            throw ScoringException.notFound("Judge not found: " + judgeId);
        }
        List<Score> scores = categoryId == null
                ? scoreRepository.findByJudgeId(judgeId)
                : scoreRepository.findByJudgeIdAndCategoryId(judgeId, categoryId);
        return tabulatorResponseMapper.toScoreRows(scores);
    }

    @Transactional(readOnly = true)
    public List<ScoringResponses.ScoreHistoryEntry> listHistory(UUID judgeId, UUID contestantId) {
        List<ScoreHistory> history;
        if (judgeId != null && contestantId != null) {
            history = scoreHistoryRepository.findByJudgeIdAndContestantIdOrderByCreatedAtDesc(judgeId, contestantId);
        } else if (judgeId != null) {
            history = scoreHistoryRepository.findByJudgeIdOrderByCreatedAtDesc(judgeId);
        } else if (contestantId != null) {
            history = scoreHistoryRepository.findByContestantIdOrderByCreatedAtDesc(contestantId);
        } else {
            history = scoreHistoryRepository.findTop200ByOrderByCreatedAtDesc();
        }
        return tabulatorResponseMapper.toScoreHistoryEntries(history);
    }

    private Contestant requireContestantFor(Judge judge, UUID contestantId) {
        if (!Boolean.TRUE.equals(judge.getActive())) {
            throw ScoringException.invalidRequest("Judge " + judge.getUsername() + " is not active");
        }
        Contestant contestant = contestantRepository.findById(contestantId)
                .orElseThrow(() -> ScoringException.notFound("Contestant not found: " + contestantId));
        if (!Boolean.TRUE.equals(contestant.getActive())) {
            throw ScoringException.invalidRequest("Contestant " + contestant.getNumber() + " is not active");
        }
        if (judge.getDivision() != contestant.getDivision()) {
            throw ScoringException.invalidRequest(
                    "Judge " + judge.getUsername() + " does not score the " + contestant.getDivision() + " division"
            );
        }
        return contestant;
    }

    private Category requireActiveCategory(UUID categoryId) {
        return categoryRepository.findById(categoryId)
                .filter(category -> Boolean.TRUE.equals(category.getActive()))
                .orElseThrow(() -> ScoringException.notFound("Category not found: " + categoryId));
    }

    private Map<UUID, BigDecimal> validate(
            Category category,
            List<Criterion> criteria,
            List<ScoringRequests.CriterionScore> scores
    ) {
        Map<UUID, Criterion> criteriaById = criteria.stream()
                .collect(Collectors.toMap(Criterion::getCriterionId, Function.identity()));
        Set<UUID> seen = new HashSet<>();
        Map<UUID, BigDecimal> weightedByCriterion = new LinkedHashMap<>();

        for (ScoringRequests.CriterionScore score : scores) {
            Criterion criterion = criteriaById.get(score.criterionId());
            if (criterion == null) {
                throw ScoringException.invalidScore(
                        "Criterion " + score.criterionId() + " does not belong to " + category.getLabel()
                );
            }
            if (!seen.add(score.criterionId())) {
                throw ScoringException.invalidScore("Duplicate score for criterion " + criterion.getLabel());
            }
            if (!weightedScoreCalculator.isWithinRange(score.rawScore(), criterion.getPercentage())) {
                log.warn("Rejected out-of-range score {} for criterion {}", score.rawScore(), criterion.getSlug());
                throw ScoringException.invalidScore(
                        "Score for " + criterion.getLabel() + " must be between 0 and "
                                + weightedScoreCalculator.maxRawScore(criterion.getPercentage())
                );
            }
            weightedByCriterion.put(
                    criterion.getCriterionId(),
                    weightedScoreCalculator.weighted(score.rawScore(), criterion.getPercentage())
            );
        }

        List<String> missing = criteria.stream()
                .filter(criterion -> !seen.contains(criterion.getCriterionId()))
                .map(Criterion::getLabel)
                .toList();
        if (!missing.isEmpty()) {
            throw ScoringException.invalidScore("Missing scores for " + String.join(", ", missing));
        }
        return weightedByCriterion;
    }

    private Score upsert(
            UUID judgeId,
            UUID contestantId,
            UUID categoryId,
            UUID criterionId,
            BigDecimal rawScore,
            BigDecimal weightedScore,
            OffsetDateTime now
    ) {
        Optional<Score> existing = scoreRepository.findByJudgeIdAndContestantIdAndCriterionId(
                judgeId, contestantId, criterionId);

        ScoreHistory history = new ScoreHistory();
        history.setHistoryId(UUID.randomUUID());
        history.setJudgeId(judgeId);
        history.setContestantId(contestantId);
        history.setCategoryId(categoryId);
        history.setCriterionId(criterionId);
        history.setNewRawScore(rawScore);
        history.setNewWeightedScore(weightedScore);
        history.setCreatedAt(now);

        Score score;
        if (existing.isPresent()) {
            score = existing.get();
            history.setOldRawScore(score.getRawScore());
            history.setOldWeightedScore(score.getWeightedScore());
            history.setChangeType(ScoreChangeType.UPDATED);
        } else {
            score = new Score();
            score.setScoreId(UUID.randomUUID());
            score.setJudgeId(judgeId);
            score.setContestantId(contestantId);
            score.setCategoryId(categoryId);
            score.setCriterionId(criterionId);
            score.setCreatedAt(now);
            history.setChangeType(ScoreChangeType.CREATED);
        }
        score.setRawScore(rawScore);
        score.setWeightedScore(weightedScore);
        score.setUpdatedAt(now);

        Score saved = scoreRepository.save(score);
        history.setScoreId(saved.getScoreId());
        scoreHistoryRepository.save(history);
        return saved;
    }
}
