package com.tabulator.service;

import com.tabulator.model.Category;
import com.tabulator.model.Contestant;
import com.tabulator.model.Criterion;
import com.tabulator.model.Division;
import com.tabulator.model.Judge;
import com.tabulator.model.Score;
import com.tabulator.model.SubmissionLock;
import com.tabulator.ranking.CategoryRef;
import com.tabulator.ranking.ContestantRef;
import com.tabulator.ranking.LockKey;
import com.tabulator.ranking.ScoreEntry;
import com.tabulator.ranking.ScoringSnapshot;
import com.tabulator.ranking.WeightedScoreCalculator;
import com.tabulator.repository.CategoryRepository;
import com.tabulator.repository.ContestantRepository;
import com.tabulator.repository.CriterionRepository;
import com.tabulator.repository.JudgeRepository;
import com.tabulator.repository.ScoreRepository;
import com.tabulator.repository.SubmissionLockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read boundary between the store and the ranking engine. Rows that do not fit the active roster or
 * the criterion bounds are dropped here so the engine only ever sees well-formed records.
 */
@Service
public class ScoringSnapshotService {

    private static final Logger log = LoggerFactory.getLogger(ScoringSnapshotService.class);

    private final CategoryRepository categoryRepository;
    private final CriterionRepository criterionRepository;
    private final ContestantRepository contestantRepository;
    private final JudgeRepository judgeRepository;
    private final ScoreRepository scoreRepository;
    private final SubmissionLockRepository submissionLockRepository;
    private final WeightedScoreCalculator weightedScoreCalculator;

    public ScoringSnapshotService(
            CategoryRepository categoryRepository,
            CriterionRepository criterionRepository,
            ContestantRepository contestantRepository,
            JudgeRepository judgeRepository,
            ScoreRepository scoreRepository,
            SubmissionLockRepository submissionLockRepository,
            WeightedScoreCalculator weightedScoreCalculator
    ) {
        this.categoryRepository = categoryRepository;
        this.criterionRepository = criterionRepository;
        this.contestantRepository = contestantRepository;
        this.judgeRepository = judgeRepository;
        this.scoreRepository = scoreRepository;
        this.submissionLockRepository = submissionLockRepository;
        this.weightedScoreCalculator = weightedScoreCalculator;
    }

    @Transactional(readOnly = true)
    public ScoringSnapshot load(Division division) {
        List<CategoryRef> categories = categoryRepository.findByActiveTrueOrderBySortOrderAsc().stream()
                .map(ScoringSnapshotService::toCategoryRef)
                .toList();
        List<ContestantRef> contestants = contestantRepository.findByDivisionAndActiveTrueOrderByNumberAsc(division)
                .stream()
                .map(ScoringSnapshotService::toContestantRef)
                .toList();
        Set<UUID> judgeIds = judgeRepository.findByDivisionAndActiveTrueOrderByFullNameAsc(division).stream()
                .map(Judge::getJudgeId)
                .collect(Collectors.toSet());

        if (categories.isEmpty() || contestants.isEmpty() || judgeIds.isEmpty()) {
            return new ScoringSnapshot(division, categories, contestants, judgeIds, List.of(), Set.of());
        }

        Set<UUID> categoryIds = categories.stream()
                .map(CategoryRef::categoryId)
                .collect(Collectors.toSet());
        Set<UUID> contestantIds = contestants.stream()
                .map(ContestantRef::contestantId)
                .collect(Collectors.toSet());
        Map<UUID, Criterion> criteriaById = criterionRepository.findByCategoryIdInOrderBySortOrderAsc(categoryIds)
                .stream()
                .collect(Collectors.toMap(Criterion::getCriterionId, Function.identity()));

        List<ScoreEntry> scores = new ArrayList<>();
        int dropped = 0;
        for (Score score : scoreRepository.findByContestantIdIn(contestantIds)) {
            if (!judgeIds.contains(score.getJudgeId()) || !categoryIds.contains(score.getCategoryId())) {
                continue;
            }
            Criterion criterion = criteriaById.get(score.getCriterionId());
            if (criterion == null
                    || !criterion.getCategoryId().equals(score.getCategoryId())
                    || score.getWeightedScore() == null
                    || !weightedScoreCalculator.isWithinRange(score.getRawScore(), criterion.getPercentage())) {
                log.warn("Dropping malformed score row {} (judge={} contestant={} criterion={})",
                        score.getScoreId(), score.getJudgeId(), score.getContestantId(), score.getCriterionId());
                dropped++;
                continue;
            }
            scores.add(new ScoreEntry(
                    score.getJudgeId(),
                    score.getContestantId(),
                    score.getCategoryId(),
                    score.getCriterionId(),
                    score.getRawScore(),
                    score.getWeightedScore()
            ));
        }

        Set<LockKey> locks = new HashSet<>();
        for (SubmissionLock lock : submissionLockRepository.findByContestantIdIn(contestantIds)) {
            if (judgeIds.contains(lock.getJudgeId()) && categoryIds.contains(lock.getCategoryId())) {
                locks.add(new LockKey(lock.getJudgeId(), lock.getCategoryId(), lock.getContestantId()));
            }
        }

        log.debug("Loaded {} snapshot: {} contestants, {} judges, {} scores, {} locks, {} dropped",
                division, contestants.size(), judgeIds.size(), scores.size(), locks.size(), dropped);
        return new ScoringSnapshot(division, categories, contestants, judgeIds, scores, locks);
    }

    private static CategoryRef toCategoryRef(Category category) {
        return new CategoryRef(
                category.getCategoryId(),
                category.getSlug(),
                category.getLabel(),
                category.getSortOrder() != null ? category.getSortOrder() : 0
        );
    }

    private static ContestantRef toContestantRef(Contestant contestant) {
        return new ContestantRef(contestant.getContestantId(), contestant.getNumber(), contestant.getFullName());
    }
}
