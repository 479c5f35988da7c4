package com.tabulator.service;

import com.tabulator.dto.ProgressResponses;
import com.tabulator.model.Category;
import com.tabulator.model.Contestant;
import com.tabulator.model.Division;
import com.tabulator.model.Judge;
import com.tabulator.model.SubmissionLock;
import com.tabulator.repository.CategoryRepository;
import com.tabulator.repository.ContestantRepository;
import com.tabulator.repository.JudgeRepository;
import com.tabulator.repository.SubmissionLockRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * How far each active judge is through their locked submissions, per category.
 */
@Service
public class ScoringProgressService {

    private final CategoryRepository categoryRepository;
    private final ContestantRepository contestantRepository;
    private final JudgeRepository judgeRepository;
    private final SubmissionLockRepository submissionLockRepository;

    public ScoringProgressService(
            CategoryRepository categoryRepository,
            ContestantRepository contestantRepository,
            JudgeRepository judgeRepository,
            SubmissionLockRepository submissionLockRepository
    ) {
        this.categoryRepository = categoryRepository;
        this.contestantRepository = contestantRepository;
        this.judgeRepository = judgeRepository;
        this.submissionLockRepository = submissionLockRepository;
    }

    @Transactional(readOnly = true)
    public ProgressResponses.ScoringProgress progress(Division division) {
        List<Category> categories = categoryRepository.findByActiveTrueOrderBySortOrderAsc();
        List<Division> divisions = division == null ? List.of(Division.values()) : List.of(division);

        List<ProgressResponses.JudgeProgress> judges = new ArrayList<>();
        int locked = 0;
        int expected = 0;
        for (Division each : divisions) {
            Set<UUID> contestantIds = contestantRepository.findByDivisionAndActiveTrueOrderByNumberAsc(each).stream()
                    .map(Contestant::getContestantId)
                    .collect(Collectors.toSet());
            for (Judge judge : judgeRepository.findByDivisionAndActiveTrueOrderByFullNameAsc(each)) {
                ProgressResponses.JudgeProgress progress = judgeProgress(judge, categories, contestantIds);
                judges.add(progress);
                locked += progress.lockedSubmissions();
                expected += progress.expectedSubmissions();
            }
        }
        return new ProgressResponses.ScoringProgress(locked, expected, judges);
    }

    private ProgressResponses.JudgeProgress judgeProgress(
            Judge judge,
            List<Category> categories,
            Set<UUID> contestantIds
    ) {
        Map<UUID, Integer> lockedByCategory = new HashMap<>();
        for (SubmissionLock lock : submissionLockRepository.findByJudgeId(judge.getJudgeId())) {
            if (contestantIds.contains(lock.getContestantId())) {
                lockedByCategory.merge(lock.getCategoryId(), 1, Integer::sum);
            }
        }

        int total = contestantIds.size();
        int lockedSubmissions = 0;
        List<ProgressResponses.JudgeCategoryProgress> perCategory = new ArrayList<>(categories.size());
        for (Category category : categories) {
            int lockedInCategory = lockedByCategory.getOrDefault(category.getCategoryId(), 0);
            lockedSubmissions += lockedInCategory;
            perCategory.add(new ProgressResponses.JudgeCategoryProgress(
                    category.getCategoryId(),
                    category.getSlug(),
                    lockedInCategory,
                    total,
                    total > 0 && lockedInCategory >= total
            ));
        }

        return new ProgressResponses.JudgeProgress(
                judge.getJudgeId(),
                judge.getFullName(),
                judge.getDivision().name(),
                lockedSubmissions,
                total * categories.size(),
                perCategory
        );
    }
}
