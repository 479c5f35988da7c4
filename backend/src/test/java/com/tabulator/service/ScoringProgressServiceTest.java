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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScoringProgressServiceTest {

    private static final UUID RUNWAY = UUID.randomUUID();
    private static final UUID FORMAL = UUID.randomUUID();
    private static final UUID C1 = UUID.randomUUID();
    private static final UUID C2 = UUID.randomUUID();

    @Mock
    private CategoryRepository categoryRepository;

    @Mock
    private ContestantRepository contestantRepository;

    @Mock
    private JudgeRepository judgeRepository;

    @Mock
    private SubmissionLockRepository submissionLockRepository;

    @InjectMocks
    private ScoringProgressService scoringProgressService;

    @Test
    void progress_countsLocksPerCategoryForActiveContestants() {
        Judge judge = new Judge();
        judge.setJudgeId(UUID.randomUUID());
        judge.setFullName("Judge Lim");
        judge.setDivision(Division.FEMALE);

        when(categoryRepository.findByActiveTrueOrderBySortOrderAsc())
                .thenReturn(List.of(category(RUNWAY, "runway"), category(FORMAL, "formal")));
        when(contestantRepository.findByDivisionAndActiveTrueOrderByNumberAsc(Division.FEMALE))
                .thenReturn(List.of(contestant(C1), contestant(C2)));
        when(judgeRepository.findByDivisionAndActiveTrueOrderByFullNameAsc(Division.FEMALE)).thenReturn(List.of(judge));
        when(submissionLockRepository.findByJudgeId(judge.getJudgeId())).thenReturn(List.of(
                lock(RUNWAY, C1),
                lock(RUNWAY, C2),
                lock(FORMAL, C1),
                lock(FORMAL, UUID.randomUUID())
        ));

        ProgressResponses.ScoringProgress progress = scoringProgressService.progress(Division.FEMALE);

        assertEquals(3, progress.lockedSubmissions());
        assertEquals(4, progress.expectedSubmissions());
        ProgressResponses.JudgeProgress judgeProgress = progress.judges().get(0);
        assertEquals("FEMALE", judgeProgress.division());
        assertTrue(judgeProgress.categories().get(0).complete());
        assertFalse(judgeProgress.categories().get(1).complete());
        assertEquals(1, judgeProgress.categories().get(1).lockedContestants());
    }

    @Test
    void progress_emptyDivisionExpectsNothing() {
        when(categoryRepository.findByActiveTrueOrderBySortOrderAsc()).thenReturn(List.of(category(RUNWAY, "runway")));
        when(contestantRepository.findByDivisionAndActiveTrueOrderByNumberAsc(Division.MALE)).thenReturn(List.of());
        when(judgeRepository.findByDivisionAndActiveTrueOrderByFullNameAsc(Division.MALE)).thenReturn(List.of());

        ProgressResponses.ScoringProgress progress = scoringProgressService.progress(Division.MALE);

        assertEquals(0, progress.expectedSubmissions());
        assertTrue(progress.judges().isEmpty());
    }

    private static Category category(UUID id, String slug) {
        Category category = new Category();
        category.setCategoryId(id);
        category.setSlug(slug);
        category.setLabel(slug);
        return category;
    }

    private static Contestant contestant(UUID id) {
        Contestant contestant = new Contestant();
        contestant.setContestantId(id);
        contestant.setDivision(Division.FEMALE);
        return contestant;
    }

    private static SubmissionLock lock(UUID categoryId, UUID contestantId) {
        SubmissionLock lock = new SubmissionLock();
        lock.setCategoryId(categoryId);
        lock.setContestantId(contestantId);
        return lock;
    }
}
