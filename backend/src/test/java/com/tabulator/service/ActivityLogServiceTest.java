package com.tabulator.service;

import com.tabulator.config.TabulatorProperties;
import com.tabulator.mapper.TabulatorResponseMapper;
import com.tabulator.model.ActivityActionType;
import com.tabulator.model.ActivityActorType;
import com.tabulator.model.ActivityLog;
import com.tabulator.model.Division;
import com.tabulator.ranking.WeightedScoreCalculator;
import com.tabulator.repository.ActivityLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ActivityLogServiceTest {

    @Mock
    private ActivityLogRepository activityLogRepository;

    private ActivityLogService activityLogService;

    @BeforeEach
    void setUp() {
        TabulatorProperties properties = new TabulatorProperties();
        properties.getActivity().setDefaultLimit(25);
        properties.getActivity().setMaxLimit(100);
        activityLogService = new ActivityLogService(
                activityLogRepository,
                new TabulatorResponseMapper(new WeightedScoreCalculator()),
                properties
        );
    }

    @Test
    void onScoringChanged_recordsJudgeSubmission() {
        when(activityLogRepository.save(any(ActivityLog.class))).thenAnswer(invocation -> invocation.getArgument(0));
        ScoringChangedEvent event = event(ScoringChangedEvent.Change.SCORES_UPSERTED, 4);

        activityLogService.onScoringChanged(event);

        ArgumentCaptor<ActivityLog> saved = ArgumentCaptor.forClass(ActivityLog.class);
        verify(activityLogRepository).save(saved.capture());
        ActivityLog activity = saved.getValue();
        assertEquals(ActivityActorType.JUDGE, activity.getActorType());
        assertEquals(ActivityActionType.SCORES_SUBMITTED, activity.getActionType());
        assertEquals("Judge Reyes", activity.getActorName());
        assertEquals(event.contestantId(), activity.getEntityId());
        assertEquals(4, activity.getMetadata().get("scoreCount").asInt());
        assertEquals("FEMALE", activity.getMetadata().get("division").asText());
    }

    @Test
    void onScoringChanged_unlockIsAttributedToAdministrator() {
        when(activityLogRepository.save(any(ActivityLog.class))).thenAnswer(invocation -> invocation.getArgument(0));

        activityLogService.onScoringChanged(event(ScoringChangedEvent.Change.LOCK_REMOVED, 0));

        ArgumentCaptor<ActivityLog> saved = ArgumentCaptor.forClass(ActivityLog.class);
        verify(activityLogRepository).save(saved.capture());
        assertEquals(ActivityActorType.ADMIN, saved.getValue().getActorType());
        assertEquals(ActivityActionType.LOCK_REMOVED, saved.getValue().getActionType());
    }

    @Test
    void onScoringChanged_storeFailureIsNotRethrown() {
        when(activityLogRepository.save(any(ActivityLog.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertDoesNotThrow(() -> activityLogService.onScoringChanged(event(ScoringChangedEvent.Change.LOCK_CREATED, 0)));
    }

    @Test
    void recent_clampsLimitToConfiguredRange() {
        when(activityLogRepository.findAllByOrderByCreatedAtDesc(any(Pageable.class))).thenReturn(List.of());

        activityLogService.recent(null);
        activityLogService.recent(500);
        activityLogService.recent(0);

        ArgumentCaptor<Pageable> pages = ArgumentCaptor.forClass(Pageable.class);
        verify(activityLogRepository, times(3)).findAllByOrderByCreatedAtDesc(pages.capture());
        assertEquals(25, pages.getAllValues().get(0).getPageSize());
        assertEquals(100, pages.getAllValues().get(1).getPageSize());
        assertEquals(1, pages.getAllValues().get(2).getPageSize());
    }

    private static ScoringChangedEvent event(ScoringChangedEvent.Change change, int scoreCount) {
        return new ScoringChangedEvent(
                change,
                Division.FEMALE,
                UUID.randomUUID(),
                "Judge Reyes",
                UUID.randomUUID(),
                UUID.randomUUID(),
                scoreCount,
                OffsetDateTime.now()
        );
    }
}
