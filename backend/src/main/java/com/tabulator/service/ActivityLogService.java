package com.tabulator.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tabulator.config.TabulatorProperties;
import com.tabulator.dto.ActivityResponses;
import com.tabulator.mapper.TabulatorResponseMapper;
import com.tabulator.model.ActivityActionType;
import com.tabulator.model.ActivityActorType;
import com.tabulator.model.ActivityLog;
import com.tabulator.repository.ActivityLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Audit feed of scoring and roster activity. Scoring changes arrive as events once the writing
 * transaction has committed.
 */
@Service
public class ActivityLogService {

    private static final Logger log = LoggerFactory.getLogger(ActivityLogService.class);

    private final ActivityLogRepository activityLogRepository;
    private final TabulatorResponseMapper tabulatorResponseMapper;
    private final TabulatorProperties tabulatorProperties;

    public ActivityLogService(
            ActivityLogRepository activityLogRepository,
            TabulatorResponseMapper tabulatorResponseMapper,
            TabulatorProperties tabulatorProperties
    ) {
        this.activityLogRepository = activityLogRepository;
        this.tabulatorResponseMapper = tabulatorResponseMapper;
        this.tabulatorProperties = tabulatorProperties;
    }

    @TransactionalEventListener(fallbackExecution = true)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void onScoringChanged(ScoringChangedEvent event) {
        ObjectNode metadata = JsonNodeFactory.instance.objectNode();
        metadata.put("judgeId", event.judgeId().toString());
        metadata.put("categoryId", event.categoryId().toString());
        metadata.put("contestantId", event.contestantId().toString());
        if (event.division() != null) {
            metadata.put("division", event.division().name());
        }

        ActivityActorType actorType = ActivityActorType.JUDGE;
        ActivityActionType actionType;
        String description;
        switch (event.change()) {
            case SCORES_UPSERTED -> {
                actionType = ActivityActionType.SCORES_SUBMITTED;
                metadata.put("scoreCount", event.scoreCount());
                description = event.judgeName() + " submitted " + event.scoreCount() + " scores";
            }
            case LOCK_CREATED -> {
                actionType = ActivityActionType.LOCK_CREATED;
                description = event.judgeName() + " locked a submission";
            }
            case LOCK_REMOVED -> {
                actorType = ActivityActorType.ADMIN;
                actionType = ActivityActionType.LOCK_REMOVED;
                description = "Administrator reopened a submission of " + event.judgeName();
            }
            default -> throw new IllegalStateException("Unhandled scoring change: " + event.change());
        }

        try {
            record(actorType, event.judgeName(), actionType, "submission", event.contestantId(), description,
                    metadata, event.occurredAt());
        } catch (DataAccessException ex) {
            // scoring write already committed
            log.warn("Failed to record activity for {} by judge {}", event.change(), event.judgeId(), ex);
        }
    }

    @Transactional
    public ActivityLog record(
            ActivityActorType actorType,
            String actorName,
            ActivityActionType actionType,
            String entityType,
            UUID entityId,
            String description,
            ObjectNode metadata,
            OffsetDateTime occurredAt
    ) {
        ActivityLog activity = new ActivityLog();
        activity.setActivityId(UUID.randomUUID());
        activity.setActorType(actorType);
        activity.setActorName(actorName);
        activity.setActionType(actionType);
        activity.setEntityType(entityType);
        activity.setEntityId(entityId);
        activity.setDescription(description);
        activity.setMetadata(metadata);
        activity.setCreatedAt(occurredAt != null ? occurredAt : OffsetDateTime.now());
        return activityLogRepository.save(activity);
    }

    @Transactional(readOnly = true)
    public List<ActivityResponses.ActivityEntry> recent(Integer limit) {
        TabulatorProperties.Activity settings = tabulatorProperties.getActivity();
        int size = limit == null ? settings.getDefaultLimit() : Math.max(1, Math.min(limit, settings.getMaxLimit()));
        return tabulatorResponseMapper.toActivityEntries(
                activityLogRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, size))
        );
    }
}
