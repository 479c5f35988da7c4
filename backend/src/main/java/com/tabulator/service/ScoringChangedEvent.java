package com.tabulator.service;

import com.tabulator.model.Division;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Published after a score upsert, lock creation or lock removal. Observers re-read rankings on demand.
 */
public record ScoringChangedEvent(
        Change change,
        Division division,
        UUID judgeId,
        String judgeName,
        UUID categoryId,
        UUID contestantId,
        int scoreCount,
        OffsetDateTime occurredAt
) {

    public enum Change {
        SCORES_UPSERTED,
        LOCK_CREATED,
        LOCK_REMOVED
    }
}
