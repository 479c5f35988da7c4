package com.tabulator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Finalizes one judge's scores for one contestant in one category.
 * At most one row exists per (judge, category, contestant).
 */
@Getter
@Setter
@Entity
@Table(name = "submission_locks")
public class SubmissionLock {

    @Id
    @Column(name = "lock_id", nullable = false, updatable = false)
    private UUID lockId;

    @Column(name = "judge_id", nullable = false, updatable = false)
    private UUID judgeId;

    @Column(name = "category_id", nullable = false, updatable = false)
    private UUID categoryId;

    @Column(name = "contestant_id", nullable = false, updatable = false)
    private UUID contestantId;

    @Column(name = "locked_at", nullable = false, updatable = false)
    private OffsetDateTime lockedAt = OffsetDateTime.now();
}
