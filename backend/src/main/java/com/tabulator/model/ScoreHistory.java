package com.tabulator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "score_history")
public class ScoreHistory {

    @Id
    @Column(name = "history_id", nullable = false, updatable = false)
    private UUID historyId;

    @Column(name = "score_id", nullable = false, updatable = false)
    private UUID scoreId;

    @Column(name = "judge_id", nullable = false, updatable = false)
    private UUID judgeId;

    @Column(name = "contestant_id", nullable = false, updatable = false)
    private UUID contestantId;

    @Column(name = "category_id", nullable = false, updatable = false)
    private UUID categoryId;

    @Column(name = "criterion_id", nullable = false, updatable = false)
    private UUID criterionId;

    @Column(name = "old_raw_score", precision = 6, scale = 3)
    private BigDecimal oldRawScore;

    @Column(name = "new_raw_score", nullable = false, precision = 6, scale = 3)
    private BigDecimal newRawScore;

    @Column(name = "old_weighted_score", precision = 6, scale = 3)
    private BigDecimal oldWeightedScore;

    @Column(name = "new_weighted_score", nullable = false, precision = 6, scale = 3)
    private BigDecimal newWeightedScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "change_type", nullable = false, length = 16)
    private ScoreChangeType changeType;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
