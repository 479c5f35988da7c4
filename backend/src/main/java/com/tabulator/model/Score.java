package com.tabulator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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
@Table(name = "scores")
public class Score {

    @Id
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

    @Column(name = "raw_score", nullable = false, precision = 6, scale = 3)
    private BigDecimal rawScore;

    @Column(name = "weighted_score", nullable = false, precision = 6, scale = 3)
    private BigDecimal weightedScore;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
