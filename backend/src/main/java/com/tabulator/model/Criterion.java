package com.tabulator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "criteria")
public class Criterion {

    @Id
    @Column(name = "criterion_id", nullable = false, updatable = false)
    private UUID criterionId;

    @Column(name = "category_id", nullable = false, updatable = false)
    private UUID categoryId;

    @Column(name = "slug", nullable = false, length = 64)
    private String slug;

    @Column(name = "label", nullable = false, length = 160)
    private String label;

    /**
     * Share of the category in (0, 1]. Also the criterion's point ceiling:
     * {@code round(percentage * 100)}.
     */
    @Column(name = "percentage", nullable = false, precision = 4, scale = 3)
    private BigDecimal percentage;

    @Column(name = "sort_order", nullable = false)
    private Integer sortOrder = 0;
}
