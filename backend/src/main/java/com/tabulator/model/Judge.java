package com.tabulator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "judges")
public class Judge {

    @Id
    @Column(name = "judge_id", nullable = false, updatable = false)
    private UUID judgeId;

    @Column(name = "full_name", nullable = false, length = 160)
    private String fullName;

    @Column(name = "username", nullable = false, unique = true, length = 64)
    private String username;

    @Enumerated(EnumType.STRING)
    @Column(name = "division", nullable = false, length = 16)
    private Division division;

    @Column(name = "active", nullable = false)
    private Boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
