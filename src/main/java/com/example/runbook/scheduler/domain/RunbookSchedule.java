package com.example.runbook.scheduler.domain;

import lombok.*;

import javax.persistence.*;
import java.sql.Timestamp;

@Entity
@Table(name = "runbook_schedule", indexes = {
        @Index(name = "idx_sched_runbook", columnList = "runbook_id"),
        @Index(name = "idx_sched_active_next", columnList = "active, next_run_at")})
@Getter @Setter @ToString
public class RunbookSchedule {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "runbook_id", length = 64, nullable = false)
    private String runbookId;

    @Column(length = 128)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ScheduleFrequency frequency;

    // 仅 frequency=CRON 时有值
    @Column(name = "cron_expression", length = 64)
    private String cronExpression;

    @Column(length = 64, nullable = false)
    private String timezone = "UTC";

    @Lob
    @Column(name = "input_params")
    private String inputParams;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RunbookEnvironment environment = RunbookEnvironment.DEVELOPMENT;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "last_run_at", columnDefinition = "TIMESTAMP(3)")
    private Timestamp lastRunAt;

    @Column(name = "next_run_at", columnDefinition = "TIMESTAMP(3)")
    private Timestamp nextRunAt;

    @Column(name = "ends_at", columnDefinition = "TIMESTAMP(3)")
    private Timestamp endsAt;

    @Column(name = "created_by", length = 64, nullable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false, columnDefinition = "TIMESTAMP(3)")
    private Timestamp createdAt;

    @Column(name = "updated_at", nullable = false, columnDefinition = "TIMESTAMP(3)")
    private Timestamp updatedAt;

    @PrePersist
    public void prePersist() {
        Timestamp now = new Timestamp(System.currentTimeMillis());
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = new Timestamp(System.currentTimeMillis());
    }
}
