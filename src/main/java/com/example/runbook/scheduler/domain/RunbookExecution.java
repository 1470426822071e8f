package com.example.runbook.scheduler.domain;

import lombok.*;

import javax.persistence.*;
import java.sql.Timestamp;

/**
 * Runbook 的一次执行。调度器只负责以 {@link ExecutionStatus#QUEUED} 创建记录，
 * 之后的状态流转由执行引擎负责。
 */
@Entity
@Table(name = "runbook_execution", indexes = {
        @Index(name = "idx_exec_runbook", columnList = "runbook_id"),
        @Index(name = "idx_exec_schedule", columnList = "schedule_id")})
@Getter @Setter @ToString
public class RunbookExecution {
    public static final String TRIGGER_TYPE_SCHEDULED = "scheduled";
    public static final String SCHEDULER_NAME = "Scheduler";
    public static final String SCHEDULER_ACTOR = "scheduler";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "runbook_id", length = 64, nullable = false)
    private String runbookId;

    @Column(name = "schedule_id")
    private Long scheduleId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ExecutionStatus status = ExecutionStatus.QUEUED;

    @Column(name = "triggered_by", length = 64, nullable = false)
    private String triggeredBy;

    @Column(name = "triggered_by_name", length = 64)
    private String triggeredByName;

    @Column(name = "trigger_type", length = 16, nullable = false)
    private String triggerType = "manual";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RunbookEnvironment environment;

    @Lob
    @Column(name = "input_params")
    private String inputParams;

    @Column(name = "created_at", nullable = false, updatable = false, columnDefinition = "TIMESTAMP(3)")
    private Timestamp createdAt;

    @Column(name = "updated_at", nullable = false, columnDefinition = "TIMESTAMP(3)")
    private Timestamp updatedAt;

    @PrePersist
    public void prePersist() {
        Timestamp now = new Timestamp(System.currentTimeMillis());
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = new Timestamp(System.currentTimeMillis());
    }
}
