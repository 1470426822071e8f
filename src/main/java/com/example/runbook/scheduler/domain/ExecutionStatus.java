package com.example.runbook.scheduler.domain;

public enum ExecutionStatus {
    QUEUED,     // 已创建，等待执行引擎领取
    RUNNING,
    PAUSED,
    SUCCESS,
    FAILED,
    CANCELLED,
    TIMEOUT
}
