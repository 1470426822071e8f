package com.example.runbook.scheduler.domain;

public enum RunbookEnvironment {
    DEVELOPMENT,
    STAGING,
    PRODUCTION
}
