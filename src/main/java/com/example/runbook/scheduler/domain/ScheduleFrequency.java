package com.example.runbook.scheduler.domain;

public enum ScheduleFrequency {
    HOURLY,   // every 60 minutes
    DAILY,    // every 24 hours
    WEEKLY,   // every 7 days
    MONTHLY,  // same day next calendar month
    CRON      // 5-field cron expression
}
