package com.example.runbook.scheduler.exception;

public class ScheduleNotFoundException extends RuntimeException {

    public ScheduleNotFoundException(Long id) {
        super("Schedule not found: id=" + id);
    }
}
