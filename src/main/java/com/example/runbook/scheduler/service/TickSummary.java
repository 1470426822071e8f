package com.example.runbook.scheduler.service;

import lombok.Value;

@Value
public class TickSummary {
    boolean aborted;
    int evaluated;
    int fired;
    int failed;

    static TickSummary aborted() {
        return new TickSummary(true, 0, 0, 0);
    }
}
