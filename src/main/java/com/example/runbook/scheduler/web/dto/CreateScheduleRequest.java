package com.example.runbook.scheduler.web.dto;

import com.example.runbook.scheduler.domain.RunbookEnvironment;
import com.example.runbook.scheduler.domain.ScheduleFrequency;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Size;
import java.time.Instant;

@Data
public class CreateScheduleRequest {
    @NotBlank(message = "name is required")
    @Size(max = 128)
    private String name;

    @NotNull(message = "frequency is required")
    private ScheduleFrequency frequency;

    // frequency=CRON 时必填
    @Size(max = 64)
    private String cronExpression;

    @Size(max = 64)
    private String timezone;

    private RunbookEnvironment environment;

    private JsonNode inputParams;

    private Instant endsAt;
}
