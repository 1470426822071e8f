package com.example.runbook.scheduler.web.dto;

import com.example.runbook.scheduler.domain.RunbookEnvironment;
import com.example.runbook.scheduler.domain.ScheduleFrequency;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import javax.validation.constraints.Size;
import java.time.Instant;

/**
 * 部分更新：为 null 的字段保持不变。
 */
@Data
public class UpdateScheduleRequest {
    @Size(max = 128)
    private String name;

    private ScheduleFrequency frequency;

    @Size(max = 64)
    private String cronExpression;

    @Size(max = 64)
    private String timezone;

    private RunbookEnvironment environment;

    private JsonNode inputParams;

    @JsonProperty("isActive")
    private Boolean active;

    private Instant endsAt;
}
