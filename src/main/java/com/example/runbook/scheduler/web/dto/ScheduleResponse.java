package com.example.runbook.scheduler.web.dto;

import com.example.runbook.scheduler.domain.RunbookEnvironment;
import com.example.runbook.scheduler.domain.RunbookSchedule;
import com.example.runbook.scheduler.domain.ScheduleFrequency;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.Getter;
import lombok.Setter;

import java.sql.Timestamp;
import java.time.Instant;

@Getter
@Setter
public class ScheduleResponse {
    private Long id;
    private String runbookId;
    private String name;
    private ScheduleFrequency frequency;
    private String cronExpression;
    private String timezone;
    private RunbookEnvironment environment;
    private JsonNode inputParams;
    @JsonProperty("isActive")
    private boolean active;
    private Instant lastRunAt;
    private Instant nextRunAt;
    private Instant endsAt;
    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;

    public static ScheduleResponse of(RunbookSchedule s, ObjectMapper mapper) {
        ScheduleResponse r = new ScheduleResponse();
        r.setId(s.getId());
        r.setRunbookId(s.getRunbookId());
        r.setName(s.getName());
        r.setFrequency(s.getFrequency());
        r.setCronExpression(s.getCronExpression());
        r.setTimezone(s.getTimezone());
        r.setEnvironment(s.getEnvironment());
        r.setInputParams(readParams(s.getInputParams(), mapper));
        r.setActive(s.isActive());
        r.setLastRunAt(toInstant(s.getLastRunAt()));
        r.setNextRunAt(toInstant(s.getNextRunAt()));
        r.setEndsAt(toInstant(s.getEndsAt()));
        r.setCreatedBy(s.getCreatedBy());
        r.setCreatedAt(toInstant(s.getCreatedAt()));
        r.setUpdatedAt(toInstant(s.getUpdatedAt()));
        return r;
    }

    private static JsonNode readParams(String json, ObjectMapper mapper) {
        if (json == null) return null;
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            // 历史数据可能不是合法 JSON，原样返回
            return TextNode.valueOf(json);
        }
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
