package com.example.runbook.scheduler.service;

import com.example.runbook.scheduler.domain.RunbookEnvironment;
import com.example.runbook.scheduler.domain.RunbookExecution;
import com.example.runbook.scheduler.domain.RunbookSchedule;
import com.example.runbook.scheduler.domain.ScheduleFrequency;
import com.example.runbook.scheduler.exception.InvalidScheduleException;
import com.example.runbook.scheduler.exception.ScheduleNotFoundException;
import com.example.runbook.scheduler.repo.ScheduleRepo;
import com.example.runbook.scheduler.timing.CronMatcher;
import com.example.runbook.scheduler.timing.NextRunCalculator;
import com.example.runbook.scheduler.web.dto.CreateScheduleRequest;
import com.example.runbook.scheduler.web.dto.UpdateScheduleRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Schedule 生命周期管理：创建、部分更新、删除、暂停、恢复、查询。
 * 不额外加锁；暂停与 tick 并发时由 tick 的条件更新（仅 active 行）兜底。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleService {

    static final String DEFAULT_TIMEZONE = "UTC";

    private final ScheduleRepo scheduleRepo;
    private final NextRunCalculator nextRunCalculator;
    private final CronMatcher cronMatcher;
    private final ObjectMapper mapper;
    private final Clock clock;

    @Transactional
    public RunbookSchedule create(String runbookId, CreateScheduleRequest req, String actor) {
        if (!StringUtils.hasText(runbookId)) {
            throw new InvalidScheduleException("runbookId is required");
        }
        if (!StringUtils.hasText(req.getName()) || req.getFrequency() == null) {
            throw new InvalidScheduleException("Missing required fields: name, frequency");
        }

        ZonedDateTime now = ZonedDateTime.now(clock);

        RunbookSchedule s = new RunbookSchedule();
        s.setRunbookId(runbookId.trim());
        s.setName(req.getName().trim());
        s.setFrequency(req.getFrequency());
        s.setCronExpression(normalizeCron(req.getFrequency(), req.getCronExpression()));
        s.setTimezone(StringUtils.hasText(req.getTimezone()) ? req.getTimezone().trim() : DEFAULT_TIMEZONE);
        s.setEnvironment(req.getEnvironment() == null ? RunbookEnvironment.DEVELOPMENT : req.getEnvironment());
        s.setInputParams(writeParams(req.getInputParams()));
        s.setEndsAt(toTimestamp(req.getEndsAt()));
        s.setActive(true);
        s.setCreatedBy(StringUtils.hasText(actor) ? actor : RunbookExecution.SCHEDULER_ACTOR);
        s.setCreatedAt(Timestamp.from(now.toInstant()));
        s.setNextRunAt(nextRunFrom(s, now));

        RunbookSchedule saved = scheduleRepo.save(s);
        log.info("Schedule created id={}, runbook={}, frequency={}, cron={}, nextRunAt={}",
                saved.getId(), saved.getRunbookId(), saved.getFrequency(), saved.getCronExpression(), saved.getNextRunAt());
        return saved;
    }

    /**
     * 部分更新：请求里为 null 的字段保持不变。
     * 频率或 cron 变化时从当前时刻重新计算 nextRunAt；isActive 由 false 改为 true 时等同于 resume。
     */
    @Transactional
    public RunbookSchedule update(Long id, UpdateScheduleRequest req) {
        RunbookSchedule s = get(id);
        ZonedDateTime now = ZonedDateTime.now(clock);
        boolean reschedule = false;

        if (req.getName() != null) {
            if (!StringUtils.hasText(req.getName())) {
                throw new InvalidScheduleException("name must not be blank");
            }
            s.setName(req.getName().trim());
        }
        if (req.getFrequency() != null && req.getFrequency() != s.getFrequency()) {
            s.setFrequency(req.getFrequency());
            reschedule = true;
        }
        String cron = req.getCronExpression() != null ? req.getCronExpression() : s.getCronExpression();
        String normalized = normalizeCron(s.getFrequency(), cron);
        if (!Objects.equals(normalized, s.getCronExpression())) {
            s.setCronExpression(normalized);
            reschedule = true;
        }
        if (req.getTimezone() != null) {
            s.setTimezone(StringUtils.hasText(req.getTimezone()) ? req.getTimezone().trim() : DEFAULT_TIMEZONE);
        }
        if (req.getEnvironment() != null) {
            s.setEnvironment(req.getEnvironment());
        }
        if (req.getInputParams() != null) {
            s.setInputParams(writeParams(req.getInputParams()));
        }
        if (req.getEndsAt() != null) {
            s.setEndsAt(toTimestamp(req.getEndsAt()));
        }
        if (req.getActive() != null && req.getActive() != s.isActive()) {
            s.setActive(req.getActive());
            if (s.isActive()) reschedule = true;
        }

        if (reschedule) {
            s.setNextRunAt(nextRunFrom(s, now));
        }

        RunbookSchedule saved = scheduleRepo.save(s);
        log.info("Schedule updated id={}, frequency={}, cron={}, active={}, nextRunAt={}",
                saved.getId(), saved.getFrequency(), saved.getCronExpression(), saved.isActive(), saved.getNextRunAt());
        return saved;
    }

    @Transactional
    public void delete(Long id) {
        if (!scheduleRepo.existsById(id)) {
            throw new ScheduleNotFoundException(id);
        }
        scheduleRepo.deleteById(id);
        log.info("Schedule deleted id={}", id);
    }

    /**
     * 暂停：只改 active，lastRunAt / nextRunAt 保持不变。
     */
    @Transactional
    public RunbookSchedule pause(Long id) {
        RunbookSchedule s = get(id);
        s.setActive(false);
        RunbookSchedule saved = scheduleRepo.save(s);
        log.info("Schedule paused id={}", id);
        return saved;
    }

    /**
     * 恢复：从当前时刻重新计算 nextRunAt（CRON 重新探测）。
     */
    @Transactional
    public RunbookSchedule resume(Long id) {
        RunbookSchedule s = get(id);
        s.setActive(true);
        s.setNextRunAt(nextRunFrom(s, ZonedDateTime.now(clock)));
        RunbookSchedule saved = scheduleRepo.save(s);
        log.info("Schedule resumed id={}, nextRunAt={}", id, saved.getNextRunAt());
        return saved;
    }

    @Transactional(readOnly = true)
    public RunbookSchedule get(Long id) {
        return scheduleRepo.findById(id).orElseThrow(() -> new ScheduleNotFoundException(id));
    }

    @Transactional(readOnly = true)
    public List<RunbookSchedule> listForRunbook(String runbookId) {
        return scheduleRepo.findByRunbookIdOrderByCreatedAtDesc(runbookId);
    }

    private Timestamp nextRunFrom(RunbookSchedule s, ZonedDateTime now) {
        return Timestamp.from(nextRunCalculator.computeNext(s.getFrequency(), s.getCronExpression(), now).toInstant());
    }

    /**
     * cronExpression 只在 CRON 频率下有意义，其余频率一律清空。
     */
    private String normalizeCron(ScheduleFrequency frequency, String cron) {
        if (frequency != ScheduleFrequency.CRON) {
            return null;
        }
        if (!StringUtils.hasText(cron)) {
            throw new InvalidScheduleException("Cron expression required for CRON frequency");
        }
        String trimmed = cron.trim();
        if (!cronMatcher.isWellFormed(trimmed)) {
            throw new InvalidScheduleException("Cron expression must have 5 fields (minute hour day-of-month month day-of-week): " + trimmed);
        }
        return trimmed;
    }

    private String writeParams(JsonNode params) {
        if (params == null || params.isNull()) return null;
        if (!params.isObject()) {
            throw new InvalidScheduleException("inputParams must be a JSON object");
        }
        try {
            return mapper.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            throw new InvalidScheduleException("inputParams could not be serialized: " + e.getOriginalMessage(), e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}
