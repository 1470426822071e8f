package com.example.runbook.scheduler.service;

import com.example.runbook.scheduler.domain.ExecutionStatus;
import com.example.runbook.scheduler.domain.RunbookExecution;
import com.example.runbook.scheduler.domain.RunbookSchedule;
import com.example.runbook.scheduler.repo.ExecutionRepo;
import com.example.runbook.scheduler.repo.ScheduleRepo;
import com.example.runbook.scheduler.timing.NextRunCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.sql.Timestamp;
import java.time.ZonedDateTime;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleTriggerService {

    private final ScheduleRepo scheduleRepo;
    private final ExecutionRepo executionRepo;
    private final NextRunCalculator nextRunCalculator;

    /**
     * 一次触发（短事务 / 新事务）：先推进 lastRunAt/nextRunAt，再创建 QUEUED execution。
     * 两次写入在同一事务里，所以只要存在 execution，schedule 一定已经推进（至多一次）。
     *
     * @return schedule 在 list 之后被暂停或删除时返回 empty
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<RunbookExecution> fire(RunbookSchedule s, ZonedDateTime now) {
        ZonedDateTime next = nextRunCalculator.computeNext(s.getFrequency(), s.getCronExpression(), now);

        int advanced = scheduleRepo.advanceTimestamps(s.getId(), Timestamp.from(now.toInstant()), Timestamp.from(next.toInstant()));
        if (advanced == 0) {
            // 在 list 之后被暂停/删除
            log.warn("Schedule no longer active, skip firing id={}", s.getId());
            return Optional.empty();
        }

        RunbookExecution e = new RunbookExecution();
        e.setRunbookId(s.getRunbookId());
        e.setScheduleId(s.getId());
        e.setStatus(ExecutionStatus.QUEUED);
        e.setTriggeredBy(StringUtils.hasText(s.getCreatedBy()) ? s.getCreatedBy() : RunbookExecution.SCHEDULER_ACTOR);
        e.setTriggeredByName(RunbookExecution.SCHEDULER_NAME);
        e.setTriggerType(RunbookExecution.TRIGGER_TYPE_SCHEDULED);
        e.setEnvironment(s.getEnvironment());
        e.setInputParams(s.getInputParams());
        RunbookExecution saved = executionRepo.save(e);

        s.setLastRunAt(Timestamp.from(now.toInstant()));
        s.setNextRunAt(Timestamp.from(next.toInstant()));

        log.info("Fired schedule id={}, runbook={}, execution={}, nextRunAt={}", s.getId(), s.getRunbookId(), saved.getId(), next);
        return Optional.of(saved);
    }
}
