package com.example.runbook.scheduler.service;

import com.example.runbook.scheduler.config.SchedulerProperties;
import com.example.runbook.scheduler.domain.RunbookExecution;
import com.example.runbook.scheduler.domain.RunbookSchedule;
import com.example.runbook.scheduler.repo.ScheduleRepo;
import com.example.runbook.scheduler.timing.DueEvaluator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runbook 调度主循环：Stopped → Running → Stopped。
 * <p>
 * {@link #start()} 立即执行一次 tick，然后在 ticker 上挂一个固定频率的定时任务；
 * {@link #stop()} 取消定时任务，已交给执行引擎的 execution 不受影响。
 * <p>
 * 同一个库只能跑一个调度实例，多个实例会重复触发同一个 schedule。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "runbook.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerLoop implements SmartLifecycle {

    private final ScheduleRepo scheduleRepo;
    private final DueEvaluator dueEvaluator;
    private final ScheduleTriggerService triggerService;
    private final ExecutionDispatcher dispatcher;
    private final TaskScheduler ticker;
    private final Clock clock;
    private final SchedulerProperties props;

    // tick 之间互斥（定时 tick 与手动 tick 不交叠）
    private final ReentrantLock tickLock = new ReentrantLock();

    private boolean running;
    private ScheduledFuture<?> armed;

    public SchedulerLoop(ScheduleRepo scheduleRepo,
                         DueEvaluator dueEvaluator,
                         ScheduleTriggerService triggerService,
                         ExecutionDispatcher dispatcher,
                         @Qualifier("schedulerTicker") TaskScheduler ticker,
                         Clock clock,
                         SchedulerProperties props) {
        this.scheduleRepo = scheduleRepo;
        this.dueEvaluator = dueEvaluator;
        this.triggerService = triggerService;
        this.dispatcher = dispatcher;
        this.ticker = ticker;
        this.clock = clock;
        this.props = props;
    }

    @Override
    public void start() {
        synchronized (this) {
            if (running) {
                log.info("Runbook scheduler is already running");
                return;
            }
            running = true;
        }

        Duration interval = props.getTickInterval();
        log.info("Starting runbook scheduler, tickInterval={}", interval);

        try {
            scheduledTick();
        } finally {
            // 首次 tick 失败也要挂上定时任务；stop() 可能在首次 tick 期间被调用
            synchronized (this) {
                if (running && armed == null) {
                    armed = ticker.scheduleAtFixedRate(this::scheduledTick, clock.instant().plus(interval), interval);
                }
            }
        }
    }

    @Override
    public synchronized void stop() {
        if (armed != null) {
            armed.cancel(false);
            armed = null;
        }
        if (running) {
            running = false;
            log.info("Runbook scheduler stopped");
        }
    }

    @Override
    public synchronized boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return props.isAutoStart();
    }

    /**
     * 对所有 active schedule 做一轮评估。每个 schedule 单独处理：
     * 某个 schedule 出错只记日志，继续处理下一个。
     */
    public TickSummary tick() {
        tickLock.lock();
        try {
            // cron 按分钟匹配，秒以下丢掉
            return doTick(ZonedDateTime.now(clock).truncatedTo(ChronoUnit.MINUTES));
        } finally {
            tickLock.unlock();
        }
    }

    private void scheduledTick() {
        try {
            tick();
        } catch (Throwable e) {
            // 异常逃出定时任务会让 ScheduledThreadPoolExecutor 静默取消后续所有 tick
            log.error("Scheduler tick error", e);
        }
    }

    private TickSummary doTick(ZonedDateTime now) {
        List<RunbookSchedule> schedules;
        try {
            schedules = scheduleRepo.findByActiveTrue();
        } catch (RuntimeException e) {
            log.error("Failed to list active schedules, tick aborted at {}", now, e);
            return TickSummary.aborted();
        }

        int fired = 0;
        int failed = 0;
        for (RunbookSchedule s : schedules) {
            try {
                if (!s.isActive() || !dueEvaluator.isDue(s, now)) continue;

                Optional<RunbookExecution> execution = triggerService.fire(s, now);
                if (execution.isPresent()) {
                    dispatcher.dispatch(execution.get());
                    fired++;
                }
            } catch (Throwable t) {
                failed++;
                log.error("Error processing schedule id={}, runbook={}", s.getId(), s.getRunbookId(), t);
            }
        }

        TickSummary summary = new TickSummary(false, schedules.size(), fired, failed);
        if (fired > 0 || failed > 0) {
            log.info("Scheduler tick at {}: {}", now, summary);
        } else {
            log.debug("Scheduler tick at {}: {}", now, summary);
        }
        return summary;
    }
}
