package com.example.runbook.scheduler.timing;

import com.example.runbook.scheduler.config.SchedulerProperties;
import com.example.runbook.scheduler.domain.ScheduleFrequency;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

@Slf4j
@Component
public class NextRunCalculator {

    static final Duration FALLBACK = Duration.ofHours(24);

    private final CronMatcher cronMatcher;
    private final int probeLimit;

    @Autowired
    public NextRunCalculator(CronMatcher cronMatcher, SchedulerProperties props) {
        this(cronMatcher, props.getCronProbeLimit());
    }

    NextRunCalculator(CronMatcher cronMatcher, int probeLimit) {
        if (probeLimit <= 0) {
            throw new IllegalArgumentException("cron probe limit must be positive: " + probeLimit);
        }
        this.cronMatcher = cronMatcher;
        this.probeLimit = probeLimit;
    }

    /**
     * 计算严格晚于 {@code from} 的下一次运行时间。
     * <p>
     * 固定频率按时间线加时长；MONTHLY 取下个月同一天，超出月末时落在月末（1/31 → 2/28 或 2/29）。
     * CRON 逐分钟探测，最多探测配置的次数，找不到时回退到 {@code from + 24h}。
     */
    public ZonedDateTime computeNext(ScheduleFrequency frequency, String cronExpression, ZonedDateTime from) {
        if (frequency == null) {
            return from.plus(FALLBACK);
        }
        switch (frequency) {
            case HOURLY:
                return from.plus(Duration.ofHours(1));
            case DAILY:
                return from.plus(Duration.ofHours(24));
            case WEEKLY:
                return from.plus(Duration.ofDays(7));
            case MONTHLY:
                return from.plusMonths(1);
            case CRON:
                return nextCronOccurrence(cronExpression, from);
            default:
                return from.plus(FALLBACK);
        }
    }

    private ZonedDateTime nextCronOccurrence(String cronExpression, ZonedDateTime from) {
        if (!cronMatcher.isWellFormed(cronExpression)) {
            log.warn("Cannot probe invalid cron '{}', falling back to +{}h", cronExpression, FALLBACK.toHours());
            return from.plus(FALLBACK);
        }

        ZonedDateTime candidate = from.truncatedTo(ChronoUnit.MINUTES);
        for (int i = 0; i < probeLimit; i++) {
            candidate = candidate.plusMinutes(1);
            if (cronMatcher.matches(cronExpression, candidate)) {
                return candidate;
            }
        }

        log.debug("No match for cron '{}' within {} minutes of {}", cronExpression, probeLimit, from);
        return from.plus(FALLBACK);
    }
}
