package com.example.runbook.scheduler.timing;

import com.example.runbook.scheduler.domain.RunbookSchedule;
import com.example.runbook.scheduler.domain.ScheduleFrequency;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * 判断单个 schedule 在某一分钟是否到期，按顺序命中即返回：
 * <ol>
 *   <li>已到 {@code endsAt}：不再到期</li>
 *   <li>{@code nextRunAt} 有值：{@code nextRunAt <= now} 才到期</li>
 *   <li>有 cron 表达式：匹配 {@code now} 才到期</li>
 *   <li>有 {@code lastRunAt}：距上次运行超过频率阈值才到期</li>
 *   <li>其他情况：不到期</li>
 * </ol>
 * nextRunAt 有值时不再看 cron：刚触发过（nextRunAt 已推到未来）的 cron schedule
 * 在同一分钟内不会再次命中。
 * 没有被评估到的分钟直接跳过，不补跑。
 */
@Component
@RequiredArgsConstructor
public class DueEvaluator {

    private final CronMatcher cronMatcher;

    public boolean isDue(RunbookSchedule s, ZonedDateTime now) {
        if (isAtOrBefore(s.getEndsAt(), now)) {
            return false;
        }

        if (s.getNextRunAt() != null) {
            return isAtOrBefore(s.getNextRunAt(), now);
        }

        if (s.getCronExpression() != null) {
            return cronMatcher.matches(s.getCronExpression(), now);
        }

        if (s.getLastRunAt() != null) {
            long elapsedMinutes = Duration.between(s.getLastRunAt().toInstant(), now.toInstant()).toMinutes();
            long threshold = thresholdMinutes(s.getFrequency());
            return threshold > 0 && elapsedMinutes >= threshold;
        }

        return false;
    }

    static long thresholdMinutes(ScheduleFrequency frequency) {
        if (frequency == null) return -1;
        switch (frequency) {
            case HOURLY:
                return 60;
            case DAILY:
                return 1440;
            case WEEKLY:
                return 10080;
            case MONTHLY:
                return 43200;
            default:
                return -1;
        }
    }

    private static boolean isAtOrBefore(Timestamp ts, ZonedDateTime now) {
        return ts != null && !ts.toInstant().isAfter(now.toInstant());
    }
}
