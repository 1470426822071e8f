package com.example.runbook.scheduler.timing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;

/**
 * 5 字段 cron 匹配：minute hour day-of-month month day-of-week（0 = Sunday）。
 * <p>
 * 每个字段支持 {@code *}、列表（{@code 1,3,5}）、区间（{@code 9-17}）和步长
 * （{@code *}{@code /15}，左侧忽略），按此顺序取第一个命中的形式。
 * 五个字段全部取 AND，day-of-month 与 day-of-week 也不例外。
 * <p>
 * 非法输入不抛异常：字段数不对时记 WARN 日志并视为不匹配。
 */
@Slf4j
@Component
public class CronMatcher {

    public static final int FIELD_COUNT = 5;

    public boolean matches(String expression, ZonedDateTime at) {
        String[] parts = split(expression);
        if (parts.length != FIELD_COUNT) {
            log.warn("Invalid cron expression (expected {} fields): '{}'", FIELD_COUNT, expression);
            return false;
        }

        return matchesField(parts[0], at.getMinute())
                && matchesField(parts[1], at.getHour())
                && matchesField(parts[2], at.getDayOfMonth())
                && matchesField(parts[3], at.getMonthValue())
                && matchesField(parts[4], at.getDayOfWeek().getValue() % 7);
    }

    public boolean isWellFormed(String expression) {
        return split(expression).length == FIELD_COUNT;
    }

    boolean matchesField(String field, int value) {
        try {
            if ("*".equals(field)) return true;

            if (field.contains(",")) {
                for (String item : field.split(",")) {
                    if (Integer.parseInt(item.trim()) == value) return true;
                }
                return false;
            }

            if (field.contains("-")) {
                String[] range = field.split("-");
                if (range.length != 2) return false;
                int lo = Integer.parseInt(range[0].trim());
                int hi = Integer.parseInt(range[1].trim());
                return value >= lo && value <= hi;
            }

            if (field.contains("/")) {
                String[] step = field.split("/");
                if (step.length != 2) return false;
                int n = Integer.parseInt(step[1].trim());
                return n > 0 && value % n == 0;
            }

            return Integer.parseInt(field) == value;
        } catch (NumberFormatException e) {
            log.debug("Unparseable cron field '{}' treated as non-matching", field);
            return false;
        }
    }

    private static String[] split(String expression) {
        if (expression == null || expression.trim().isEmpty()) return new String[0];
        return expression.trim().split("\\s+");
    }
}
