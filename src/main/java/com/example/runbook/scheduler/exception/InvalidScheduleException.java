package com.example.runbook.scheduler.exception;

/**
 * 请求不满足 schedule 校验规则（缺字段、CRON 缺表达式、inputParams 非法等）。
 */
public class InvalidScheduleException extends RuntimeException {

    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
