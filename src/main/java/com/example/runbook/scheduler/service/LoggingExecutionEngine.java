package com.example.runbook.scheduler.service;

import lombok.extern.slf4j.Slf4j;

/**
 * 没有注册 {@link ExecutionEngine} 时的默认实现：只记日志，execution 保持 QUEUED。
 */
@Slf4j
public class LoggingExecutionEngine implements ExecutionEngine {

    @Override
    public void execute(Long executionId, String actor) {
        log.info("No execution engine configured; execution id={} actor={} left QUEUED", executionId, actor);
    }
}
