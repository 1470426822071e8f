package com.example.runbook.scheduler.service;

public interface ExecutionEngine {
    /**
     * 执行一个已排队的 execution（在派发线程池中调用，可阻塞）。
     * 抛出的异常只会被记录，不会回滚 schedule 的 lastRunAt/nextRunAt。
     */
    void execute(Long executionId, String actor) throws Exception;
}
