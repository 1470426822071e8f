package com.example.runbook.scheduler.service;

import com.example.runbook.scheduler.domain.RunbookExecution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

/**
 * 投递到派发线程池后立即返回：调度循环不等待执行引擎，也拿不到执行结果。
 */
@Slf4j
@Service
public class ExecutionDispatcher {

    private final ExecutionEngine engine;
    private final TaskExecutor dispatchExec;

    public ExecutionDispatcher(ExecutionEngine engine, @Qualifier("dispatchExec") TaskExecutor dispatchExec) {
        this.engine = engine;
        this.dispatchExec = dispatchExec;
    }

    public void dispatch(RunbookExecution execution) {
        final Long executionId = execution.getId();
        final String actor = execution.getTriggeredBy();
        final String runbookId = execution.getRunbookId();

        log.info("Submit execution to dispatch pool: id={}, runbook={}", executionId, runbookId);
        dispatchExec.execute(() -> run(executionId, actor, runbookId));
    }

    private void run(Long executionId, String actor, String runbookId) {
        try {
            engine.execute(executionId, actor);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("Scheduled execution interrupted id={}, runbook={}", executionId, runbookId, ie);
        } catch (Exception e) {
            log.error("Scheduled execution error id={}, runbook={}", executionId, runbookId, e);
        }
    }
}
