package com.example.runbook.scheduler.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Execution 派发线程池
 * - 无界队列：调度循环只负责投递，不感知执行引擎的快慢（没有背压，也没有结果回传）
 * - 核心线程可超时回收，空闲时更省资源
 */
@Configuration
public class DispatchPoolConfig {

    @Bean("dispatchExec")
    public ThreadPoolTaskExecutor dispatchExec(SchedulerProperties props) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();

        int core = Math.max(1, props.getDispatch().getCorePoolSize());
        e.setCorePoolSize(core);
        e.setMaxPoolSize(core);                   // 无界队列下 max 不生效，保持一致
        e.setQueueCapacity(Integer.MAX_VALUE);
        e.setKeepAliveSeconds(30);
        e.setAllowCoreThreadTimeOut(true);
        e.setThreadNamePrefix("dispatch-");

        // 优雅关闭：已投递的执行尽量跑完
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds((int) props.getDispatch().getAwaitTermination().getSeconds());

        return e;
    }
}
