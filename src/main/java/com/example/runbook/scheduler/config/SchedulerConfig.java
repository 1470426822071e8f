package com.example.runbook.scheduler.config;

import com.example.runbook.scheduler.service.ExecutionEngine;
import com.example.runbook.scheduler.service.LoggingExecutionEngine;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(SchedulerProperties.class)
public class SchedulerConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * 单线程 ticker：保证同一时刻只有一个 tick 在跑
     */
    @Bean("schedulerTicker")
    public ThreadPoolTaskScheduler schedulerTicker() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(1);
        s.setThreadNamePrefix("sched-");
        s.setRemoveOnCancelPolicy(true);
        s.setWaitForTasksToCompleteOnShutdown(false);
        return s;
    }

    @Bean
    @ConditionalOnMissingBean(ExecutionEngine.class)
    public ExecutionEngine executionEngine() {
        return new LoggingExecutionEngine();
    }
}
