package com.example.runbook.scheduler.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * runbook.scheduler.* 配置项
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "runbook.scheduler")
public class SchedulerProperties {

    /** 是否创建调度循环 */
    private boolean enabled = true;

    /** 随应用上下文自动启动 */
    private boolean autoStart = true;

    private Duration tickInterval = Duration.ofSeconds(60);

    /** 查找下一个 cron 匹配时逐分钟探测的上限 */
    private int cronProbeLimit = 1440;

    private final Dispatch dispatch = new Dispatch();

    @Getter
    @Setter
    public static class Dispatch {
        private int corePoolSize = 4;
        private Duration awaitTermination = Duration.ofSeconds(20);
    }
}
