package com.flowpulse.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 调度器配置：daemonScheduler 承载推送心跳、全局巡检与保留期清理。
 */
@Slf4j
@EnableScheduling
@Configuration
public class SchedulingConfig {

    @Bean(name = "daemonScheduler")
    public ThreadPoolTaskScheduler daemonScheduler(
            @Value("${scheduling.daemon.pool-size:2}") int poolSize,
            @Value("${scheduling.daemon.thread-name-prefix:daemon-scheduler-}") String threadNamePrefix,
            @Value("${scheduling.daemon.await-termination-seconds:30}") int awaitTerminationSeconds) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(poolSize, 1));
        scheduler.setThreadNamePrefix(threadNamePrefix);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(Math.max(awaitTerminationSeconds, 0));
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(throwable ->
                log.error("Scheduled task execution failed. scheduler={}, error={}",
                        threadNamePrefix, throwable.getMessage(), throwable));
        return scheduler;
    }
}
