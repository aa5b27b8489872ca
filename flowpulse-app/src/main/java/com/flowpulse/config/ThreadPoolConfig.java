package com.flowpulse.config;

import com.flowpulse.trigger.application.common.RetrySleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置。
 * <p>
 * webhookDispatchWorker 承载状态变更触发的外发 Webhook，使重试等待不阻塞迁移请求线程。
 * </p>
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ThreadPoolConfigProperties.class)
public class ThreadPoolConfig {

    @Bean(name = "webhookDispatchWorker", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "webhookDispatchWorker")
    public ThreadPoolExecutor webhookDispatchWorker(ThreadPoolConfigProperties properties) {
        int coreSize = Math.max(properties.getCorePoolSize(), 1);
        int maxSize = Math.max(properties.getMaxPoolSize(), coreSize);
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(properties.getThreadNamePrefix() + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(
                coreSize,
                maxSize,
                Math.max(properties.getKeepAliveTime(), 0L),
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(properties.getBlockQueueSize(), 1)),
                threadFactory,
                buildRejectedExecutionHandler(properties.getPolicy()));
    }

    /**
     * 外发与入站重试共用的等待策略。
     */
    @Bean
    @ConditionalOnMissingBean(RetrySleeper.class)
    public RetrySleeper retrySleeper() {
        return RetrySleeper.THREAD_SLEEP;
    }

    /**
     * 队列打满时先记录被拒的投递，再交给配置的策略处理；未知策略按 CallerRuns 回退到请求线程执行。
     */
    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        RejectedExecutionHandler delegate = resolvePolicy(policy);
        String policyName = delegate.getClass().getSimpleName();
        return (runnable, executor) -> {
            log.warn("Webhook dispatch rejected by worker pool. policy={}, poolSize={}, activeCount={}, queueSize={}",
                    policyName, executor.getPoolSize(), executor.getActiveCount(), executor.getQueue().size());
            delegate.rejectedExecution(runnable, executor);
        };
    }

    private RejectedExecutionHandler resolvePolicy(String policy) {
        String normalized = policy == null ? "" : policy.trim();
        if ("DiscardPolicy".equalsIgnoreCase(normalized)) {
            return new ThreadPoolExecutor.DiscardPolicy();
        }
        if ("AbortPolicy".equalsIgnoreCase(normalized)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        if (!"CallerRunsPolicy".equalsIgnoreCase(normalized)) {
            log.warn("Unsupported webhook worker rejection policy, using CallerRunsPolicy. policy={}", policy);
        }
        return new ThreadPoolExecutor.CallerRunsPolicy();
    }
}
