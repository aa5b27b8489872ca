package com.flowpulse.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 外发 Webhook 工作线程池参数，前缀 thread.pool.executor.config。
 */
@Data
@ConfigurationProperties(prefix = "thread.pool.executor.config", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数 */
    private Integer corePoolSize = 4;

    /** 最大线程数 */
    private Integer maxPoolSize = 16;

    /** 空闲线程存活时间（秒） */
    private Long keepAliveTime = 60L;

    /** 等待队列容量 */
    private Integer blockQueueSize = 1000;

    /**
     * 拒绝策略：AbortPolicy / DiscardPolicy / CallerRunsPolicy（默认）。DiscardOldest 会丢掉已排队的状态通知，不支持
     */
    private String policy = "CallerRunsPolicy";

    private String threadNamePrefix = "webhook-dispatch-";

}
