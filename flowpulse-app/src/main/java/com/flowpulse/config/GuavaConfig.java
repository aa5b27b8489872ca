package com.flowpulse.config;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Guava 本地缓存配置。
 */
@Configuration
public class GuavaConfig {

    /**
     * 入站 Webhook 幂等缓存：idempotency_id → 已处理标记，写入后按 TTL 过期。
     */
    @Bean(name = "webhookIdempotencyCache")
    public Cache<String, Boolean> webhookIdempotencyCache(
            @Value("${webhook.idempotency.ttl-minutes:60}") long ttlMinutes,
            @Value("${webhook.idempotency.maximum-size:10000}") long maximumSize) {
        return CacheBuilder.newBuilder()
                .expireAfterWrite(Math.max(ttlMinutes, 1L), TimeUnit.MINUTES)
                .maximumSize(Math.max(maximumSize, 1L))
                .build();
    }

}
