package com.flowpulse.domain.webhook.adapter.repository;

import com.flowpulse.domain.webhook.model.entity.WebhookEndpointEntity;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 外发端点仓储接口，计数器通过单行原子自增更新
 *
 * @author flowpulse
 * @since 2026-10-19
 */
public interface IWebhookEndpointRepository {

    WebhookEndpointEntity save(WebhookEndpointEntity entity);

    WebhookEndpointEntity findByEndpointId(String endpointId);

    List<WebhookEndpointEntity> findAll();

    List<WebhookEndpointEntity> findActive();

    /**
     * trigger_count + 1
     */
    void incrementTriggerCount(String endpointId, LocalDateTime now);

    /**
     * success_count + 1 并刷新 last_triggered
     */
    void recordSuccess(String endpointId, LocalDateTime now);

    /**
     * error_count + 1
     */
    void recordError(String endpointId, LocalDateTime now);
}
