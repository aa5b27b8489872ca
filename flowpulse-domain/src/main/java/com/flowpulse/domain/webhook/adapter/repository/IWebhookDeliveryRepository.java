package com.flowpulse.domain.webhook.adapter.repository;

import com.flowpulse.domain.webhook.model.entity.WebhookDeliveryEntity;

import java.time.LocalDateTime;

/**
 * Webhook 投递记录仓储接口
 *
 * @author flowpulse
 * @since 2026-10-19
 */
public interface IWebhookDeliveryRepository {

    WebhookDeliveryEntity save(WebhookDeliveryEntity entity);

    long countSince(LocalDateTime since);

    long countFailedSince(LocalDateTime since);
}
