package com.flowpulse.infrastructure.repository.webhook;

import com.flowpulse.domain.webhook.adapter.repository.IWebhookDeliveryRepository;
import com.flowpulse.domain.webhook.model.entity.WebhookDeliveryEntity;
import com.flowpulse.infrastructure.dao.WebhookDeliveryDao;
import com.flowpulse.infrastructure.dao.po.WebhookDeliveryPO;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

/**
 * Webhook 投递记录仓储实现
 *
 * @author flowpulse
 * @since 2026-10-19
 */
@Repository
public class WebhookDeliveryRepositoryImpl implements IWebhookDeliveryRepository {

    private static final int MESSAGE_MAX_LENGTH = 1000;

    private final WebhookDeliveryDao webhookDeliveryDao;

    public WebhookDeliveryRepositoryImpl(WebhookDeliveryDao webhookDeliveryDao) {
        this.webhookDeliveryDao = webhookDeliveryDao;
    }

    @Override
    public WebhookDeliveryEntity save(WebhookDeliveryEntity entity) {
        WebhookDeliveryPO po = WebhookDeliveryPO.builder()
                .direction(entity.getDirection().getCode())
                .platform(entity.getPlatform())
                .endpointId(entity.getEndpointId())
                .eventType(entity.getEventType())
                .idempotencyId(entity.getIdempotencyId())
                .success(Boolean.TRUE.equals(entity.getSuccess()))
                .attempts(entity.getAttempts() == null ? 0 : entity.getAttempts())
                .message(StringUtils.abbreviate(entity.getMessage(), MESSAGE_MAX_LENGTH))
                .createdAt(entity.getCreatedAt())
                .build();
        webhookDeliveryDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public long countSince(LocalDateTime since) {
        return webhookDeliveryDao.countSince(since);
    }

    @Override
    public long countFailedSince(LocalDateTime since) {
        return webhookDeliveryDao.countFailedSince(since);
    }
}
