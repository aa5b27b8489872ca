package com.flowpulse.test.support;

import com.flowpulse.domain.webhook.adapter.repository.IWebhookDeliveryRepository;
import com.flowpulse.domain.webhook.model.entity.WebhookDeliveryEntity;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 内存投递记录仓储。
 */
public class InMemoryWebhookDeliveryRepository implements IWebhookDeliveryRepository {

    private final List<WebhookDeliveryEntity> store = new ArrayList<>();
    private long nextId = 1;

    @Override
    public synchronized WebhookDeliveryEntity save(WebhookDeliveryEntity entity) {
        if (entity.getId() == null) {
            entity.setId(nextId++);
        }
        store.add(entity);
        return entity;
    }

    @Override
    public synchronized long countSince(LocalDateTime since) {
        return store.stream().filter(item -> !item.getCreatedAt().isBefore(since)).count();
    }

    @Override
    public synchronized long countFailedSince(LocalDateTime since) {
        return store.stream()
                .filter(item -> !item.getCreatedAt().isBefore(since))
                .filter(item -> !Boolean.TRUE.equals(item.getSuccess()))
                .count();
    }

    public synchronized List<WebhookDeliveryEntity> findAll() {
        return new ArrayList<>(store);
    }
}
