package com.flowpulse.domain.webhook.model.valobj;

import com.flowpulse.types.enums.WebhookPlatformEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 归一化后的入站事件：{platform, event_type, payload, entry_id, idempotency_id, timestamp}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CanonicalWebhookEvent {

    private WebhookPlatformEnum platform;
    private String eventType;
    private Map<String, Object> payload;
    private String entryId;
    private String idempotencyId;
    private LocalDateTime timestamp;
}
