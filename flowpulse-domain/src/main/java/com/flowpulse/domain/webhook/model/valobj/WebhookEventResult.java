package com.flowpulse.domain.webhook.model.valobj;

/**
 * 单个入站子事件的处理结果。
 */
public record WebhookEventResult(String eventType,
                                 String entryId,
                                 String idempotencyId,
                                 boolean success,
                                 String message) {

    public static WebhookEventResult ok(CanonicalWebhookEvent event, String message) {
        return new WebhookEventResult(event.getEventType(), event.getEntryId(), event.getIdempotencyId(), true, message);
    }

    public static WebhookEventResult fail(CanonicalWebhookEvent event, String message) {
        return new WebhookEventResult(event.getEventType(), event.getEntryId(), event.getIdempotencyId(), false, message);
    }
}
