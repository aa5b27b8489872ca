package com.flowpulse.domain.webhook.service.platform;

import com.flowpulse.domain.webhook.model.valobj.CanonicalWebhookEvent;
import com.flowpulse.domain.webhook.service.WebhookPayloadDomainService;
import com.flowpulse.domain.webhook.service.WebhookSignatureDomainService;
import com.flowpulse.types.enums.WebhookPlatformEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Kajabi：单事件投递，签名为十六进制 HMAC-SHA256。
 */
@Service
public class KajabiWebhookPayloadAdapter implements IWebhookPayloadAdapter {

    private static final Set<String> HANDLED_EVENT_TYPES = Set.of(
            "person.created", "person.updated", "person.deleted", "purchase.created", "purchase.updated");

    private final WebhookPayloadDomainService payloadDomainService;
    private final WebhookSignatureDomainService signatureDomainService;

    public KajabiWebhookPayloadAdapter(WebhookPayloadDomainService payloadDomainService,
                                       WebhookSignatureDomainService signatureDomainService) {
        this.payloadDomainService = payloadDomainService;
        this.signatureDomainService = signatureDomainService;
    }

    @Override
    public WebhookPlatformEnum platform() {
        return WebhookPlatformEnum.KAJABI;
    }

    @Override
    public String signatureHeader() {
        return "X-Kajabi-Signature";
    }

    @Override
    public String signaturePrefix() {
        return "";
    }

    @Override
    public String eventTypeHeader() {
        return "X-Kajabi-Event";
    }

    @Override
    public Set<String> handledEventTypes() {
        return HANDLED_EVENT_TYPES;
    }

    @Override
    public List<CanonicalWebhookEvent> normalize(String rawBody,
                                                 Map<String, Object> body,
                                                 String headerEventType,
                                                 LocalDateTime receivedAt) {
        String eventType = StringUtils.defaultIfBlank(StringUtils.trimToNull(headerEventType),
                StringUtils.defaultIfBlank(payloadDomainService.readText(body, "event", "event_type", "type"), "unknown"));
        Map<String, Object> data = payloadDomainService.readMap(body, "data");
        Map<String, Object> payload = data.isEmpty() ? body : data;
        String entryId = payloadDomainService.readText(payload, "id");
        String deliveryId = payloadDomainService.readText(body, "event_id", "id");
        String idempotencyId = "kajabi:" + StringUtils.defaultIfBlank(deliveryId, signatureDomainService.sha256Hex(rawBody));
        return List.of(CanonicalWebhookEvent.builder()
                .platform(WebhookPlatformEnum.KAJABI)
                .eventType(eventType)
                .payload(payload)
                .entryId(entryId)
                .idempotencyId(idempotencyId)
                .timestamp(receivedAt)
                .build());
    }
}
