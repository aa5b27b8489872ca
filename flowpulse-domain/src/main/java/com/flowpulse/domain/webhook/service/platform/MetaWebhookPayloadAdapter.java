package com.flowpulse.domain.webhook.service.platform;

import com.flowpulse.domain.webhook.model.valobj.CanonicalWebhookEvent;
import com.flowpulse.domain.webhook.service.WebhookPayloadDomainService;
import com.flowpulse.types.enums.WebhookPlatformEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Meta：一次投递含 entry 列表，每个 entry 含 changes 列表，每个 change 是一个子事件。
 * 事件类型取顶层 object (page / user / instagram)。
 */
@Service
public class MetaWebhookPayloadAdapter implements IWebhookPayloadAdapter {

    private static final Set<String> HANDLED_EVENT_TYPES = Set.of("page", "user", "instagram");

    private final WebhookPayloadDomainService payloadDomainService;

    public MetaWebhookPayloadAdapter(WebhookPayloadDomainService payloadDomainService) {
        this.payloadDomainService = payloadDomainService;
    }

    @Override
    public WebhookPlatformEnum platform() {
        return WebhookPlatformEnum.META;
    }

    @Override
    public String signatureHeader() {
        return "X-Hub-Signature-256";
    }

    @Override
    public String signaturePrefix() {
        return "sha256=";
    }

    @Override
    public String eventTypeHeader() {
        return null;
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
        String eventType = StringUtils.defaultIfBlank(payloadDomainService.readText(body, "object"),
                StringUtils.defaultIfBlank(StringUtils.trimToNull(headerEventType), "unknown"));
        List<CanonicalWebhookEvent> events = new ArrayList<>();
        for (Map<String, Object> entry : payloadDomainService.readMapList(body, "entry")) {
            String entryId = payloadDomainService.readText(entry, "id");
            String entryTime = payloadDomainService.readText(entry, "time");
            List<Map<String, Object>> changes = payloadDomainService.readMapList(entry, "changes");
            for (int index = 0; index < changes.size(); index++) {
                Map<String, Object> change = changes.get(index);
                String field = payloadDomainService.readText(change, "field");
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("object", eventType);
                payload.put("field", field);
                payload.put("value", change.get("value"));
                payload.put("time", entryTime);
                events.add(CanonicalWebhookEvent.builder()
                        .platform(WebhookPlatformEnum.META)
                        .eventType(eventType)
                        .payload(payload)
                        .entryId(entryId)
                        .idempotencyId(String.join(":", "meta",
                                StringUtils.defaultString(entryId, "-"),
                                StringUtils.defaultString(entryTime, "-"),
                                String.valueOf(index),
                                StringUtils.defaultString(field, "-")))
                        .timestamp(receivedAt)
                        .build());
            }
        }
        return events;
    }
}
