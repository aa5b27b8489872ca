package com.flowpulse.domain.webhook.service.platform;

import com.flowpulse.domain.webhook.model.valobj.CanonicalWebhookEvent;
import com.flowpulse.domain.webhook.service.WebhookPayloadDomainService;
import com.flowpulse.domain.webhook.service.WebhookSignatureDomainService;
import com.flowpulse.types.enums.WebhookPlatformEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * n8n：工作流执行回调。未携带事件头时按 execution.status / workflow 字段推导事件类型。
 */
@Service
public class N8nWebhookPayloadAdapter implements IWebhookPayloadAdapter {

    public static final String EXECUTION_STARTED = "execution_started";
    public static final String EXECUTION_COMPLETED = "execution_completed";
    public static final String EXECUTION_FAILED = "execution_failed";
    public static final String WORKFLOW_UPDATED = "workflow_updated";

    private static final Set<String> HANDLED_EVENT_TYPES = Set.of(
            EXECUTION_STARTED, EXECUTION_COMPLETED, EXECUTION_FAILED, WORKFLOW_UPDATED);

    private final WebhookPayloadDomainService payloadDomainService;
    private final WebhookSignatureDomainService signatureDomainService;

    public N8nWebhookPayloadAdapter(WebhookPayloadDomainService payloadDomainService,
                                    WebhookSignatureDomainService signatureDomainService) {
        this.payloadDomainService = payloadDomainService;
        this.signatureDomainService = signatureDomainService;
    }

    @Override
    public WebhookPlatformEnum platform() {
        return WebhookPlatformEnum.N8N;
    }

    @Override
    public String signatureHeader() {
        return "X-N8N-Signature";
    }

    @Override
    public String signaturePrefix() {
        return "";
    }

    @Override
    public String eventTypeHeader() {
        return "X-N8N-Event";
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
        String eventType = StringUtils.defaultIfBlank(StringUtils.trimToNull(headerEventType), determineEventType(body));
        Map<String, Object> workflow = payloadDomainService.readMap(body, "workflow");
        Map<String, Object> execution = payloadDomainService.readMap(body, "execution");
        String workflowId = StringUtils.defaultIfBlank(
                payloadDomainService.readText(body, "workflowId", "workflow_id"),
                payloadDomainService.readText(workflow, "id"));
        String executionId = StringUtils.defaultIfBlank(
                payloadDomainService.readText(execution, "id"),
                payloadDomainService.readText(body, "executionId", "execution_id"));
        String idempotencyId = StringUtils.isNotBlank(executionId)
                ? "n8n:" + executionId + ":" + eventType
                : "n8n:" + signatureDomainService.sha256Hex(rawBody);
        return List.of(CanonicalWebhookEvent.builder()
                .platform(WebhookPlatformEnum.N8N)
                .eventType(eventType)
                .payload(body)
                .entryId(workflowId)
                .idempotencyId(idempotencyId)
                .timestamp(receivedAt)
                .build());
    }

    public String determineEventType(Map<String, Object> body) {
        Map<String, Object> execution = payloadDomainService.readMap(body, "execution");
        String status = StringUtils.trimToEmpty(payloadDomainService.readText(execution, "status")).toLowerCase(Locale.ROOT);
        switch (status) {
            case "running":
                return EXECUTION_STARTED;
            case "success":
                return EXECUTION_COMPLETED;
            case "error":
                return EXECUTION_FAILED;
            default:
                break;
        }
        if (body != null && body.get("workflow") instanceof Map<?, ?>) {
            return WORKFLOW_UPDATED;
        }
        return "unknown";
    }
}
