package com.flowpulse.trigger.application.webhook;

import com.flowpulse.domain.state.model.valobj.TransitionCommand;
import com.flowpulse.domain.webhook.adapter.repository.IWebhookDeliveryRepository;
import com.flowpulse.domain.webhook.model.entity.WebhookDeliveryEntity;
import com.flowpulse.domain.webhook.model.valobj.CanonicalWebhookEvent;
import com.flowpulse.domain.webhook.model.valobj.WebhookEventResult;
import com.flowpulse.domain.webhook.service.WebhookPayloadDomainService;
import com.flowpulse.domain.webhook.service.platform.IWebhookPayloadAdapter;
import com.flowpulse.domain.webhook.service.platform.N8nWebhookPayloadAdapter;
import com.flowpulse.trigger.application.command.WorkflowStateCommandService;
import com.flowpulse.trigger.application.common.RetrySleeper;
import com.flowpulse.trigger.application.stream.RealtimeEventHub;
import com.flowpulse.types.common.Constants;
import com.flowpulse.types.enums.DeliveryDirectionEnum;
import com.flowpulse.types.enums.ResponseCode;
import com.flowpulse.types.enums.TransitionTypeEnum;
import com.flowpulse.types.enums.WebhookPlatformEnum;
import com.flowpulse.types.enums.WorkflowStateEnum;
import com.flowpulse.types.exception.AppException;
import com.google.common.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 标准化入站事件处理器。
 * <p>
 * 按 idempotency_id 去重；n8n 执行事件驱动状态迁移，其余已知事件在 webhooks 频道广播。
 * 每个事件的处理结果都会写入投递记录。
 * </p>
 * <p>
 * 版本冲突与存储异常视为暂时失败，按 webhook.inbound 配置在当前线程同步重试；
 * 参数错误、非法迁移、未知事件类型直接失败。
 * </p>
 */
@Slf4j
@Service
public class WebhookEventProcessor {

    public static final String DUPLICATE_MESSAGE = "duplicate ignored";

    private static final Map<String, WorkflowStateEnum> N8N_TARGET_STATES = Map.of(
            N8nWebhookPayloadAdapter.EXECUTION_STARTED, WorkflowStateEnum.RUNNING,
            N8nWebhookPayloadAdapter.EXECUTION_COMPLETED, WorkflowStateEnum.COMPLETED,
            N8nWebhookPayloadAdapter.EXECUTION_FAILED, WorkflowStateEnum.FAILED);

    private static final Map<String, TransitionTypeEnum> N8N_TRANSITION_TYPES = Map.of(
            N8nWebhookPayloadAdapter.EXECUTION_STARTED, TransitionTypeEnum.START,
            N8nWebhookPayloadAdapter.EXECUTION_COMPLETED, TransitionTypeEnum.COMPLETE,
            N8nWebhookPayloadAdapter.EXECUTION_FAILED, TransitionTypeEnum.FAIL);

    private final Cache<String, Boolean> idempotencyCache;
    private final WorkflowStateCommandService workflowStateCommandService;
    private final RealtimeEventHub realtimeEventHub;
    private final IWebhookDeliveryRepository deliveryRepository;
    private final WebhookPayloadDomainService payloadDomainService;
    private final WebhookGatewayProperties gatewayProperties;
    private final RetrySleeper retrySleeper;
    private final Clock clock;

    public WebhookEventProcessor(@Qualifier("webhookIdempotencyCache") Cache<String, Boolean> idempotencyCache,
                                 WorkflowStateCommandService workflowStateCommandService,
                                 RealtimeEventHub realtimeEventHub,
                                 IWebhookDeliveryRepository deliveryRepository,
                                 WebhookPayloadDomainService payloadDomainService,
                                 WebhookGatewayProperties gatewayProperties,
                                 RetrySleeper retrySleeper,
                                 Clock clock) {
        this.idempotencyCache = idempotencyCache;
        this.workflowStateCommandService = workflowStateCommandService;
        this.realtimeEventHub = realtimeEventHub;
        this.deliveryRepository = deliveryRepository;
        this.payloadDomainService = payloadDomainService;
        this.gatewayProperties = gatewayProperties;
        this.retrySleeper = retrySleeper;
        this.clock = clock;
    }

    public WebhookEventResult process(CanonicalWebhookEvent event, IWebhookPayloadAdapter adapter) {
        String idempotencyId = StringUtils.trimToNull(event.getIdempotencyId());
        if (idempotencyId != null && idempotencyCache.asMap().putIfAbsent(idempotencyId, Boolean.TRUE) != null) {
            log.info("Webhook event duplicate ignored. platform={}, eventType={}, idempotencyId={}",
                    event.getPlatform().getCode(), event.getEventType(), idempotencyId);
            return WebhookEventResult.ok(event, DUPLICATE_MESSAGE);
        }
        WebhookGatewayProperties.Inbound inbound = gatewayProperties.getInbound();
        int maxAttempts = 1 + Math.max(inbound.getRetryAttempts(), 0);
        int attempts = 0;
        WebhookEventResult result = null;
        while (attempts < maxAttempts) {
            attempts++;
            boolean retryable;
            try {
                result = handle(event, adapter);
                break;
            } catch (AppException ex) {
                result = WebhookEventResult.fail(event, ex.getInfo());
                retryable = ResponseCode.CONFLICT.getCode().equals(ex.getCode());
            } catch (RuntimeException ex) {
                log.warn("Webhook event handling failed. platform={}, eventType={}, idempotencyId={}, attempt={}, error={}",
                        event.getPlatform().getCode(), event.getEventType(), idempotencyId, attempts, ex.getMessage(), ex);
                result = WebhookEventResult.fail(event, StringUtils.defaultIfBlank(ex.getMessage(), ex.getClass().getSimpleName()));
                retryable = true;
            }
            if (!retryable || attempts >= maxAttempts) {
                break;
            }
            log.info("Webhook event retry scheduled. platform={}, eventType={}, idempotencyId={}, attempt={}, maxAttempts={}, retryDelayMs={}",
                    event.getPlatform().getCode(), event.getEventType(), idempotencyId, attempts, maxAttempts,
                    inbound.getRetryDelayMs());
            if (!pause(inbound.getRetryDelayMs())) {
                result = WebhookEventResult.fail(event, "interrupted");
                break;
            }
        }
        if (!result.success() && idempotencyId != null) {
            idempotencyCache.invalidate(idempotencyId);
        }
        recordDelivery(event, result, attempts);
        return result;
    }

    private boolean pause(long delayMs) {
        if (delayMs <= 0) {
            return true;
        }
        try {
            retrySleeper.sleep(delayMs);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Webhook event retry interrupted. delayMs={}", delayMs);
            return false;
        }
    }

    private WebhookEventResult handle(CanonicalWebhookEvent event, IWebhookPayloadAdapter adapter) {
        String eventType = event.getEventType();
        if (eventType == null || !adapter.handledEventTypes().contains(eventType)) {
            return WebhookEventResult.fail(event,
                    "Unhandled " + event.getPlatform().getCode() + " event type: " + eventType);
        }
        if (event.getPlatform() == WebhookPlatformEnum.N8N && N8N_TARGET_STATES.containsKey(eventType)) {
            return applyExecutionTransition(event);
        }
        int recipients = realtimeEventHub.broadcastToChannels(List.of(Constants.CHANNEL_WEBHOOKS), broadcastPayload(event));
        log.info("Webhook event broadcast. platform={}, eventType={}, entryId={}, recipients={}",
                event.getPlatform().getCode(), eventType, event.getEntryId(), recipients);
        return WebhookEventResult.ok(event, "broadcast");
    }

    private WebhookEventResult applyExecutionTransition(CanonicalWebhookEvent event) {
        String workflowId = StringUtils.trimToNull(event.getEntryId());
        if (workflowId == null) {
            return WebhookEventResult.fail(event, "Missing workflow id in n8n payload");
        }
        String eventType = event.getEventType();
        Map<String, Object> execution = payloadDomainService.readMap(event.getPayload(), "execution");
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source", WebhookPlatformEnum.N8N.getCode());
        metadata.put("event_type", eventType);
        String executionId = payloadDomainService.readText(execution, "id");
        workflowStateCommandService.applyTransition(TransitionCommand.builder()
                .workflowId(workflowId)
                .newState(N8N_TARGET_STATES.get(eventType).getCode())
                .transitionType(N8N_TRANSITION_TYPES.get(eventType).getCode())
                .executionId(executionId)
                .metadata(metadata)
                .triggeredBy("webhook:" + WebhookPlatformEnum.N8N.getCode())
                .build());
        return WebhookEventResult.ok(event, "state updated to " + N8N_TARGET_STATES.get(eventType).getCode());
    }

    private Map<String, Object> broadcastPayload(CanonicalWebhookEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("platform", event.getPlatform().getCode());
        payload.put("event_type", event.getEventType());
        payload.put("entry_id", event.getEntryId());
        payload.put("payload", payloadDomainService.sanitize(event.getPayload()));
        payload.put("timestamp", event.getTimestamp() == null ? null : event.getTimestamp().toString());
        return payload;
    }

    private void recordDelivery(CanonicalWebhookEvent event, WebhookEventResult result, int attempts) {
        WebhookDeliveryEntity delivery = new WebhookDeliveryEntity();
        delivery.setDirection(DeliveryDirectionEnum.INBOUND);
        delivery.setPlatform(event.getPlatform().getCode());
        delivery.setEventType(event.getEventType());
        delivery.setIdempotencyId(event.getIdempotencyId());
        delivery.setSuccess(result.success());
        delivery.setAttempts(attempts);
        delivery.setMessage(result.message());
        delivery.setCreatedAt(LocalDateTime.now(clock));
        try {
            deliveryRepository.save(delivery);
        } catch (RuntimeException ex) {
            log.warn("Webhook delivery record failed. direction=inbound, platform={}, idempotencyId={}, error={}",
                    event.getPlatform().getCode(), event.getIdempotencyId(), ex.getMessage());
        }
    }
}
