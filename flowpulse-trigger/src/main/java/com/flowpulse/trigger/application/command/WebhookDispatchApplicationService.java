package com.flowpulse.trigger.application.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowpulse.api.dto.EmergencyDispatchRequestDTO;
import com.flowpulse.api.dto.EmergencyDispatchResponseDTO;
import com.flowpulse.api.dto.OrchestrationStatusDTO;
import com.flowpulse.api.dto.WebhookDispatchRequestDTO;
import com.flowpulse.api.dto.WebhookDispatchResponseDTO;
import com.flowpulse.api.dto.WebhookEndpointDTO;
import com.flowpulse.api.dto.WebhookEndpointRegisterRequestDTO;
import com.flowpulse.api.dto.WebhookEndpointRegisterResponseDTO;
import com.flowpulse.api.dto.WebhookErrorHandlingDTO;
import com.flowpulse.domain.state.model.entity.WorkflowStateEntity;
import com.flowpulse.domain.state.model.valobj.WorkflowStateChangedEvent;
import com.flowpulse.domain.webhook.adapter.gateway.IWebhookTransport;
import com.flowpulse.domain.webhook.adapter.repository.IWebhookDeliveryRepository;
import com.flowpulse.domain.webhook.adapter.repository.IWebhookEndpointRepository;
import com.flowpulse.domain.webhook.model.entity.WebhookDeliveryEntity;
import com.flowpulse.domain.webhook.model.entity.WebhookEndpointEntity;
import com.flowpulse.domain.webhook.model.valobj.DispatchSummary;
import com.flowpulse.domain.webhook.model.valobj.EmergencyDispatchCommand;
import com.flowpulse.domain.webhook.model.valobj.EmergencyDispatchResult;
import com.flowpulse.domain.webhook.model.valobj.OrchestrationStatus;
import com.flowpulse.domain.webhook.model.valobj.OutboundWebhookRequest;
import com.flowpulse.domain.webhook.model.valobj.WebhookErrorHandling;
import com.flowpulse.domain.webhook.model.valobj.WebhookSecurity;
import com.flowpulse.domain.webhook.service.WebhookDispatchDomainService;
import com.flowpulse.trigger.application.common.RetrySleeper;
import com.flowpulse.trigger.application.stream.RealtimeEventHub;
import com.flowpulse.trigger.application.webhook.WebhookGatewayProperties;
import com.flowpulse.trigger.event.WorkflowStateEventPublisher;
import com.flowpulse.types.common.Constants;
import com.flowpulse.types.enums.DeliveryDirectionEnum;
import com.flowpulse.types.enums.EmergencyPriorityEnum;
import com.flowpulse.types.enums.FallbackActionEnum;
import com.flowpulse.types.enums.ResponseCode;
import com.flowpulse.types.enums.WebhookAuthModeEnum;
import com.flowpulse.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 外发 Webhook 编排用例：端点注册、按触发类型分发（重试、间隔控制、兜底）、紧急投递与状态汇总。
 * <p>
 * 分发结果只通过返回值与计数器体现，下游失败不会抛给调用方。
 * </p>
 */
@Slf4j
@Service
public class WebhookDispatchApplicationService {

    private static final String STATE_SUBSCRIBER_ID = "webhook-dispatcher";
    private static final String DEFAULT_EMERGENCY_TRIGGER = "emergency";

    private final IWebhookEndpointRepository endpointRepository;
    private final IWebhookDeliveryRepository deliveryRepository;
    private final IWebhookTransport webhookTransport;
    private final WebhookDispatchDomainService dispatchDomainService;
    private final WebhookGatewayProperties gatewayProperties;
    private final RealtimeEventHub realtimeEventHub;
    private final WorkflowStateEventPublisher workflowStateEventPublisher;
    private final Executor dispatchExecutor;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Counter successCounter;
    private final Counter failureCounter;
    private final Counter retryCounter;
    private final ConcurrentMap<String, Long> lastDispatchAt = new ConcurrentHashMap<>();
    private final AtomicInteger queuedEvents = new AtomicInteger();
    private final RetrySleeper retrySleeper;

    public WebhookDispatchApplicationService(IWebhookEndpointRepository endpointRepository,
                                             IWebhookDeliveryRepository deliveryRepository,
                                             IWebhookTransport webhookTransport,
                                             WebhookDispatchDomainService dispatchDomainService,
                                             WebhookGatewayProperties gatewayProperties,
                                             RealtimeEventHub realtimeEventHub,
                                             WorkflowStateEventPublisher workflowStateEventPublisher,
                                             @Qualifier("webhookDispatchWorker") Executor dispatchExecutor,
                                             ObjectMapper objectMapper,
                                             Clock clock,
                                             RetrySleeper retrySleeper,
                                             ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.endpointRepository = endpointRepository;
        this.deliveryRepository = deliveryRepository;
        this.webhookTransport = webhookTransport;
        this.dispatchDomainService = dispatchDomainService;
        this.gatewayProperties = gatewayProperties;
        this.realtimeEventHub = realtimeEventHub;
        this.workflowStateEventPublisher = workflowStateEventPublisher;
        this.dispatchExecutor = dispatchExecutor;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.retrySleeper = retrySleeper;
        MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new);
        this.successCounter = Counter.builder("flowpulse.webhook.dispatch.success.total").register(meterRegistry);
        this.failureCounter = Counter.builder("flowpulse.webhook.dispatch.failure.total").register(meterRegistry);
        this.retryCounter = Counter.builder("flowpulse.webhook.dispatch.retry.total").register(meterRegistry);
    }

    @PostConstruct
    public void subscribeStateEvents() {
        workflowStateEventPublisher.subscribe(STATE_SUBSCRIBER_ID, this::onWorkflowStateChanged);
    }

    @PreDestroy
    public void unsubscribeStateEvents() {
        workflowStateEventPublisher.unsubscribe(STATE_SUBSCRIBER_ID);
    }

    public WebhookEndpointRegisterResponseDTO register(WebhookEndpointRegisterRequestDTO request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "Request body is required");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        WebhookEndpointEntity endpoint = new WebhookEndpointEntity();
        endpoint.setEndpointId(UUID.randomUUID().toString());
        endpoint.setName(StringUtils.trimToNull(request.getName()));
        endpoint.setUrl(StringUtils.trimToNull(request.getUrl()));
        endpoint.setMethod(dispatchDomainService.normalizeMethod(request.getMethod()));
        endpoint.setActive(request.getActive() == null || request.getActive());
        endpoint.setTriggers(request.getTriggers() == null ? new ArrayList<>() : new ArrayList<>(request.getTriggers()));
        endpoint.setTriggerCount(0L);
        endpoint.setSuccessCount(0L);
        endpoint.setErrorCount(0L);
        endpoint.setCreatedAt(now);
        endpoint.setUpdatedAt(now);
        try {
            endpoint.setSecurity(toSecurity(request));
            endpoint.setErrorHandling(toErrorHandling(request.getErrorHandling()));
            endpoint.validate();
        } catch (IllegalArgumentException | IllegalStateException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getMessage());
        }
        WebhookEndpointEntity saved = endpointRepository.save(endpoint);
        log.info("Webhook endpoint registered. endpointId={}, name={}, method={}, triggers={}",
                saved.getEndpointId(), saved.getName(), saved.getMethod(), saved.getTriggers());
        WebhookEndpointRegisterResponseDTO response = new WebhookEndpointRegisterResponseDTO();
        response.setEndpointId(saved.getEndpointId());
        return response;
    }

    public WebhookDispatchResponseDTO dispatch(WebhookDispatchRequestDTO request) {
        if (request == null || StringUtils.isBlank(request.getWorkflowId())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "workflowId is required");
        }
        if (StringUtils.isBlank(request.getTriggerType())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "triggerType is required");
        }
        DispatchSummary summary = dispatch(request.getWorkflowId().trim(), request.getTriggerType().trim(), request.getData());
        WebhookDispatchResponseDTO response = new WebhookDispatchResponseDTO();
        response.setSuccess(summary.success());
        response.setMatchedEndpoints(summary.matchedEndpoints());
        return response;
    }

    /**
     * 向所有匹配触发类型的活跃端点外发。
     */
    public DispatchSummary dispatch(String workflowId, String triggerType, Map<String, Object> data) {
        List<WebhookEndpointEntity> matched = dispatchDomainService.matchEndpoints(endpointRepository.findActive(), triggerType);
        if (matched.isEmpty()) {
            log.debug("No webhook endpoint matched. workflowId={}, triggerType={}", workflowId, triggerType);
            return new DispatchSummary(0, 0);
        }
        String body = serializeBody(workflowId, triggerType, data);
        if (body == null) {
            return new DispatchSummary(matched.size(), 0);
        }
        int succeeded = 0;
        for (WebhookEndpointEntity endpoint : matched) {
            if (deliver(endpoint, workflowId, triggerType, body, false, Long.MAX_VALUE)) {
                succeeded++;
            }
        }
        log.info("Webhook dispatch finished. workflowId={}, triggerType={}, matched={}, succeeded={}",
                workflowId, triggerType, matched.size(), succeeded);
        return new DispatchSummary(matched.size(), succeeded);
    }

    public EmergencyDispatchResponseDTO emergencyDispatch(EmergencyDispatchRequestDTO request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "Request body is required");
        }
        EmergencyPriorityEnum priority;
        try {
            priority = EmergencyPriorityEnum.fromCode(request.getPriorityLevel());
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getMessage());
        }
        EmergencyDispatchResult result = emergencyDispatch(EmergencyDispatchCommand.builder()
                .workflowId(request.getWorkflowId())
                .data(request.getData())
                .triggerType(request.getTriggerType())
                .priorityLevel(priority == null ? EmergencyPriorityEnum.HIGH : priority)
                .maxDelayMs(request.getMaxDelayMs())
                .overrideConflicts(Boolean.TRUE.equals(request.getOverrideConflicts()))
                .primaryEndpointId(request.getPrimaryEndpointId())
                .fallbackEndpointIds(request.getFallbackEndpointIds())
                .build());
        EmergencyDispatchResponseDTO response = new EmergencyDispatchResponseDTO();
        response.setSuccess(result.success());
        response.setPriorityLevel(result.priorityLevel().getCode());
        response.setDeliveredEndpointId(result.deliveredEndpointId());
        response.setAttemptedEndpointIds(result.attemptedEndpointIds());
        return response;
    }

    /**
     * 紧急投递：主端点优先，依次尝试备用端点，首个成功即停止；超过 maxDelayMs 放弃。
     */
    public EmergencyDispatchResult emergencyDispatch(EmergencyDispatchCommand command) {
        if (StringUtils.isBlank(command.getWorkflowId())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "workflowId is required");
        }
        if (StringUtils.isBlank(command.getPrimaryEndpointId())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "primaryEndpointId is required");
        }
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(command.getPrimaryEndpointId().trim());
        if (command.getFallbackEndpointIds() != null) {
            for (String fallbackId : command.getFallbackEndpointIds()) {
                if (StringUtils.isNotBlank(fallbackId)) {
                    candidates.add(fallbackId.trim());
                }
            }
        }
        EmergencyPriorityEnum priority = command.getPriorityLevel() == null ? EmergencyPriorityEnum.HIGH : command.getPriorityLevel();
        String workflowId = command.getWorkflowId().trim();
        String triggerType = StringUtils.defaultIfBlank(StringUtils.trimToNull(command.getTriggerType()), DEFAULT_EMERGENCY_TRIGGER);
        Long maxDelayMs = command.getMaxDelayMs();
        long deadline = maxDelayMs == null || maxDelayMs <= 0 ? Long.MAX_VALUE : clock.millis() + maxDelayMs;

        Map<String, Object> data = new LinkedHashMap<>();
        if (command.getData() != null) {
            data.putAll(command.getData());
        }
        data.put("priority_level", priority.getCode());
        String body = serializeBody(workflowId, triggerType, data);
        List<String> attempted = new ArrayList<>();
        if (body == null) {
            return new EmergencyDispatchResult(false, priority, null, attempted);
        }
        for (String endpointId : candidates) {
            if (!attempted.isEmpty() && clock.millis() > deadline) {
                log.warn("Emergency dispatch deadline exceeded. workflowId={}, priority={}, attempted={}",
                        workflowId, priority.getCode(), attempted);
                break;
            }
            attempted.add(endpointId);
            WebhookEndpointEntity endpoint = endpointRepository.findByEndpointId(endpointId);
            if (endpoint == null || !endpoint.isEnabled()) {
                log.warn("Emergency dispatch skipped unavailable endpoint. workflowId={}, endpointId={}", workflowId, endpointId);
                continue;
            }
            if (deliver(endpoint, workflowId, triggerType, body, command.isOverrideConflicts(), deadline)) {
                log.info("Emergency dispatch delivered. workflowId={}, priority={}, endpointId={}, attempts={}",
                        workflowId, priority.getCode(), endpointId, attempted.size());
                return new EmergencyDispatchResult(true, priority, endpointId, attempted);
            }
        }
        log.error("Emergency dispatch failed on all endpoints. workflowId={}, priority={}, attempted={}",
                workflowId, priority.getCode(), attempted);
        return new EmergencyDispatchResult(false, priority, null, attempted);
    }

    public List<WebhookEndpointDTO> listEndpoints() {
        List<WebhookEndpointDTO> result = new ArrayList<>();
        for (WebhookEndpointEntity endpoint : endpointRepository.findAll()) {
            result.add(toEndpointDTO(endpoint));
        }
        return result;
    }

    public OrchestrationStatusDTO statusView() {
        OrchestrationStatus status = status();
        OrchestrationStatusDTO dto = new OrchestrationStatusDTO();
        dto.setActiveEndpoints(status.activeEndpoints());
        dto.setTotalEndpoints(status.totalEndpoints());
        dto.setQueuedEvents(status.queuedEvents());
        dto.setProcessedEvents(status.processedEvents());
        dto.setFailedEvents(status.failedEvents());
        dto.setSystemHealth(status.systemHealth().getCode());
        return dto;
    }

    /**
     * 编排状态：端点数量 + 最近 24 小时投递统计。
     */
    public OrchestrationStatus status() {
        List<WebhookEndpointEntity> endpoints = endpointRepository.findAll();
        int active = 0;
        for (WebhookEndpointEntity endpoint : endpoints) {
            if (endpoint.isEnabled()) {
                active++;
            }
        }
        LocalDateTime since = LocalDateTime.now(clock).minusHours(24);
        long processed = deliveryRepository.countSince(since);
        long failed = deliveryRepository.countFailedSince(since);
        return new OrchestrationStatus(active, endpoints.size(), queuedEvents.get(), processed, failed,
                dispatchDomainService.evaluateHealth(processed, failed));
    }

    void onWorkflowStateChanged(WorkflowStateChangedEvent event) {
        WorkflowStateEntity state = event.state();
        String triggerType = event.triggerType();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("current_state", state.getCurrentState() == null ? null : state.getCurrentState().getCode());
        data.put("previous_state", state.getPreviousState() == null ? null : state.getPreviousState().getCode());
        data.put("transition_type", event.transition() == null || event.transition().getTransitionType() == null
                ? null : event.transition().getTransitionType().getCode());
        data.put("execution_id", state.getExecutionId());
        data.put("progress_percentage", state.getProgressPercentage());
        data.put("metadata", state.getMetadata());
        queuedEvents.incrementAndGet();
        try {
            dispatchExecutor.execute(() -> {
                try {
                    dispatch(state.getWorkflowId(), triggerType, data);
                } catch (RuntimeException ex) {
                    log.warn("Async webhook dispatch failed. workflowId={}, triggerType={}, error={}",
                            state.getWorkflowId(), triggerType, ex.getMessage(), ex);
                } finally {
                    queuedEvents.decrementAndGet();
                }
            });
        } catch (RejectedExecutionException ex) {
            queuedEvents.decrementAndGet();
            log.warn("Async webhook dispatch rejected. workflowId={}, triggerType={}, error={}",
                    state.getWorkflowId(), triggerType, ex.getMessage());
        }
    }

    /**
     * 单端点外发：最多 1 + retryAttempts 次；下一次等待会越过 deadlineMillis 时提前放弃。
     */
    private boolean deliver(WebhookEndpointEntity endpoint,
                            String workflowId,
                            String triggerType,
                            String body,
                            boolean bypassSpacing,
                            long deadlineMillis) {
        String endpointId = endpoint.getEndpointId();
        if (!bypassSpacing && !acquireDispatchSlot(endpointId)) {
            log.info("Webhook dispatch skipped by min interval. endpointId={}, triggerType={}, minIntervalMs={}",
                    endpointId, triggerType, gatewayProperties.getDispatch().getMinIntervalMs());
            failureCounter.increment();
            return false;
        }
        if (bypassSpacing) {
            lastDispatchAt.put(endpointId, clock.millis());
        }
        updateCounters("trigger", endpointId,
                () -> endpointRepository.incrementTriggerCount(endpointId, LocalDateTime.now(clock)));

        WebhookErrorHandling errorHandling = endpoint.effectiveErrorHandling();
        WebhookSecurity security = endpoint.getSecurity() == null ? WebhookSecurity.none() : endpoint.getSecurity();
        String secret = gatewayProperties.resolveSecret(security.getSecretRef());
        OutboundWebhookRequest request = new OutboundWebhookRequest(
                endpoint.getUrl(),
                dispatchDomainService.normalizeMethod(endpoint.getMethod()),
                dispatchDomainService.buildHeaders(security, secret, body),
                body);

        int maxAttempts = 1 + errorHandling.getRetryAttempts();
        int attempts = 0;
        String lastError = null;
        boolean success = false;
        while (attempts < maxAttempts) {
            attempts++;
            try {
                int status = webhookTransport.send(request);
                if (dispatchDomainService.isSuccessStatus(status)) {
                    success = true;
                    break;
                }
                lastError = "HTTP " + status;
            } catch (IOException | RuntimeException ex) {
                lastError = StringUtils.defaultIfBlank(ex.getMessage(), ex.getClass().getSimpleName());
            }
            log.debug("Webhook attempt failed. endpointId={}, attempt={}, maxAttempts={}, error={}",
                    endpointId, attempts, maxAttempts, lastError);
            if (attempts < maxAttempts) {
                long delayMs = errorHandling.getRetryDelayMs() == null ? 0L : Math.max(errorHandling.getRetryDelayMs(), 0L);
                if (deadlineMillis != Long.MAX_VALUE && clock.millis() + delayMs > deadlineMillis) {
                    lastError = StringUtils.defaultString(lastError) + " (deadline reached)";
                    log.info("Webhook retries stopped by deadline. endpointId={}, attempts={}, retryDelayMs={}",
                            endpointId, attempts, delayMs);
                    break;
                }
                retryCounter.increment();
                if (!pause(delayMs)) {
                    lastError = "interrupted";
                    break;
                }
            }
        }

        LocalDateTime finishedAt = LocalDateTime.now(clock);
        if (success) {
            updateCounters("success", endpointId, () -> endpointRepository.recordSuccess(endpointId, finishedAt));
            successCounter.increment();
            recordDelivery(endpointId, triggerType, true, attempts, null, finishedAt);
            return true;
        }
        updateCounters("error", endpointId, () -> endpointRepository.recordError(endpointId, finishedAt));
        failureCounter.increment();
        recordDelivery(endpointId, triggerType, false, attempts, lastError, finishedAt);
        applyFallback(endpoint, errorHandling.getFallbackAction(), workflowId, triggerType, attempts, lastError);
        return false;
    }

    private boolean acquireDispatchSlot(String endpointId) {
        long minIntervalMs = gatewayProperties.getDispatch().getMinIntervalMs();
        long now = clock.millis();
        if (minIntervalMs <= 0) {
            lastDispatchAt.put(endpointId, now);
            return true;
        }
        boolean[] acquired = {false};
        lastDispatchAt.compute(endpointId, (key, last) -> {
            if (last != null && now - last < minIntervalMs) {
                return last;
            }
            acquired[0] = true;
            return now;
        });
        return acquired[0];
    }

    /**
     * 端点计数写失败只记日志，外发结果以实际 HTTP 响应为准。
     */
    private void updateCounters(String counter, String endpointId, Runnable update) {
        try {
            update.run();
        } catch (RuntimeException ex) {
            log.warn("Webhook endpoint counter update failed. counter={}, endpointId={}, error={}",
                    counter, endpointId, ex.getMessage(), ex);
        }
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
            return false;
        }
    }

    private void applyFallback(WebhookEndpointEntity endpoint,
                               FallbackActionEnum action,
                               String workflowId,
                               String triggerType,
                               int attempts,
                               String lastError) {
        FallbackActionEnum fallback = action == null ? FallbackActionEnum.LOG : action;
        switch (fallback) {
            case IGNORE -> {
            }
            case LOG -> log.warn("Webhook dispatch exhausted retries. endpointId={}, name={}, workflowId={}, triggerType={}, attempts={}, error={}",
                    endpoint.getEndpointId(), endpoint.getName(), workflowId, triggerType, attempts, lastError);
            case ALERT -> {
                log.error("Webhook dispatch exhausted retries, raising alert. endpointId={}, name={}, workflowId={}, triggerType={}, attempts={}, error={}",
                        endpoint.getEndpointId(), endpoint.getName(), workflowId, triggerType, attempts, lastError);
                Map<String, Object> alert = new LinkedHashMap<>();
                alert.put("type", "webhook_failure");
                alert.put("endpoint_id", endpoint.getEndpointId());
                alert.put("endpoint_name", endpoint.getName());
                alert.put("workflow_id", workflowId);
                alert.put("trigger_type", triggerType);
                alert.put("attempts", attempts);
                alert.put("error", lastError);
                realtimeEventHub.broadcastToChannels(List.of(Constants.CHANNEL_ALERTS), alert);
            }
        }
    }

    private String serializeBody(String workflowId, String triggerType, Map<String, Object> data) {
        try {
            return objectMapper.writeValueAsString(
                    dispatchDomainService.buildBody(workflowId, triggerType, data, clock.instant()));
        } catch (JsonProcessingException ex) {
            log.warn("Webhook body serialization failed. workflowId={}, triggerType={}, error={}",
                    workflowId, triggerType, ex.getMessage());
            return null;
        }
    }

    private void recordDelivery(String endpointId,
                                String triggerType,
                                boolean success,
                                int attempts,
                                String message,
                                LocalDateTime createdAt) {
        WebhookDeliveryEntity delivery = new WebhookDeliveryEntity();
        delivery.setDirection(DeliveryDirectionEnum.OUTBOUND);
        delivery.setEndpointId(endpointId);
        delivery.setEventType(triggerType);
        delivery.setSuccess(success);
        delivery.setAttempts(attempts);
        delivery.setMessage(message);
        delivery.setCreatedAt(createdAt);
        try {
            deliveryRepository.save(delivery);
        } catch (RuntimeException ex) {
            log.warn("Webhook delivery record failed. direction=outbound, endpointId={}, error={}", endpointId, ex.getMessage());
        }
    }

    private WebhookSecurity toSecurity(WebhookEndpointRegisterRequestDTO request) {
        if (request.getSecurity() == null) {
            return WebhookSecurity.none();
        }
        WebhookAuthModeEnum mode = StringUtils.isBlank(request.getSecurity().getAuthentication())
                ? WebhookAuthModeEnum.NONE
                : WebhookAuthModeEnum.fromCode(request.getSecurity().getAuthentication());
        return WebhookSecurity.builder()
                .authentication(mode)
                .secretRef(StringUtils.trimToNull(request.getSecurity().getSecretRef()))
                .headerName(StringUtils.trimToNull(request.getSecurity().getHeaderName()))
                .build();
    }

    private WebhookErrorHandling toErrorHandling(WebhookErrorHandlingDTO dto) {
        if (dto == null) {
            return WebhookErrorHandling.defaults();
        }
        return WebhookErrorHandling.builder()
                .retryAttempts(dto.getRetryAttempts())
                .retryDelayMs(dto.getRetryDelay())
                .fallbackAction(StringUtils.isBlank(dto.getFallbackAction()) ? null : FallbackActionEnum.fromCode(dto.getFallbackAction()))
                .build()
                .withDefaults();
    }

    private WebhookEndpointDTO toEndpointDTO(WebhookEndpointEntity endpoint) {
        WebhookEndpointDTO dto = new WebhookEndpointDTO();
        dto.setEndpointId(endpoint.getEndpointId());
        dto.setName(endpoint.getName());
        dto.setUrl(endpoint.getUrl());
        dto.setMethod(endpoint.getMethod());
        dto.setActive(endpoint.isEnabled());
        dto.setStatus(endpoint.deriveStatus().getCode());
        dto.setTriggers(endpoint.getTriggers());
        WebhookErrorHandling errorHandling = endpoint.effectiveErrorHandling();
        WebhookErrorHandlingDTO errorHandlingDTO = new WebhookErrorHandlingDTO();
        errorHandlingDTO.setRetryAttempts(errorHandling.getRetryAttempts());
        errorHandlingDTO.setRetryDelay(errorHandling.getRetryDelayMs());
        errorHandlingDTO.setFallbackAction(errorHandling.getFallbackAction().getCode());
        dto.setErrorHandling(errorHandlingDTO);
        dto.setTriggerCount(endpoint.getTriggerCount());
        dto.setSuccessCount(endpoint.getSuccessCount());
        dto.setErrorCount(endpoint.getErrorCount());
        dto.setLastTriggered(endpoint.getLastTriggered());
        return dto;
    }
}
