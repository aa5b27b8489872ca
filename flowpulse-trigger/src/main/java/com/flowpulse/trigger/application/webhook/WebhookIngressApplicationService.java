package com.flowpulse.trigger.application.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowpulse.api.dto.WebhookEventResultDTO;
import com.flowpulse.api.dto.WebhookIngressResponseDTO;
import com.flowpulse.domain.webhook.model.valobj.CanonicalWebhookEvent;
import com.flowpulse.domain.webhook.model.valobj.WebhookEventResult;
import com.flowpulse.domain.webhook.service.WebhookSignatureDomainService;
import com.flowpulse.domain.webhook.service.platform.IWebhookPayloadAdapter;
import com.flowpulse.types.enums.ResponseCode;
import com.flowpulse.types.enums.WebhookPlatformEnum;
import com.flowpulse.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 入站 Webhook 用例：验签、解析、归一化、逐事件处理，以及订阅握手。
 */
@Slf4j
@Service
public class WebhookIngressApplicationService {

    private static final String SUBSCRIBE_MODE = "subscribe";

    private final Map<WebhookPlatformEnum, IWebhookPayloadAdapter> adapters = new EnumMap<>(WebhookPlatformEnum.class);
    private final WebhookEventProcessor eventProcessor;
    private final WebhookSignatureDomainService signatureDomainService;
    private final WebhookGatewayProperties gatewayProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public WebhookIngressApplicationService(List<IWebhookPayloadAdapter> payloadAdapters,
                                            WebhookEventProcessor eventProcessor,
                                            WebhookSignatureDomainService signatureDomainService,
                                            WebhookGatewayProperties gatewayProperties,
                                            ObjectMapper objectMapper,
                                            Clock clock) {
        for (IWebhookPayloadAdapter adapter : payloadAdapters) {
            adapters.put(adapter.platform(), adapter);
        }
        this.eventProcessor = eventProcessor;
        this.signatureDomainService = signatureDomainService;
        this.gatewayProperties = gatewayProperties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * 处理一次入站投递。全部成功返回 200，部分失败返回 207。
     */
    public IngressOutcome receive(String platform, String rawBody, HttpHeaders headers) {
        IWebhookPayloadAdapter adapter = requireAdapter(platform);
        String code = adapter.platform().getCode();
        String signature = headers == null ? null : headers.getFirst(adapter.signatureHeader());
        if (!signatureDomainService.verify(gatewayProperties.platformSecret(code), rawBody, signature, adapter.signaturePrefix())) {
            log.warn("Webhook signature rejected. platform={}, signaturePresent={}", code, StringUtils.isNotBlank(signature));
            throw new AppException(ResponseCode.UNAUTHORIZED.getCode(), "Invalid webhook signature");
        }
        Map<String, Object> body = parseBody(rawBody);
        String headerEventType = adapter.eventTypeHeader() == null || headers == null
                ? null
                : headers.getFirst(adapter.eventTypeHeader());
        List<CanonicalWebhookEvent> events = adapter.normalize(rawBody, body, headerEventType, LocalDateTime.now(clock));

        List<WebhookEventResultDTO> results = new ArrayList<>();
        int failed = 0;
        for (CanonicalWebhookEvent event : events) {
            WebhookEventResult result = eventProcessor.process(event, adapter);
            if (!result.success()) {
                failed++;
            }
            results.add(toResultDTO(result));
        }
        WebhookIngressResponseDTO response = new WebhookIngressResponseDTO();
        response.setResults(results);
        log.info("Webhook delivery processed. platform={}, events={}, failed={}", code, events.size(), failed);
        if (failed == 0) {
            response.setSuccess(true);
            response.setMessage(events.isEmpty() ? "No events to process" : "Processed " + events.size() + " events");
            return new IngressOutcome(HttpStatus.OK.value(), response);
        }
        response.setSuccess(false);
        response.setMessage(failed + " of " + events.size() + " events failed");
        return new IngressOutcome(HttpStatus.MULTI_STATUS.value(), response);
    }

    /**
     * 订阅握手：mode=subscribe 且令牌一致时回显 challenge，其余一律 403；
     * 平台未配置 verify token 时同样拒绝。
     */
    public String handshake(String platform, String mode, String verifyToken, String challenge) {
        IWebhookPayloadAdapter adapter = requireAdapter(platform);
        String code = adapter.platform().getCode();
        String expected = gatewayProperties.platformVerifyToken(code);
        if (expected == null) {
            log.warn("Webhook handshake rejected, verify token not configured. platform={}", code);
            throw new AppException(ResponseCode.FORBIDDEN.getCode(), "Webhook verification failed");
        }
        if (!SUBSCRIBE_MODE.equals(StringUtils.trimToEmpty(mode))
                || !signatureDomainService.constantTimeEquals(expected, StringUtils.trimToNull(verifyToken))) {
            log.warn("Webhook handshake rejected. platform={}, mode={}", code, mode);
            throw new AppException(ResponseCode.FORBIDDEN.getCode(), "Webhook verification failed");
        }
        log.info("Webhook handshake accepted. platform={}", code);
        return StringUtils.defaultString(challenge);
    }

    private IWebhookPayloadAdapter requireAdapter(String platform) {
        WebhookPlatformEnum platformEnum = WebhookPlatformEnum.fromCode(platform);
        IWebhookPayloadAdapter adapter = platformEnum == null ? null : adapters.get(platformEnum);
        if (adapter == null) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "Unknown webhook platform: " + platform);
        }
        return adapter;
    }

    private Map<String, Object> parseBody(String rawBody) {
        if (StringUtils.isBlank(rawBody)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "Webhook body is empty");
        }
        try {
            Map<String, Object> body = objectMapper.readValue(rawBody, new TypeReference<Map<String, Object>>() {
            });
            if (body == null) {
                throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "Webhook body must be a JSON object");
            }
            return body;
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "Invalid JSON payload", ex);
        }
    }

    private WebhookEventResultDTO toResultDTO(WebhookEventResult result) {
        WebhookEventResultDTO dto = new WebhookEventResultDTO();
        dto.setEventType(result.eventType());
        dto.setEntryId(result.entryId());
        dto.setIdempotencyId(result.idempotencyId());
        dto.setSuccess(result.success());
        dto.setMessage(result.message());
        return dto;
    }

    public record IngressOutcome(int httpStatus, WebhookIngressResponseDTO body) {
    }
}
