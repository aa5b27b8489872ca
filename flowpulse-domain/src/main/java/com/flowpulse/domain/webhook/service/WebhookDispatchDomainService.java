package com.flowpulse.domain.webhook.service;

import com.flowpulse.domain.webhook.model.entity.WebhookEndpointEntity;
import com.flowpulse.domain.webhook.model.valobj.WebhookSecurity;
import com.flowpulse.types.common.Constants;
import com.flowpulse.types.enums.SystemHealthEnum;
import com.flowpulse.types.enums.WebhookAuthModeEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 外发派发规则：端点匹配、请求体与认证头构造、健康度评估。
 */
@Service
public class WebhookDispatchDomainService {

    public static final String SIGNATURE_HEADER = "X-FlowPulse-Signature";
    public static final String USER_AGENT = "FlowPulse-Webhook/1.0";

    private final WebhookPayloadDomainService payloadDomainService;
    private final WebhookSignatureDomainService signatureDomainService;

    public WebhookDispatchDomainService(WebhookPayloadDomainService payloadDomainService,
                                        WebhookSignatureDomainService signatureDomainService) {
        this.payloadDomainService = payloadDomainService;
        this.signatureDomainService = signatureDomainService;
    }

    public List<WebhookEndpointEntity> matchEndpoints(List<WebhookEndpointEntity> endpoints, String triggerType) {
        List<WebhookEndpointEntity> matched = new ArrayList<>();
        if (endpoints == null) {
            return matched;
        }
        for (WebhookEndpointEntity endpoint : endpoints) {
            if (endpoint != null && endpoint.isEnabled() && endpoint.matchesTrigger(triggerType)) {
                matched.add(endpoint);
            }
        }
        return matched;
    }

    /**
     * {workflow_id, trigger_type, data, timestamp, source}，data 已脱敏。
     */
    public Map<String, Object> buildBody(String workflowId, String triggerType, Map<String, Object> data, Instant timestamp) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("workflow_id", workflowId);
        body.put("trigger_type", triggerType);
        body.put("data", payloadDomainService.sanitize(data));
        body.put("timestamp", timestamp == null ? null : timestamp.toString());
        body.put("source", Constants.OUTBOUND_SOURCE);
        return body;
    }

    /**
     * 构造请求头。签名模式对序列化后的请求体做 HMAC。
     *
     * @param secret 已解析的密钥，none 模式可空
     */
    public Map<String, String> buildHeaders(WebhookSecurity security, String secret, String serializedBody) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("User-Agent", USER_AGENT);
        WebhookAuthModeEnum mode = security == null || security.getAuthentication() == null
                ? WebhookAuthModeEnum.NONE
                : security.getAuthentication();
        if (mode == WebhookAuthModeEnum.NONE || StringUtils.isBlank(secret)) {
            return headers;
        }
        String customHeader = StringUtils.trimToNull(security.getHeaderName());
        switch (mode) {
            case BEARER:
                headers.put(StringUtils.defaultString(customHeader, "Authorization"), "Bearer " + secret);
                break;
            case BASIC:
                headers.put(StringUtils.defaultString(customHeader, "Authorization"), "Basic " + secret);
                break;
            case WEBHOOK_SIGNATURE:
                headers.put(StringUtils.defaultString(customHeader, SIGNATURE_HEADER),
                        "sha256=" + signatureDomainService.hmacSha256Hex(secret, serializedBody));
                break;
            default:
                break;
        }
        return headers;
    }

    public String normalizeMethod(String method) {
        return StringUtils.isBlank(method) ? "POST" : method.trim().toUpperCase(Locale.ROOT);
    }

    public boolean isSuccessStatus(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * 成功率百分比，无处理记录时为 100。
     */
    public double successRate(long processed, long failed) {
        if (processed <= 0) {
            return 100D;
        }
        long succeeded = Math.max(processed - failed, 0L);
        return succeeded * 100D / processed;
    }

    public SystemHealthEnum evaluateHealth(long processed, long failed) {
        return SystemHealthEnum.fromSuccessRate(successRate(processed, failed));
    }
}
