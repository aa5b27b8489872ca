package com.flowpulse.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * HTTP 入口日志配置。
 */
@Data
@Component
@ConfigurationProperties(prefix = "observability.http-log", ignoreInvalidFields = true)
public class ObservabilityHttpLogProperties {

    private boolean enabled = true;

    private List<String> includePathPatterns = Arrays.asList("/api/**");

    /** SSE 长连接不进入过滤器，避免响应被缓存。 */
    private List<String> excludePathPatterns = Arrays.asList("/actuator/**", "/api/stream");

    /** 原始请求体参与验签的路径，不做请求体缓存与摘要。 */
    private List<String> rawBodyPathPatterns = Arrays.asList("/api/webhooks/**");

    private boolean logRequestBody = false;

    /** 请求体摘要白名单字段。 */
    private List<String> requestBodyWhitelist = Arrays.asList("workflow_id", "new_state", "transition_type", "action", "clientId", "triggerType");

    private List<String> maskFields = Arrays.asList("token", "secret", "authorization", "password", "verify_token", "hub.verify_token");

    private long slowRequestThresholdMs = 1000L;

    /** 采样比例（0~1） */
    private double sampleRate = 1.0D;

    private int maxBodyLength = 1024;
}
