package com.flowpulse.domain.webhook.model.entity;

import com.flowpulse.domain.webhook.model.valobj.WebhookErrorHandling;
import com.flowpulse.domain.webhook.model.valobj.WebhookSecurity;
import com.flowpulse.types.enums.EndpointStatusEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 外发 Webhook 端点领域实体
 *
 * @author flowpulse
 * @since 2026-10-19
 */
@Data
public class WebhookEndpointEntity {

    private static final Set<String> SUPPORTED_METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE");

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 对外暴露的端点 ID (UUID)
     */
    private String endpointId;

    private String name;

    private String url;

    /**
     * HTTP 方法，默认 POST
     */
    private String method;

    private Boolean active;

    private WebhookSecurity security;

    /**
     * 触发过滤：空表示全部，支持 * 与 前缀.* 通配
     */
    private List<String> triggers;

    private WebhookErrorHandling errorHandling;

    private Long triggerCount;

    private Long successCount;

    private Long errorCount;

    private LocalDateTime lastTriggered;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public void validate() {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalStateException("Endpoint name cannot be empty");
        }
        if (url == null || url.trim().isEmpty()) {
            throw new IllegalStateException("Endpoint url cannot be empty");
        }
        String normalizedUrl = url.trim().toLowerCase(Locale.ROOT);
        if (!normalizedUrl.startsWith("http://") && !normalizedUrl.startsWith("https://")) {
            throw new IllegalStateException("Endpoint url must be http(s): " + url);
        }
        if (method != null && !SUPPORTED_METHODS.contains(method.trim().toUpperCase(Locale.ROOT))) {
            throw new IllegalStateException("Unsupported HTTP method: " + method);
        }
    }

    public boolean isEnabled() {
        return Boolean.TRUE.equals(active);
    }

    /**
     * 派生状态：停用 → inactive，失败多于成功 → error，否则 active。
     */
    public EndpointStatusEnum deriveStatus() {
        if (!isEnabled()) {
            return EndpointStatusEnum.INACTIVE;
        }
        if (valueOf(errorCount) > valueOf(successCount)) {
            return EndpointStatusEnum.ERROR;
        }
        return EndpointStatusEnum.ACTIVE;
    }

    public boolean matchesTrigger(String triggerType) {
        if (triggers == null || triggers.isEmpty()) {
            return true;
        }
        if (triggerType == null) {
            return false;
        }
        for (String trigger : triggers) {
            if (trigger == null || trigger.isBlank()) {
                continue;
            }
            String pattern = trigger.trim();
            if ("*".equals(pattern) || pattern.equals(triggerType)) {
                return true;
            }
            if (pattern.endsWith(".*") && triggerType.startsWith(pattern.substring(0, pattern.length() - 1))) {
                return true;
            }
        }
        return false;
    }

    public WebhookErrorHandling effectiveErrorHandling() {
        return errorHandling == null ? WebhookErrorHandling.defaults() : errorHandling.withDefaults();
    }

    private long valueOf(Long value) {
        return value == null ? 0L : value;
    }
}
