package com.flowpulse.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 外发端点 PO (webhook_endpoints)
 *
 * @author flowpulse
 * @since 2026-10-19
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookEndpointPO {

    private Long id;

    /**
     * 对外端点 ID (UUID)
     */
    private String endpointId;

    private String name;

    private String url;

    private String method;

    private Boolean isActive;

    /**
     * 认证配置 (JSONB)
     */
    private String security;

    /**
     * 触发过滤 (JSONB 字符串数组)
     */
    private String triggers;

    /**
     * 重试与兜底 (JSONB)
     */
    private String errorHandling;

    private Long triggerCount;

    private Long successCount;

    private Long errorCount;

    private LocalDateTime lastTriggered;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
