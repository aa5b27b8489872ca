package com.flowpulse.api.dto;

import lombok.Data;

/**
 * 外发端点重试与兜底策略。
 */
@Data
public class WebhookErrorHandlingDTO {

    private Integer retryAttempts;
    private Long retryDelay;
    private String fallbackAction;
}
