package com.flowpulse.api.dto;

import lombok.Data;

/**
 * 单个入站子事件处理结果。
 */
@Data
public class WebhookEventResultDTO {

    private String eventType;
    private String entryId;
    private String idempotencyId;
    private boolean success;
    private String message;
}
