package com.flowpulse.api.dto;

import lombok.Data;

import java.util.Map;

/**
 * 外发 Webhook 手动派发请求。
 */
@Data
public class WebhookDispatchRequestDTO {

    private String workflowId;
    private Map<String, Object> data;
    private String triggerType;
}
