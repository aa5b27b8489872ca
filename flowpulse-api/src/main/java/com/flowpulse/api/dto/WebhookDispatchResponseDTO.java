package com.flowpulse.api.dto;

import lombok.Data;

/**
 * 外发 Webhook 派发结果。
 */
@Data
public class WebhookDispatchResponseDTO {

    private boolean success;
    private Integer matchedEndpoints;
}
