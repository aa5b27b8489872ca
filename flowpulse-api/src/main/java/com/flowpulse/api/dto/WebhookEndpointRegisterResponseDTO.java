package com.flowpulse.api.dto;

import lombok.Data;

/**
 * 外发端点注册结果。
 */
@Data
public class WebhookEndpointRegisterResponseDTO {

    private String endpointId;
}
