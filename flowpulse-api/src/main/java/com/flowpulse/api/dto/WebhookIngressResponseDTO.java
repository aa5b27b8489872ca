package com.flowpulse.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.List;

/**
 * 入站 Webhook 响应体。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookIngressResponseDTO {

    private boolean success;
    private String message;
    private List<WebhookEventResultDTO> results;
}
