package com.flowpulse.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 外发端点视图。
 */
@Data
public class WebhookEndpointDTO {

    private String endpointId;
    private String name;
    private String url;
    private String method;
    private boolean active;
    private String status;
    private List<String> triggers;
    private WebhookErrorHandlingDTO errorHandling;
    private Long triggerCount;
    private Long successCount;
    private Long errorCount;
    private LocalDateTime lastTriggered;
}
