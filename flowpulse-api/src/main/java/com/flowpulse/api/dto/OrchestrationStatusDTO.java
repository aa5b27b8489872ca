package com.flowpulse.api.dto;

import lombok.Data;

/**
 * Webhook 编排整体状态。
 */
@Data
public class OrchestrationStatusDTO {

    private Integer activeEndpoints;
    private Integer totalEndpoints;
    private Integer queuedEvents;
    private Long processedEvents;
    private Long failedEvents;
    private String systemHealth;
}
