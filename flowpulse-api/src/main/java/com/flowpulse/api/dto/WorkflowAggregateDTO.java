package com.flowpulse.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 工作流聚合统计 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WorkflowAggregateDTO {

    private String workflowId;
    private Long totalTransitions;
    private Map<String, Long> stateCounts;
    private Map<String, Long> timeInStateMs;
    private Long totalExecutions;
    private Long successfulExecutions;
    private Long failedExecutions;
    private Long cancelledExecutions;
    private Double successRate;
    private Double averageDuration;
    private LocalDateTime lastTransitionAt;
}
