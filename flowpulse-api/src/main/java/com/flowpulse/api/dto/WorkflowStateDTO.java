package com.flowpulse.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 工作流当前状态快照 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WorkflowStateDTO {

    private Long id;
    private String workflowId;
    private String currentState;
    private String previousState;
    private String executionId;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Long duration;
    private Integer progressPercentage;
    private Map<String, Object> metadata;
    private Integer version;
    private LocalDateTime updatedAt;
}
