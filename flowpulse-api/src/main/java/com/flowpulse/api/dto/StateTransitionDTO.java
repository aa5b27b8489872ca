package com.flowpulse.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 状态迁移审计记录 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StateTransitionDTO {

    private Long id;
    private Long workflowStateId;
    private String fromState;
    private String toState;
    private String transitionType;
    private LocalDateTime timestamp;
    private Long durationInPreviousState;
    private String triggeredBy;
    private String reason;
    private Map<String, Object> metadata;
}
