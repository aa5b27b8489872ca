package com.flowpulse.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.Map;

/**
 * 状态迁移请求。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StateTransitionRequestDTO {

    private String workflowId;
    private String newState;
    private String transitionType;
    private String executionId;
    private Integer progress;
    private Map<String, Object> metadata;
    private String triggeredBy;
    private String reason;
}
