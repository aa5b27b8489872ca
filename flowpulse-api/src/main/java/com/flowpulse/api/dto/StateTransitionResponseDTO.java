package com.flowpulse.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * 状态迁移结果，transition 为 created 或 updated。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StateTransitionResponseDTO {

    private WorkflowStateDTO state;
    private String transition;
}
