package com.flowpulse.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;

/**
 * 单个工作流状态查询结果。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WorkflowStateDetailDTO {

    private WorkflowStateDTO state;
    private List<StateTransitionDTO> history;
    private WorkflowAggregateDTO aggregates;
}
