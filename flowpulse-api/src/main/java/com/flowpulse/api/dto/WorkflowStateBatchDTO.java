package com.flowpulse.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.Map;

/**
 * 批量工作流状态查询结果，按 workflow_id 索引。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WorkflowStateBatchDTO {

    private Map<String, WorkflowStateDTO> states;
    private Map<String, WorkflowAggregateDTO> aggregates;
}
