package com.flowpulse.domain.state.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 状态迁移指令，状态与迁移类型保持原始编码，由领域服务校验。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransitionCommand {

    private String workflowId;
    private String newState;
    private String transitionType;
    private String executionId;
    private Integer progress;
    private Map<String, Object> metadata;
    private String triggeredBy;
    private String reason;
}
