package com.flowpulse.domain.state.model.entity;

import com.flowpulse.types.enums.TransitionTypeEnum;
import com.flowpulse.types.enums.WorkflowStateEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 状态迁移审计实体，只追加不修改。
 *
 * @author flowpulse
 * @since 2026-10-19
 */
@Data
public class StateTransitionEntity {

    private Long id;

    /**
     * 关联 workflow_states.id
     */
    private Long workflowStateId;

    private String workflowId;

    private WorkflowStateEnum fromState;

    private WorkflowStateEnum toState;

    private TransitionTypeEnum transitionType;

    private LocalDateTime timestamp;

    /**
     * 在上一状态停留时长 (毫秒)
     */
    private Long durationInPreviousState;

    private String triggeredBy;

    private String reason;

    private Map<String, Object> metadata;
}
