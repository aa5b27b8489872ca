package com.flowpulse.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 状态迁移审计 PO (state_transitions)
 *
 * @author flowpulse
 * @since 2026-10-19
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StateTransitionPO {

    private Long id;

    /**
     * 关联 workflow_states.id
     */
    private Long workflowStateId;

    private String workflowId;

    private String fromState;

    private String toState;

    private String transitionType;

    private LocalDateTime timestamp;

    /**
     * 在上一状态停留时长 (毫秒)
     */
    private Long durationInPreviousState;

    private String triggeredBy;

    private String reason;

    /**
     * 元数据 (JSONB)
     */
    private String metadata;
}
