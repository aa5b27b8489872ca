package com.flowpulse.domain.state.model.valobj;

import com.flowpulse.domain.state.model.entity.StateTransitionEntity;
import com.flowpulse.domain.state.model.entity.WorkflowStateEntity;

/**
 * 状态迁移提交后的进程内事件。
 */
public record WorkflowStateChangedEvent(WorkflowStateEntity state,
                                        StateTransitionEntity transition,
                                        boolean created) {

    public String triggerType() {
        if (state == null || state.getCurrentState() == null) {
            return "workflow.unknown";
        }
        return "workflow." + state.getCurrentState().getCode();
    }
}
