package com.flowpulse.domain.state.model.valobj;

import com.flowpulse.domain.state.model.entity.StateTransitionEntity;
import com.flowpulse.domain.state.model.entity.WorkflowStateEntity;

/**
 * 状态迁移结果。
 *
 * @param state      迁移后的快照
 * @param transition 追加的审计记录
 * @param created    是否为首次创建
 */
public record TransitionResult(WorkflowStateEntity state,
                               StateTransitionEntity transition,
                               boolean created) {

    public String operation() {
        return created ? "created" : "updated";
    }
}
