package com.flowpulse.domain.state.adapter.repository;

import com.flowpulse.domain.state.model.entity.StateTransitionEntity;
import com.flowpulse.domain.state.model.entity.WorkflowStateEntity;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 工作流状态仓储接口
 *
 * @author flowpulse
 * @since 2026-10-19
 */
public interface IWorkflowStateRepository {

    /**
     * 首次创建快照并追加迁移记录 (同一事务)
     */
    WorkflowStateEntity create(WorkflowStateEntity state, StateTransitionEntity transition);

    /**
     * 更新快照 (带乐观锁) 并追加迁移记录 (同一事务)
     */
    WorkflowStateEntity update(WorkflowStateEntity state, StateTransitionEntity transition);

    /**
     * 查询当前快照 (updated_at 最大的行)
     */
    WorkflowStateEntity findByWorkflowId(String workflowId);

    /**
     * 批量查询当前快照
     */
    List<WorkflowStateEntity> findByWorkflowIds(List<String> workflowIds);

    /**
     * 删除 updated_at 早于 cutoff 的终态快照
     */
    int deleteTerminalBefore(LocalDateTime cutoff, String workflowId);
}
