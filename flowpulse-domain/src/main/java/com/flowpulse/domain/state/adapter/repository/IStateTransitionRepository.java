package com.flowpulse.domain.state.adapter.repository;

import com.flowpulse.domain.state.model.entity.StateTransitionEntity;

import java.util.List;

/**
 * 状态迁移审计仓储接口 (只读，写入随快照一起完成)
 *
 * @author flowpulse
 * @since 2026-10-19
 */
public interface IStateTransitionRepository {

    /**
     * 最近的迁移记录，按时间倒序
     */
    List<StateTransitionEntity> findRecentByWorkflowId(String workflowId, int limit);

    /**
     * 全部迁移记录，按时间正序
     */
    List<StateTransitionEntity> findAllByWorkflowId(String workflowId);
}
