package com.flowpulse.infrastructure.dao;

import com.flowpulse.infrastructure.dao.po.StateTransitionPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 状态迁移审计 DAO (只追加)
 *
 * @author flowpulse
 * @since 2026-10-19
 */
@Mapper
public interface StateTransitionDao {

    int insert(StateTransitionPO po);

    /**
     * 最近迁移，按时间倒序
     */
    List<StateTransitionPO> selectRecentByWorkflowId(@Param("workflowId") String workflowId,
                                                     @Param("limit") Integer limit);

    /**
     * 全部迁移，按时间正序
     */
    List<StateTransitionPO> selectByWorkflowId(@Param("workflowId") String workflowId);
}
