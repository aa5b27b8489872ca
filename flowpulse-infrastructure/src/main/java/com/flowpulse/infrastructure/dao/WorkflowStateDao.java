package com.flowpulse.infrastructure.dao;

import com.flowpulse.infrastructure.dao.po.WorkflowStatePO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 工作流状态快照 DAO
 *
 * @author flowpulse
 * @since 2026-10-19
 */
@Mapper
public interface WorkflowStateDao {

    /**
     * 插入快照 (回填 id)
     */
    int insert(WorkflowStatePO po);

    /**
     * 根据 ID 更新 (带乐观锁)
     */
    int updateWithVersion(WorkflowStatePO po);

    WorkflowStatePO selectByWorkflowId(@Param("workflowId") String workflowId);

    List<WorkflowStatePO> selectByWorkflowIds(@Param("workflowIds") List<String> workflowIds);

    /**
     * 删除终态且 updated_at 严格早于 cutoff 的快照，workflowId 为空时不限定
     */
    int deleteTerminalBefore(@Param("terminalStates") List<String> terminalStates,
                             @Param("cutoff") LocalDateTime cutoff,
                             @Param("workflowId") String workflowId);
}
