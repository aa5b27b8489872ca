package com.flowpulse.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 工作流状态快照 PO (workflow_states)
 *
 * @author flowpulse
 * @since 2026-10-19
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowStatePO {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 逻辑工作流 ID (唯一)
     */
    private String workflowId;

    /**
     * 当前状态编码
     */
    private String currentState;

    /**
     * 上一状态编码
     */
    private String previousState;

    private String executionId;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    /**
     * 执行耗时 (毫秒)
     */
    private Long duration;

    private Integer progressPercentage;

    /**
     * 元数据 (JSONB)
     */
    private String metadata;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
