package com.flowpulse.domain.state.model.entity;

import com.flowpulse.types.enums.WorkflowStateEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 工作流状态快照领域实体
 *
 * @author flowpulse
 * @since 2026-10-19
 */
@Data
public class WorkflowStateEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 逻辑工作流 ID
     */
    private String workflowId;

    /**
     * 当前状态
     */
    private WorkflowStateEnum currentState;

    /**
     * 上一状态 (首次迁移为 idle)
     */
    private WorkflowStateEnum previousState;

    /**
     * 外部执行 ID (可空)
     */
    private String executionId;

    /**
     * 开始时间 (首次进入 running 时写入)
     */
    private LocalDateTime startedAt;

    /**
     * 完成时间 (进入终态时写入)
     */
    private LocalDateTime completedAt;

    /**
     * 执行耗时 (毫秒)
     */
    private Long duration;

    /**
     * 进度 (0-100)
     */
    private Integer progressPercentage;

    /**
     * 元数据 (JSONB)
     */
    private Map<String, Object> metadata;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;

    public void validate() {
        if (workflowId == null || workflowId.trim().isEmpty()) {
            throw new IllegalStateException("Workflow id cannot be empty");
        }
        if (currentState == null) {
            throw new IllegalStateException("Current state cannot be null");
        }
        if (progressPercentage != null && (progressPercentage < 0 || progressPercentage > 100)) {
            throw new IllegalStateException("Progress percentage must be between 0 and 100");
        }
    }

    public boolean isTerminal() {
        return currentState != null && currentState.isTerminal();
    }

    /**
     * 浅合并元数据，新键覆盖旧键。
     */
    public void mergeMetadata(Map<String, Object> patch) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (metadata != null) {
            merged.putAll(metadata);
        }
        if (patch != null) {
            merged.putAll(patch);
        }
        this.metadata = merged;
    }
}
