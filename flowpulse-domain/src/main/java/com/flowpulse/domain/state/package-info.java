/**
 * State 领域 - 工作流状态域
 *
 * <p>职责：工作流实例状态快照、状态迁移审计、聚合统计与保留期清理</p>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.flowpulse.domain.state.model.entity.WorkflowStateEntity}</li>
 * </ul>
 *
 * <h3>核心实体</h3>
 * <ul>
 *   <li>WorkflowState - 当前状态快照（每个 workflow_id 一行）</li>
 *   <li>StateTransition - 迁移审计（只追加）</li>
 * </ul>
 *
 * @author flowpulse
 * @since 2026-10-19
 */
package com.flowpulse.domain.state;
