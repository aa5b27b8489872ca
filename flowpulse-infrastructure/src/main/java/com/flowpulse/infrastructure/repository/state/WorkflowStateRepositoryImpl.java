package com.flowpulse.infrastructure.repository.state;

import com.flowpulse.domain.state.adapter.repository.IWorkflowStateRepository;
import com.flowpulse.domain.state.model.entity.StateTransitionEntity;
import com.flowpulse.domain.state.model.entity.WorkflowStateEntity;
import com.flowpulse.infrastructure.dao.StateTransitionDao;
import com.flowpulse.infrastructure.dao.WorkflowStateDao;
import com.flowpulse.infrastructure.dao.po.StateTransitionPO;
import com.flowpulse.infrastructure.dao.po.WorkflowStatePO;
import com.flowpulse.infrastructure.util.JsonCodec;
import com.flowpulse.types.enums.ResponseCode;
import com.flowpulse.types.enums.WorkflowStateEnum;
import com.flowpulse.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 工作流状态仓储实现类。
 * <p>
 * 快照与迁移审计在同一事务内写入：
 * <ul>
 *   <li>首次创建依赖 workflow_id 唯一约束，并发创建的失败方返回 CONFLICT</li>
 *   <li>更新带乐观锁 (version)，影响行数为 0 时返回 CONFLICT</li>
 * </ul>
 * </p>
 *
 * @author flowpulse
 * @since 2026-10-19
 */
@Slf4j
@Repository
public class WorkflowStateRepositoryImpl implements IWorkflowStateRepository {

    private final WorkflowStateDao workflowStateDao;
    private final StateTransitionDao stateTransitionDao;
    private final JsonCodec jsonCodec;

    public WorkflowStateRepositoryImpl(WorkflowStateDao workflowStateDao,
                                       StateTransitionDao stateTransitionDao,
                                       JsonCodec jsonCodec) {
        this.workflowStateDao = workflowStateDao;
        this.stateTransitionDao = stateTransitionDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public WorkflowStateEntity create(WorkflowStateEntity state, StateTransitionEntity transition) {
        state.validate();
        WorkflowStatePO po = toPO(state);
        try {
            workflowStateDao.insert(po);
        } catch (DuplicateKeyException ex) {
            log.warn("Workflow state create conflict. workflowId={}", state.getWorkflowId());
            throw new AppException(ResponseCode.CONFLICT.getCode(),
                    "Workflow state was created concurrently: " + state.getWorkflowId(), ex);
        }
        state.setId(po.getId());
        appendTransition(po.getId(), transition);
        return state;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public WorkflowStateEntity update(WorkflowStateEntity state, StateTransitionEntity transition) {
        state.validate();
        Integer oldVersion = state.getVersion();
        if (oldVersion == null || state.getId() == null) {
            throw new IllegalStateException("Id and version are required for workflow state update: " + state.getWorkflowId());
        }
        WorkflowStatePO po = toPO(state);
        int affected = workflowStateDao.updateWithVersion(po);
        if (affected == 0) {
            log.warn("Workflow state optimistic lock failed. workflowId={}, version={}", state.getWorkflowId(), oldVersion);
            throw new AppException(ResponseCode.CONFLICT.getCode(),
                    "Workflow state was modified concurrently: " + state.getWorkflowId());
        }
        state.setVersion(oldVersion + 1);
        appendTransition(state.getId(), transition);
        return state;
    }

    @Override
    public WorkflowStateEntity findByWorkflowId(String workflowId) {
        return toEntity(workflowStateDao.selectByWorkflowId(workflowId));
    }

    @Override
    public List<WorkflowStateEntity> findByWorkflowIds(List<String> workflowIds) {
        if (workflowIds == null || workflowIds.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> distinctIds = new ArrayList<>(new LinkedHashSet<>(workflowIds));
        return workflowStateDao.selectByWorkflowIds(distinctIds).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public int deleteTerminalBefore(LocalDateTime cutoff, String workflowId) {
        List<String> terminalStates = new ArrayList<>();
        for (WorkflowStateEnum state : WorkflowStateEnum.values()) {
            if (state.isTerminal()) {
                terminalStates.add(state.getCode());
            }
        }
        return workflowStateDao.deleteTerminalBefore(terminalStates, cutoff, workflowId);
    }

    private void appendTransition(Long workflowStateId, StateTransitionEntity transition) {
        if (transition == null) {
            return;
        }
        transition.setWorkflowStateId(workflowStateId);
        StateTransitionPO transitionPO = StateTransitionRepositoryImpl.toPO(transition, jsonCodec);
        stateTransitionDao.insert(transitionPO);
        transition.setId(transitionPO.getId());
    }

    private WorkflowStateEntity toEntity(WorkflowStatePO po) {
        if (po == null) {
            return null;
        }
        WorkflowStateEntity entity = new WorkflowStateEntity();
        entity.setId(po.getId());
        entity.setWorkflowId(po.getWorkflowId());
        entity.setCurrentState(WorkflowStateEnum.fromCode(po.getCurrentState()));
        entity.setPreviousState(po.getPreviousState() == null ? null : WorkflowStateEnum.fromCode(po.getPreviousState()));
        entity.setExecutionId(po.getExecutionId());
        entity.setStartedAt(po.getStartedAt());
        entity.setCompletedAt(po.getCompletedAt());
        entity.setDuration(po.getDuration());
        entity.setProgressPercentage(po.getProgressPercentage());
        entity.setMetadata(jsonCodec.readMap(po.getMetadata()));
        entity.setVersion(po.getVersion());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private WorkflowStatePO toPO(WorkflowStateEntity entity) {
        return WorkflowStatePO.builder()
                .id(entity.getId())
                .workflowId(entity.getWorkflowId())
                .currentState(entity.getCurrentState().getCode())
                .previousState(entity.getPreviousState() == null ? null : entity.getPreviousState().getCode())
                .executionId(entity.getExecutionId())
                .startedAt(entity.getStartedAt())
                .completedAt(entity.getCompletedAt())
                .duration(entity.getDuration())
                .progressPercentage(entity.getProgressPercentage())
                .metadata(jsonCodec.writeValue(entity.getMetadata()))
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
