package com.flowpulse.infrastructure.repository.state;

import com.flowpulse.domain.state.adapter.repository.IStateTransitionRepository;
import com.flowpulse.domain.state.model.entity.StateTransitionEntity;
import com.flowpulse.infrastructure.dao.StateTransitionDao;
import com.flowpulse.infrastructure.dao.po.StateTransitionPO;
import com.flowpulse.infrastructure.util.JsonCodec;
import com.flowpulse.types.enums.TransitionTypeEnum;
import com.flowpulse.types.enums.WorkflowStateEnum;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 状态迁移审计仓储实现 (只读查询，写入由 {@link WorkflowStateRepositoryImpl} 在事务内完成)
 *
 * @author flowpulse
 * @since 2026-10-19
 */
@Repository
public class StateTransitionRepositoryImpl implements IStateTransitionRepository {

    private final StateTransitionDao stateTransitionDao;
    private final JsonCodec jsonCodec;

    public StateTransitionRepositoryImpl(StateTransitionDao stateTransitionDao, JsonCodec jsonCodec) {
        this.stateTransitionDao = stateTransitionDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public List<StateTransitionEntity> findRecentByWorkflowId(String workflowId, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return stateTransitionDao.selectRecentByWorkflowId(workflowId, limit).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<StateTransitionEntity> findAllByWorkflowId(String workflowId) {
        return stateTransitionDao.selectByWorkflowId(workflowId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private StateTransitionEntity toEntity(StateTransitionPO po) {
        StateTransitionEntity entity = new StateTransitionEntity();
        entity.setId(po.getId());
        entity.setWorkflowStateId(po.getWorkflowStateId());
        entity.setWorkflowId(po.getWorkflowId());
        entity.setFromState(po.getFromState() == null ? null : WorkflowStateEnum.fromCode(po.getFromState()));
        entity.setToState(WorkflowStateEnum.fromCode(po.getToState()));
        entity.setTransitionType(TransitionTypeEnum.fromCode(po.getTransitionType()));
        entity.setTimestamp(po.getTimestamp());
        entity.setDurationInPreviousState(po.getDurationInPreviousState());
        entity.setTriggeredBy(po.getTriggeredBy());
        entity.setReason(po.getReason());
        entity.setMetadata(jsonCodec.readMap(po.getMetadata()));
        return entity;
    }

    static StateTransitionPO toPO(StateTransitionEntity entity, JsonCodec jsonCodec) {
        return StateTransitionPO.builder()
                .id(entity.getId())
                .workflowStateId(entity.getWorkflowStateId())
                .workflowId(entity.getWorkflowId())
                .fromState(entity.getFromState() == null ? null : entity.getFromState().getCode())
                .toState(entity.getToState().getCode())
                .transitionType(entity.getTransitionType().getCode())
                .timestamp(entity.getTimestamp())
                .durationInPreviousState(entity.getDurationInPreviousState())
                .triggeredBy(entity.getTriggeredBy())
                .reason(entity.getReason())
                .metadata(jsonCodec.writeValue(entity.getMetadata()))
                .build();
    }
}
