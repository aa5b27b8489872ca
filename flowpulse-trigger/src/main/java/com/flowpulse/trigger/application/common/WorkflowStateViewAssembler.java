package com.flowpulse.trigger.application.common;

import com.flowpulse.api.dto.StateTransitionDTO;
import com.flowpulse.api.dto.WorkflowAggregateDTO;
import com.flowpulse.api.dto.WorkflowStateDTO;
import com.flowpulse.domain.state.model.entity.StateTransitionEntity;
import com.flowpulse.domain.state.model.entity.WorkflowStateEntity;
import com.flowpulse.domain.state.model.valobj.WorkflowAggregate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;

/**
 * 工作流状态视图组装器：领域对象 → 对外 DTO。
 */
@Component
public class WorkflowStateViewAssembler {

    public WorkflowStateDTO toStateDTO(WorkflowStateEntity state) {
        if (state == null) {
            return null;
        }
        WorkflowStateDTO dto = new WorkflowStateDTO();
        dto.setId(state.getId());
        dto.setWorkflowId(state.getWorkflowId());
        dto.setCurrentState(state.getCurrentState() == null ? null : state.getCurrentState().getCode());
        dto.setPreviousState(state.getPreviousState() == null ? null : state.getPreviousState().getCode());
        dto.setExecutionId(state.getExecutionId());
        dto.setStartedAt(state.getStartedAt());
        dto.setCompletedAt(state.getCompletedAt());
        dto.setDuration(state.getDuration());
        dto.setProgressPercentage(state.getProgressPercentage());
        dto.setMetadata(state.getMetadata() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(state.getMetadata()));
        dto.setVersion(state.getVersion());
        dto.setUpdatedAt(state.getUpdatedAt());
        return dto;
    }

    public StateTransitionDTO toTransitionDTO(StateTransitionEntity transition) {
        StateTransitionDTO dto = new StateTransitionDTO();
        dto.setId(transition.getId());
        dto.setWorkflowStateId(transition.getWorkflowStateId());
        dto.setFromState(transition.getFromState() == null ? null : transition.getFromState().getCode());
        dto.setToState(transition.getToState() == null ? null : transition.getToState().getCode());
        dto.setTransitionType(transition.getTransitionType() == null ? null : transition.getTransitionType().getCode());
        dto.setTimestamp(transition.getTimestamp());
        dto.setDurationInPreviousState(transition.getDurationInPreviousState());
        dto.setTriggeredBy(transition.getTriggeredBy());
        dto.setReason(transition.getReason());
        dto.setMetadata(transition.getMetadata());
        return dto;
    }

    public WorkflowAggregateDTO toAggregateDTO(WorkflowAggregate aggregate) {
        WorkflowAggregateDTO dto = new WorkflowAggregateDTO();
        dto.setWorkflowId(aggregate.getWorkflowId());
        dto.setTotalTransitions(aggregate.getTotalTransitions());
        dto.setStateCounts(aggregate.getStateCounts());
        dto.setTimeInStateMs(aggregate.getTimeInStateMs());
        dto.setTotalExecutions(aggregate.getTotalExecutions());
        dto.setSuccessfulExecutions(aggregate.getSuccessfulExecutions());
        dto.setFailedExecutions(aggregate.getFailedExecutions());
        dto.setCancelledExecutions(aggregate.getCancelledExecutions());
        dto.setSuccessRate(aggregate.getSuccessRate());
        dto.setAverageDuration(aggregate.getAverageDuration());
        dto.setLastTransitionAt(aggregate.getLastTransitionAt());
        return dto;
    }
}
