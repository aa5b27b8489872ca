package com.flowpulse.domain.state.service;

import com.flowpulse.domain.state.model.entity.StateTransitionEntity;
import com.flowpulse.domain.state.model.entity.WorkflowStateEntity;
import com.flowpulse.domain.state.model.valobj.TransitionCommand;
import com.flowpulse.domain.state.model.valobj.TransitionResult;
import com.flowpulse.types.enums.ResponseCode;
import com.flowpulse.types.enums.TransitionTypeEnum;
import com.flowpulse.types.enums.WorkflowStateEnum;
import com.flowpulse.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 工作流状态迁移领域服务：校验指令、推进快照并生成审计记录。
 * <p>
 * 只做纯计算，不访问仓储；持久化与并发控制由应用层负责。
 * </p>
 */
@Service
public class StateTransitionDomainService {

    /**
     * 对当前快照应用迁移指令。
     *
     * @param current 当前快照，不存在时为 null
     * @param command 迁移指令
     * @param now     迁移时间
     * @param strict  是否按迁移表校验合法性
     * @return 迁移后的快照与审计记录 (未持久化)
     */
    public TransitionResult apply(WorkflowStateEntity current,
                                  TransitionCommand command,
                                  LocalDateTime now,
                                  boolean strict) {
        validate(command);
        WorkflowStateEnum newState = WorkflowStateEnum.fromCode(command.getNewState());
        TransitionTypeEnum transitionType = TransitionTypeEnum.fromCode(command.getTransitionType());
        WorkflowStateEnum fromState = current == null ? WorkflowStateEnum.IDLE : current.getCurrentState();
        if (strict && !StateTransitionPolicy.isAllowed(fromState, newState)) {
            throw new AppException(ResponseCode.INVALID_TRANSITION.getCode(),
                    "Transition not allowed: " + fromState.getCode() + " -> " + newState.getCode());
        }
        if (current == null) {
            return createState(command, newState, transitionType, now);
        }
        return advanceState(current, command, newState, transitionType, now);
    }

    public void validate(TransitionCommand command) {
        if (command == null) {
            throw illegal("Request body is required");
        }
        if (StringUtils.isBlank(command.getWorkflowId())) {
            throw illegal("workflow_id is required");
        }
        if (StringUtils.isBlank(command.getNewState())) {
            throw illegal("new_state is required");
        }
        if (StringUtils.isBlank(command.getTransitionType())) {
            throw illegal("transition_type is required");
        }
        if (!WorkflowStateEnum.isValidCode(command.getNewState())) {
            throw illegal("Invalid state: " + command.getNewState());
        }
        if (!TransitionTypeEnum.isValidCode(command.getTransitionType())) {
            throw illegal("Invalid transition type: " + command.getTransitionType());
        }
        Integer progress = command.getProgress();
        if (progress != null && (progress < 0 || progress > 100)) {
            throw illegal("progress must be between 0 and 100");
        }
    }

    private TransitionResult createState(TransitionCommand command,
                                         WorkflowStateEnum newState,
                                         TransitionTypeEnum transitionType,
                                         LocalDateTime now) {
        WorkflowStateEntity state = new WorkflowStateEntity();
        state.setWorkflowId(command.getWorkflowId().trim());
        state.setPreviousState(WorkflowStateEnum.IDLE);
        state.setCurrentState(newState);
        state.setExecutionId(command.getExecutionId());
        state.setProgressPercentage(command.getProgress() == null ? 0 : command.getProgress());
        state.setMetadata(copy(command.getMetadata()));
        state.setVersion(0);
        state.setCreatedAt(now);
        state.setUpdatedAt(now);
        if (newState == WorkflowStateEnum.RUNNING) {
            state.setStartedAt(now);
        }
        if (newState.isTerminal()) {
            state.setCompletedAt(now);
            state.setDuration(0L);
        }
        StateTransitionEntity transition = buildTransition(state, WorkflowStateEnum.IDLE, transitionType, 0L, command, now);
        return new TransitionResult(state, transition, true);
    }

    private TransitionResult advanceState(WorkflowStateEntity state,
                                          TransitionCommand command,
                                          WorkflowStateEnum newState,
                                          TransitionTypeEnum transitionType,
                                          LocalDateTime now) {
        WorkflowStateEnum fromState = state.getCurrentState();
        long durationInPrevious = millisBetween(state.getUpdatedAt(), now);

        state.setPreviousState(fromState);
        state.setCurrentState(newState);
        state.mergeMetadata(command.getMetadata());
        if (command.getProgress() != null) {
            state.setProgressPercentage(command.getProgress());
        }
        if (StringUtils.isNotBlank(command.getExecutionId())) {
            state.setExecutionId(command.getExecutionId());
        }
        if (newState == WorkflowStateEnum.RUNNING && state.getStartedAt() == null) {
            state.setStartedAt(now);
        }
        if (newState.isTerminal()) {
            state.setCompletedAt(now);
            state.setDuration(state.getStartedAt() == null ? 0L : millisBetween(state.getStartedAt(), now));
        }
        state.setUpdatedAt(now);

        StateTransitionEntity transition = buildTransition(state, fromState, transitionType, durationInPrevious, command, now);
        return new TransitionResult(state, transition, false);
    }

    private StateTransitionEntity buildTransition(WorkflowStateEntity state,
                                                  WorkflowStateEnum fromState,
                                                  TransitionTypeEnum transitionType,
                                                  long durationInPrevious,
                                                  TransitionCommand command,
                                                  LocalDateTime now) {
        StateTransitionEntity transition = new StateTransitionEntity();
        transition.setWorkflowStateId(state.getId());
        transition.setWorkflowId(state.getWorkflowId());
        transition.setFromState(fromState);
        transition.setToState(state.getCurrentState());
        transition.setTransitionType(transitionType);
        transition.setTimestamp(now);
        transition.setDurationInPreviousState(durationInPrevious);
        transition.setTriggeredBy(StringUtils.trimToNull(command.getTriggeredBy()));
        transition.setReason(StringUtils.trimToNull(command.getReason()));
        transition.setMetadata(copy(command.getMetadata()));
        return transition;
    }

    private long millisBetween(LocalDateTime from, LocalDateTime to) {
        if (from == null || to == null) {
            return 0L;
        }
        return Math.max(0L, Duration.between(from, to).toMillis());
    }

    private Map<String, Object> copy(Map<String, Object> source) {
        return source == null ? new LinkedHashMap<>() : new LinkedHashMap<>(source);
    }

    private AppException illegal(String message) {
        return new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), message);
    }
}
