package com.flowpulse.trigger.application.command;

import com.flowpulse.api.dto.StateCleanupResponseDTO;
import com.flowpulse.api.dto.StateTransitionRequestDTO;
import com.flowpulse.api.dto.StateTransitionResponseDTO;
import com.flowpulse.domain.state.adapter.repository.IWorkflowStateRepository;
import com.flowpulse.domain.state.model.entity.StateTransitionEntity;
import com.flowpulse.domain.state.model.entity.WorkflowStateEntity;
import com.flowpulse.domain.state.model.valobj.StateCleanupResult;
import com.flowpulse.domain.state.model.valobj.TransitionCommand;
import com.flowpulse.domain.state.model.valobj.TransitionResult;
import com.flowpulse.domain.state.model.valobj.WorkflowStateChangedEvent;
import com.flowpulse.domain.state.service.StateTransitionDomainService;
import com.flowpulse.trigger.application.common.WorkflowStateViewAssembler;
import com.flowpulse.trigger.event.WorkflowStateEventPublisher;
import com.flowpulse.types.enums.ResponseCode;
import com.flowpulse.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 工作流状态写用例：应用迁移、保留期清理。
 */
@Slf4j
@Service
public class WorkflowStateCommandService {

    public static final int DEFAULT_RETENTION_DAYS = 30;

    private final IWorkflowStateRepository workflowStateRepository;
    private final StateTransitionDomainService stateTransitionDomainService;
    private final WorkflowStateEventPublisher workflowStateEventPublisher;
    private final WorkflowStateViewAssembler viewAssembler;
    private final Clock clock;
    private final boolean strictTransitions;

    public WorkflowStateCommandService(IWorkflowStateRepository workflowStateRepository,
                                       StateTransitionDomainService stateTransitionDomainService,
                                       WorkflowStateEventPublisher workflowStateEventPublisher,
                                       WorkflowStateViewAssembler viewAssembler,
                                       Clock clock,
                                       @Value("${workflow.state.strict-transitions:false}") boolean strictTransitions) {
        this.workflowStateRepository = workflowStateRepository;
        this.stateTransitionDomainService = stateTransitionDomainService;
        this.workflowStateEventPublisher = workflowStateEventPublisher;
        this.viewAssembler = viewAssembler;
        this.clock = clock;
        this.strictTransitions = strictTransitions;
    }

    public StateTransitionResponseDTO applyTransition(StateTransitionRequestDTO request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "Request body is required");
        }
        TransitionResult result = applyTransition(TransitionCommand.builder()
                .workflowId(request.getWorkflowId())
                .newState(request.getNewState())
                .transitionType(request.getTransitionType())
                .executionId(request.getExecutionId())
                .progress(request.getProgress())
                .metadata(request.getMetadata())
                .triggeredBy(request.getTriggeredBy())
                .reason(request.getReason())
                .build());
        StateTransitionResponseDTO response = new StateTransitionResponseDTO();
        response.setState(viewAssembler.toStateDTO(result.state()));
        response.setTransition(result.operation());
        return response;
    }

    /**
     * 应用一次迁移并在提交后发布状态变更事件。
     */
    public TransitionResult applyTransition(TransitionCommand command) {
        stateTransitionDomainService.validate(command);
        LocalDateTime now = LocalDateTime.now(clock);
        WorkflowStateEntity current = workflowStateRepository.findByWorkflowId(command.getWorkflowId().trim());
        TransitionResult result = stateTransitionDomainService.apply(current, command, now, strictTransitions);
        WorkflowStateEntity saved = result.created()
                ? workflowStateRepository.create(result.state(), result.transition())
                : workflowStateRepository.update(result.state(), result.transition());
        StateTransitionEntity transition = result.transition();
        log.info("Workflow state transition applied. workflowId={}, from={}, to={}, type={}, operation={}, version={}",
                saved.getWorkflowId(),
                transition.getFromState() == null ? null : transition.getFromState().getCode(),
                transition.getToState().getCode(),
                transition.getTransitionType().getCode(),
                result.operation(),
                saved.getVersion());
        TransitionResult committed = new TransitionResult(saved, transition, result.created());
        workflowStateEventPublisher.publish(new WorkflowStateChangedEvent(saved, transition, result.created()));
        return committed;
    }

    public StateCleanupResponseDTO cleanup(Integer daysOld, String workflowId) {
        StateCleanupResult result = purgeTerminalStates(daysOld == null ? DEFAULT_RETENTION_DAYS : daysOld, workflowId);
        StateCleanupResponseDTO response = new StateCleanupResponseDTO();
        response.setDeletedCount(result.deletedCount());
        response.setCutoffDate(result.cutoffDate());
        return response;
    }

    /**
     * 删除 updated_at 严格早于 now - daysOld 的终态快照。
     */
    public StateCleanupResult purgeTerminalStates(int daysOld, String workflowId) {
        if (daysOld < 0) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "days_old must be >= 0");
        }
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(daysOld);
        String scopedWorkflowId = StringUtils.trimToNull(workflowId);
        int deleted = workflowStateRepository.deleteTerminalBefore(cutoff, scopedWorkflowId);
        log.info("Workflow state cleanup finished. daysOld={}, workflowId={}, cutoff={}, deleted={}",
                daysOld, scopedWorkflowId, cutoff, deleted);
        return new StateCleanupResult(deleted, cutoff);
    }
}
