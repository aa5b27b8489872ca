package com.flowpulse.trigger.application.query;

import com.flowpulse.api.dto.StateTransitionDTO;
import com.flowpulse.api.dto.WorkflowAggregateDTO;
import com.flowpulse.api.dto.WorkflowStateBatchDTO;
import com.flowpulse.api.dto.WorkflowStateDTO;
import com.flowpulse.api.dto.WorkflowStateDetailDTO;
import com.flowpulse.domain.state.adapter.repository.IStateTransitionRepository;
import com.flowpulse.domain.state.adapter.repository.IWorkflowStateRepository;
import com.flowpulse.domain.state.model.entity.StateTransitionEntity;
import com.flowpulse.domain.state.model.entity.WorkflowStateEntity;
import com.flowpulse.domain.state.service.WorkflowAggregateDomainService;
import com.flowpulse.trigger.application.common.WorkflowStateViewAssembler;
import com.flowpulse.types.common.Constants;
import com.flowpulse.types.enums.ResponseCode;
import com.flowpulse.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 工作流状态读用例：单个/批量快照、历史与聚合。
 */
@Service
public class WorkflowStateQueryService {

    private final IWorkflowStateRepository workflowStateRepository;
    private final IStateTransitionRepository stateTransitionRepository;
    private final WorkflowAggregateDomainService aggregateDomainService;
    private final WorkflowStateViewAssembler viewAssembler;

    public WorkflowStateQueryService(IWorkflowStateRepository workflowStateRepository,
                                     IStateTransitionRepository stateTransitionRepository,
                                     WorkflowAggregateDomainService aggregateDomainService,
                                     WorkflowStateViewAssembler viewAssembler) {
        this.workflowStateRepository = workflowStateRepository;
        this.stateTransitionRepository = stateTransitionRepository;
        this.aggregateDomainService = aggregateDomainService;
        this.viewAssembler = viewAssembler;
    }

    public WorkflowStateDetailDTO getState(String workflowId, boolean includeHistory, boolean includeAggregates) {
        if (StringUtils.isBlank(workflowId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "workflow_id is required");
        }
        String normalizedId = workflowId.trim();
        WorkflowStateEntity state = workflowStateRepository.findByWorkflowId(normalizedId);
        if (state == null) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "Workflow state not found: " + normalizedId);
        }
        WorkflowStateDetailDTO detail = new WorkflowStateDetailDTO();
        detail.setState(viewAssembler.toStateDTO(state));
        if (includeHistory) {
            List<StateTransitionDTO> history = new ArrayList<>();
            for (StateTransitionEntity transition : stateTransitionRepository.findRecentByWorkflowId(normalizedId, Constants.STATE_HISTORY_LIMIT)) {
                history.add(viewAssembler.toTransitionDTO(transition));
            }
            detail.setHistory(history);
        }
        if (includeAggregates) {
            detail.setAggregates(aggregateOf(normalizedId));
        }
        return detail;
    }

    /**
     * 批量查询；没有状态的 ID 不出现在结果中。
     */
    public WorkflowStateBatchDTO getStates(List<String> workflowIds, boolean includeAggregates) {
        Set<String> ids = new LinkedHashSet<>();
        if (workflowIds != null) {
            for (String workflowId : workflowIds) {
                String normalized = StringUtils.trimToNull(workflowId);
                if (normalized != null) {
                    ids.add(normalized);
                }
            }
        }
        if (ids.isEmpty()) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "workflow_ids is required");
        }
        Map<String, WorkflowStateEntity> latest = new LinkedHashMap<>();
        for (WorkflowStateEntity state : workflowStateRepository.findByWorkflowIds(new ArrayList<>(ids))) {
            WorkflowStateEntity existing = latest.get(state.getWorkflowId());
            if (existing == null || isAfter(state.getUpdatedAt(), existing.getUpdatedAt())) {
                latest.put(state.getWorkflowId(), state);
            }
        }
        Map<String, WorkflowStateDTO> states = new LinkedHashMap<>();
        for (String id : ids) {
            WorkflowStateEntity state = latest.get(id);
            if (state != null) {
                states.put(id, viewAssembler.toStateDTO(state));
            }
        }
        WorkflowStateBatchDTO batch = new WorkflowStateBatchDTO();
        batch.setStates(states);
        if (includeAggregates) {
            Map<String, WorkflowAggregateDTO> aggregates = new LinkedHashMap<>();
            for (String id : states.keySet()) {
                aggregates.put(id, aggregateOf(id));
            }
            batch.setAggregates(aggregates);
        }
        return batch;
    }

    private WorkflowAggregateDTO aggregateOf(String workflowId) {
        List<StateTransitionEntity> transitions = stateTransitionRepository.findAllByWorkflowId(workflowId);
        return viewAssembler.toAggregateDTO(aggregateDomainService.aggregate(workflowId, transitions));
    }

    private boolean isAfter(LocalDateTime candidate, LocalDateTime current) {
        if (candidate == null) {
            return false;
        }
        return current == null || candidate.isAfter(current);
    }
}
