package com.flowpulse.trigger.http;

import com.flowpulse.api.dto.StateCleanupResponseDTO;
import com.flowpulse.api.dto.StateTransitionRequestDTO;
import com.flowpulse.api.dto.StateTransitionResponseDTO;
import com.flowpulse.api.response.Response;
import com.flowpulse.trigger.application.command.WorkflowStateCommandService;
import com.flowpulse.trigger.application.query.WorkflowStateQueryService;
import com.flowpulse.types.common.Constants;
import com.flowpulse.types.enums.ResponseCode;
import com.flowpulse.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;

/**
 * 工作流状态 API：查询、应用迁移、保留期清理。
 */
@RestController
@RequestMapping("/api/workflow/state")
public class WorkflowStateController {

    private final WorkflowStateCommandService workflowStateCommandService;
    private final WorkflowStateQueryService workflowStateQueryService;

    public WorkflowStateController(WorkflowStateCommandService workflowStateCommandService,
                                   WorkflowStateQueryService workflowStateQueryService) {
        this.workflowStateCommandService = workflowStateCommandService;
        this.workflowStateQueryService = workflowStateQueryService;
    }

    /**
     * workflow_id 查询单个（可带历史与聚合），workflow_ids 批量查询。
     */
    @GetMapping
    public Response<Object> getState(@RequestParam(value = "workflow_id", required = false) String workflowId,
                                     @RequestParam(value = "workflow_ids", required = false) String workflowIds,
                                     @RequestParam(value = "include_history", defaultValue = "false") boolean includeHistory,
                                     @RequestParam(value = "include_aggregates", defaultValue = "false") boolean includeAggregates) {
        if (StringUtils.isNotBlank(workflowId)) {
            return success(workflowStateQueryService.getState(workflowId, includeHistory, includeAggregates));
        }
        if (StringUtils.isNotBlank(workflowIds)) {
            return success(workflowStateQueryService.getStates(
                    Arrays.asList(workflowIds.split(Constants.SPLIT)), includeAggregates));
        }
        throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "workflow_id or workflow_ids is required");
    }

    @PostMapping
    public Response<StateTransitionResponseDTO> applyTransition(@RequestBody StateTransitionRequestDTO request) {
        return success(workflowStateCommandService.applyTransition(request));
    }

    @DeleteMapping
    public Response<StateCleanupResponseDTO> cleanup(@RequestParam(value = "days_old", required = false) Integer daysOld,
                                                     @RequestParam(value = "workflow_id", required = false) String workflowId) {
        return success(workflowStateCommandService.cleanup(daysOld, workflowId));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
