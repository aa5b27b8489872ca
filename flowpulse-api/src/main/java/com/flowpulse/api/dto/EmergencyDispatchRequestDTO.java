package com.flowpulse.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 紧急派发请求。
 */
@Data
public class EmergencyDispatchRequestDTO {

    private String workflowId;
    private Map<String, Object> data;
    private String triggerType;
    private String priorityLevel;
    private Long maxDelayMs;
    private Boolean overrideConflicts;
    private String primaryEndpointId;
    private List<String> fallbackEndpointIds;
}
