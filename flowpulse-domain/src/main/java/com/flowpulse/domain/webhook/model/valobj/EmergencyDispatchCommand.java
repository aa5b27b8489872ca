package com.flowpulse.domain.webhook.model.valobj;

import com.flowpulse.types.enums.EmergencyPriorityEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 紧急派发指令：主目标失败后依次尝试备用端点，可跳过派发间隔限制。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmergencyDispatchCommand {

    private String workflowId;
    private Map<String, Object> data;
    private String triggerType;
    private EmergencyPriorityEnum priorityLevel;
    private Long maxDelayMs;
    private boolean overrideConflicts;
    private String primaryEndpointId;
    private List<String> fallbackEndpointIds;
}
