package com.flowpulse.domain.webhook.model.valobj;

import com.flowpulse.types.enums.EmergencyPriorityEnum;

import java.util.List;

/**
 * 紧急派发结果。
 */
public record EmergencyDispatchResult(boolean success,
                                      EmergencyPriorityEnum priorityLevel,
                                      String deliveredEndpointId,
                                      List<String> attemptedEndpointIds) {

    public EmergencyDispatchResult {
        attemptedEndpointIds = attemptedEndpointIds == null ? List.of() : List.copyOf(attemptedEndpointIds);
    }
}
