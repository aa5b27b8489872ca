package com.flowpulse.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 紧急派发结果。
 */
@Data
public class EmergencyDispatchResponseDTO {

    private boolean success;
    private String priorityLevel;
    private String deliveredEndpointId;
    private List<String> attemptedEndpointIds;
}
