package com.flowpulse.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 终态保留期清理结果。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StateCleanupResponseDTO {

    private Integer deletedCount;
    private LocalDateTime cutoffDate;
}
