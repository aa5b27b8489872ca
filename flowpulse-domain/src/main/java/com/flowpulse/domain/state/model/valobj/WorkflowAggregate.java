package com.flowpulse.domain.state.model.valobj;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单个工作流的聚合统计（由迁移日志实时计算）。
 */
@Data
public class WorkflowAggregate {

    private String workflowId;
    private long totalTransitions;
    private Map<String, Long> stateCounts = new LinkedHashMap<>();
    private Map<String, Long> timeInStateMs = new LinkedHashMap<>();
    private long totalExecutions;
    private long successfulExecutions;
    private long failedExecutions;
    private long cancelledExecutions;
    private double successRate;
    private Double averageDuration;
    private LocalDateTime lastTransitionAt;
}
