package com.flowpulse.domain.state.service;

import com.flowpulse.domain.state.model.entity.StateTransitionEntity;
import com.flowpulse.domain.state.model.valobj.WorkflowAggregate;
import com.flowpulse.types.enums.WorkflowStateEnum;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 聚合统计领域服务：从迁移日志重算单个工作流的状态分布、执行次数、成功率与平均耗时。
 */
@Service
public class WorkflowAggregateDomainService {

    public WorkflowAggregate aggregate(String workflowId, List<StateTransitionEntity> transitions) {
        WorkflowAggregate aggregate = new WorkflowAggregate();
        aggregate.setWorkflowId(workflowId);
        if (transitions == null || transitions.isEmpty()) {
            return aggregate;
        }
        List<StateTransitionEntity> ordered = transitions.stream()
                .filter(item -> item != null && item.getToState() != null)
                .sorted(Comparator.comparing(StateTransitionEntity::getTimestamp,
                                Comparator.nullsFirst(Comparator.naturalOrder()))
                        .thenComparing(StateTransitionEntity::getId, Comparator.nullsFirst(Comparator.naturalOrder())))
                .collect(Collectors.toList());

        LocalDateTime runStartedAt = null;
        long executionDurationSum = 0L;
        long measuredExecutions = 0L;
        for (StateTransitionEntity transition : ordered) {
            WorkflowStateEnum toState = transition.getToState();
            aggregate.setTotalTransitions(aggregate.getTotalTransitions() + 1);
            aggregate.getStateCounts().merge(toState.getCode(), 1L, Long::sum);
            if (transition.getFromState() != null && transition.getDurationInPreviousState() != null) {
                aggregate.getTimeInStateMs().merge(transition.getFromState().getCode(),
                        transition.getDurationInPreviousState(), Long::sum);
            }
            if (toState == WorkflowStateEnum.RUNNING && runStartedAt == null) {
                runStartedAt = transition.getTimestamp();
            }
            if (toState.isTerminal()) {
                aggregate.setTotalExecutions(aggregate.getTotalExecutions() + 1);
                switch (toState) {
                    case COMPLETED -> aggregate.setSuccessfulExecutions(aggregate.getSuccessfulExecutions() + 1);
                    case FAILED -> aggregate.setFailedExecutions(aggregate.getFailedExecutions() + 1);
                    case CANCELLED -> aggregate.setCancelledExecutions(aggregate.getCancelledExecutions() + 1);
                    default -> {
                    }
                }
                if (runStartedAt != null && transition.getTimestamp() != null) {
                    executionDurationSum += Math.max(0L, Duration.between(runStartedAt, transition.getTimestamp()).toMillis());
                    measuredExecutions++;
                }
                runStartedAt = null;
            }
            aggregate.setLastTransitionAt(transition.getTimestamp());
        }
        aggregate.setSuccessRate(rate(aggregate.getSuccessfulExecutions(), aggregate.getTotalExecutions()));
        aggregate.setAverageDuration(measuredExecutions == 0L ? null : (double) executionDurationSum / measuredExecutions);
        return aggregate;
    }

    private double rate(long part, long total) {
        if (total <= 0L) {
            return 0D;
        }
        double rate = (part * 100.0D) / total;
        return Math.round(rate * 100.0D) / 100.0D;
    }
}
