package com.flowpulse.domain.state.service;

import com.flowpulse.types.enums.WorkflowStateEnum;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 状态迁移合法性表：from_state → 允许的 to_state 集合。
 */
public final class StateTransitionPolicy {

    private static final Map<WorkflowStateEnum, Set<WorkflowStateEnum>> ALLOWED = new EnumMap<>(WorkflowStateEnum.class);

    static {
        ALLOWED.put(WorkflowStateEnum.IDLE, EnumSet.of(
                WorkflowStateEnum.PENDING, WorkflowStateEnum.SCHEDULED, WorkflowStateEnum.RUNNING));
        ALLOWED.put(WorkflowStateEnum.PENDING, EnumSet.of(
                WorkflowStateEnum.RUNNING, WorkflowStateEnum.CANCELLED, WorkflowStateEnum.FAILED));
        ALLOWED.put(WorkflowStateEnum.RUNNING, EnumSet.of(
                WorkflowStateEnum.PAUSED, WorkflowStateEnum.COMPLETED, WorkflowStateEnum.FAILED, WorkflowStateEnum.CANCELLED));
        ALLOWED.put(WorkflowStateEnum.PAUSED, EnumSet.of(
                WorkflowStateEnum.RUNNING, WorkflowStateEnum.CANCELLED, WorkflowStateEnum.FAILED));
        ALLOWED.put(WorkflowStateEnum.COMPLETED, EnumSet.of(
                WorkflowStateEnum.IDLE, WorkflowStateEnum.PENDING));
        ALLOWED.put(WorkflowStateEnum.FAILED, EnumSet.of(
                WorkflowStateEnum.RETRYING, WorkflowStateEnum.CANCELLED, WorkflowStateEnum.IDLE));
        ALLOWED.put(WorkflowStateEnum.CANCELLED, EnumSet.of(
                WorkflowStateEnum.IDLE, WorkflowStateEnum.PENDING));
        ALLOWED.put(WorkflowStateEnum.RETRYING, EnumSet.of(
                WorkflowStateEnum.RUNNING, WorkflowStateEnum.FAILED, WorkflowStateEnum.CANCELLED));
        ALLOWED.put(WorkflowStateEnum.SCHEDULED, EnumSet.of(
                WorkflowStateEnum.PENDING, WorkflowStateEnum.RUNNING, WorkflowStateEnum.CANCELLED));
    }

    private StateTransitionPolicy() {
    }

    public static boolean isAllowed(WorkflowStateEnum from, WorkflowStateEnum to) {
        if (from == null || to == null) {
            return false;
        }
        return ALLOWED.getOrDefault(from, Collections.emptySet()).contains(to);
    }

    public static Set<WorkflowStateEnum> allowedTargets(WorkflowStateEnum from) {
        if (from == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(ALLOWED.getOrDefault(from, EnumSet.noneOf(WorkflowStateEnum.class)));
    }
}
