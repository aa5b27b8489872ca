package com.flowpulse.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 工作流实例状态枚举
 *
 * @author flowpulse
 * @since 2026-10-19
 */
public enum WorkflowStateEnum {

    /**
     * 空闲 - 尚未开始或已重置
     */
    IDLE("idle", false),

    /**
     * 待执行 - 已进入执行队列
     */
    PENDING("pending", false),

    /**
     * 运行中
     */
    RUNNING("running", false),

    /**
     * 暂停 - 可恢复
     */
    PAUSED("paused", false),

    /**
     * 已完成
     */
    COMPLETED("completed", true),

    /**
     * 失败
     */
    FAILED("failed", true),

    /**
     * 已取消
     */
    CANCELLED("cancelled", true),

    /**
     * 重试中
     */
    RETRYING("retrying", false),

    /**
     * 已排期
     */
    SCHEDULED("scheduled", false);

    private final String code;
    private final boolean terminal;

    WorkflowStateEnum(String code, boolean terminal) {
        this.code = code;
        this.terminal = terminal;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 终态：completed / failed / cancelled。
     */
    public boolean isTerminal() {
        return terminal;
    }

    public static WorkflowStateEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (WorkflowStateEnum state : WorkflowStateEnum.values()) {
            if (state.code.equals(code)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown workflow state code: " + code);
    }

    public static boolean isValidCode(String code) {
        if (code == null) {
            return false;
        }
        for (WorkflowStateEnum state : WorkflowStateEnum.values()) {
            if (state.code.equals(code)) {
                return true;
            }
        }
        return false;
    }
}
