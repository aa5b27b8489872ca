package com.flowpulse.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 编排整体健康度
 *
 * @author flowpulse
 * @since 2026-10-19
 */
public enum SystemHealthEnum {

    /**
     * 成功率高于 95%
     */
    HEALTHY("healthy"),

    /**
     * 成功率高于 80%
     */
    WARNING("warning"),

    CRITICAL("critical");

    private final String code;

    SystemHealthEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static SystemHealthEnum fromSuccessRate(double successRate) {
        if (successRate > 95D) {
            return HEALTHY;
        }
        if (successRate > 80D) {
            return WARNING;
        }
        return CRITICAL;
    }
}
