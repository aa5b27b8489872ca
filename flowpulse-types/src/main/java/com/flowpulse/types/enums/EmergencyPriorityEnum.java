package com.flowpulse.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 紧急投递优先级
 *
 * @author flowpulse
 * @since 2026-10-19
 */
public enum EmergencyPriorityEnum {

    HIGH("high"),
    URGENT("urgent"),
    CRITICAL("critical");

    private final String code;

    EmergencyPriorityEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static EmergencyPriorityEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (EmergencyPriorityEnum priority : EmergencyPriorityEnum.values()) {
            if (priority.code.equalsIgnoreCase(code.trim())) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown emergency priority level: " + code);
    }
}
