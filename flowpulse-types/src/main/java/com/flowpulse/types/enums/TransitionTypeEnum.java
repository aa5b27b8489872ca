package com.flowpulse.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 状态迁移类型枚举
 *
 * @author flowpulse
 * @since 2026-10-19
 */
public enum TransitionTypeEnum {

    START("start"),
    PAUSE("pause"),
    RESUME("resume"),
    COMPLETE("complete"),
    FAIL("fail"),
    CANCEL("cancel"),
    RETRY("retry"),
    SCHEDULE("schedule"),
    RESET("reset");

    private final String code;

    TransitionTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static TransitionTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TransitionTypeEnum type : TransitionTypeEnum.values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown transition type code: " + code);
    }

    public static boolean isValidCode(String code) {
        if (code == null) {
            return false;
        }
        for (TransitionTypeEnum type : TransitionTypeEnum.values()) {
            if (type.code.equals(code)) {
                return true;
            }
        }
        return false;
    }
}
