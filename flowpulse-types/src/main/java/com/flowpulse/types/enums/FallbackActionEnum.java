package com.flowpulse.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 外发 Webhook 重试耗尽后的兜底动作
 *
 * @author flowpulse
 * @since 2026-10-19
 */
public enum FallbackActionEnum {

    IGNORE("ignore"),
    LOG("log"),
    ALERT("alert");

    private final String code;

    FallbackActionEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static FallbackActionEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (FallbackActionEnum action : FallbackActionEnum.values()) {
            if (action.code.equalsIgnoreCase(code.trim())) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown fallback action code: " + code);
    }
}
