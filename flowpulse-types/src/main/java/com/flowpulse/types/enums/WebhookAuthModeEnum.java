package com.flowpulse.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 外发 Webhook 认证方式
 *
 * @author flowpulse
 * @since 2026-10-19
 */
public enum WebhookAuthModeEnum {

    NONE("none"),
    BEARER("bearer"),
    BASIC("basic"),
    WEBHOOK_SIGNATURE("webhook_signature");

    private final String code;

    WebhookAuthModeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static WebhookAuthModeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (WebhookAuthModeEnum mode : WebhookAuthModeEnum.values()) {
            if (mode.code.equalsIgnoreCase(code.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown webhook authentication mode: " + code);
    }
}
