package com.flowpulse.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 入站 Webhook 来源平台枚举
 *
 * @author flowpulse
 * @since 2026-10-19
 */
public enum WebhookPlatformEnum {

    /**
     * Kajabi - 会员与订单事件
     */
    KAJABI("kajabi"),

    /**
     * Meta - 主页订阅事件（entry/changes 嵌套投递）
     */
    META("meta"),

    /**
     * n8n - 工作流执行事件
     */
    N8N("n8n");

    private final String code;

    WebhookPlatformEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 不区分大小写匹配，未知平台返回 null。
     */
    public static WebhookPlatformEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (WebhookPlatformEnum platform : WebhookPlatformEnum.values()) {
            if (platform.code.equalsIgnoreCase(code.trim())) {
                return platform;
            }
        }
        return null;
    }
}
