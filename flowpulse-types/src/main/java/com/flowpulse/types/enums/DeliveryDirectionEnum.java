package com.flowpulse.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Webhook 投递方向
 *
 * @author flowpulse
 * @since 2026-10-19
 */
public enum DeliveryDirectionEnum {

    INBOUND("inbound"),
    OUTBOUND("outbound");

    private final String code;

    DeliveryDirectionEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static DeliveryDirectionEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (DeliveryDirectionEnum direction : DeliveryDirectionEnum.values()) {
            if (direction.code.equals(code)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown delivery direction: " + code);
    }
}
