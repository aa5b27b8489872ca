package com.flowpulse.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 外发端点派生状态
 *
 * @author flowpulse
 * @since 2026-10-19
 */
public enum EndpointStatusEnum {

    ACTIVE("active"),
    INACTIVE("inactive"),
    ERROR("error");

    private final String code;

    EndpointStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
