package com.flowpulse.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 实时推送消息类型
 *
 * @author flowpulse
 * @since 2026-10-19
 */
public enum StreamMessageTypeEnum {

    /**
     * 连接建立确认
     */
    CONNECTED("connected"),

    /**
     * 初始快照：当前预测
     */
    INITIAL_FORECASTS("initial_forecasts"),

    /**
     * 初始快照：活跃告警
     */
    INITIAL_ALERTS("initial_alerts"),

    /**
     * 初始快照：数据引擎状态
     */
    ENGINE_STATUS("engine_status"),

    /**
     * 上游数据引擎推送
     */
    DATA("data"),

    /**
     * 单连接心跳
     */
    PING("ping"),

    BROADCAST("broadcast"),

    CHANNEL_MESSAGE("channel_message"),

    /**
     * 全局巡检探活
     */
    HEARTBEAT("heartbeat");

    private final String code;

    StreamMessageTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
