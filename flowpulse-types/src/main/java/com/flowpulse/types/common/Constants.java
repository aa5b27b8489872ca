package com.flowpulse.types.common;

/**
 * 全局常量定义类。
 * <p>
 * 定义系统中使用的全局常量，如分隔符、默认频道等通用配置。
 * </p>
 *
 * @author flowpulse
 * @since 2026-10-19
 */
public class Constants {

    /** 逗号分隔符，用于字符串分割操作 */
    public final static String SPLIT = ",";

    /** 客户端未指定频道时的默认订阅 */
    public final static String[] DEFAULT_STREAM_CHANNELS = {"insights", "alerts", "forecasts"};

    /** 工作流状态变更广播频道 */
    public final static String CHANNEL_WORKFLOWS = "workflows";

    /** 入站 Webhook 事件广播频道 */
    public final static String CHANNEL_WEBHOOKS = "webhooks";

    /** 告警频道 */
    public final static String CHANNEL_ALERTS = "alerts";

    /** 预测频道 */
    public final static String CHANNEL_FORECASTS = "forecasts";

    /** 洞察频道 */
    public final static String CHANNEL_INSIGHTS = "insights";

    /** 状态历史最大返回条数 */
    public final static int STATE_HISTORY_LIMIT = 50;

    /** 外发 Webhook 载荷中的来源标识 */
    public final static String OUTBOUND_SOURCE = "flowpulse";

}
