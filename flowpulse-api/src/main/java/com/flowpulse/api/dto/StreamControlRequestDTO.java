package com.flowpulse.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 推送通道控制指令。
 * <p>
 * action 取值：get_status、inject_data、send_to_client、broadcast、get_forecasts、get_alerts。
 * </p>
 */
@Data
public class StreamControlRequestDTO {

    private String action;
    private Map<String, Object> payload;
    private String clientId;
    private List<String> channels;
}
