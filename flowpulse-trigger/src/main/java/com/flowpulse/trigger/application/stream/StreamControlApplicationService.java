package com.flowpulse.trigger.application.stream;

import com.flowpulse.api.dto.StreamControlRequestDTO;
import com.flowpulse.domain.stream.adapter.gateway.IInsightDataEngine;
import com.flowpulse.domain.stream.service.StreamChannelDomainService;
import com.flowpulse.types.enums.ResponseCode;
import com.flowpulse.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 推送中心控制动作。
 */
@Slf4j
@Service
public class StreamControlApplicationService {

    private final RealtimeEventHub realtimeEventHub;
    private final IInsightDataEngine insightDataEngine;
    private final StreamChannelDomainService channelDomainService;

    public StreamControlApplicationService(RealtimeEventHub realtimeEventHub,
                                           IInsightDataEngine insightDataEngine,
                                           StreamChannelDomainService channelDomainService) {
        this.realtimeEventHub = realtimeEventHub;
        this.insightDataEngine = insightDataEngine;
        this.channelDomainService = channelDomainService;
    }

    public Map<String, Object> execute(StreamControlRequestDTO request) {
        if (request == null || StringUtils.isBlank(request.getAction())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "action is required");
        }
        String action = request.getAction().trim().toLowerCase();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("action", action);
        switch (action) {
            case "get_status" -> result.putAll(realtimeEventHub.status());
            case "inject_data" -> result.put("channel", injectData(request.getPayload()));
            case "send_to_client" -> result.put("delivered", sendToClient(request));
            case "broadcast" -> result.put("recipients", broadcast(request));
            case "get_forecasts" -> result.put("forecasts", insightDataEngine.getForecasts());
            case "get_alerts" -> result.put("alerts", insightDataEngine.getActiveAlerts());
            default -> throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "Unknown action: " + request.getAction());
        }
        return result;
    }

    private String injectData(Map<String, Object> payload) {
        Object type = payload == null ? null : payload.get("type");
        if (type == null || StringUtils.isBlank(String.valueOf(type))) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "payload.type is required");
        }
        Map<String, Object> data = new LinkedHashMap<>(payload);
        data.remove("type");
        String channel = insightDataEngine.injectData(String.valueOf(type).trim(), data);
        log.info("Stream data injected. type={}, channel={}", type, channel);
        return channel;
    }

    private boolean sendToClient(StreamControlRequestDTO request) {
        if (StringUtils.isBlank(request.getClientId())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "clientId is required");
        }
        if (!realtimeEventHub.sendToClient(request.getClientId(), request.getPayload())) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "Client not connected: " + request.getClientId().trim());
        }
        return true;
    }

    private int broadcast(StreamControlRequestDTO request) {
        Set<String> channels = channelDomainService.normalize(request.getChannels());
        if (channels.isEmpty()) {
            return realtimeEventHub.broadcastToAll(request.getPayload());
        }
        return realtimeEventHub.broadcastToChannels(channels, request.getPayload());
    }
}
