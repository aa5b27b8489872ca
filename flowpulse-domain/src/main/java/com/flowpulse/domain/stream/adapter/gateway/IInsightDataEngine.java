package com.flowpulse.domain.stream.adapter.gateway;

import com.flowpulse.domain.stream.model.valobj.StreamMessage;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 上游洞察数据引擎接口 (预测、告警、引擎状态)
 *
 * @author flowpulse
 * @since 2026-10-19
 */
public interface IInsightDataEngine {

    /**
     * 订阅引擎推送，只接收 channels 内的数据
     */
    void subscribe(String clientId, Set<String> channels, Consumer<StreamMessage> listener);

    void unsubscribe(String clientId);

    List<Map<String, Object>> getForecasts();

    List<Map<String, Object>> getActiveAlerts();

    Map<String, Object> getStatus();

    /**
     * 注入数据并推送给订阅者
     *
     * @return 数据被路由到的频道
     */
    String injectData(String type, Map<String, Object> payload);
}
