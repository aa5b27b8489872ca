package com.flowpulse.infrastructure.stream;

import com.flowpulse.domain.stream.adapter.gateway.IInsightDataEngine;
import com.flowpulse.domain.stream.model.valobj.StreamMessage;
import com.flowpulse.domain.stream.service.StreamChannelDomainService;
import com.flowpulse.types.common.Constants;
import com.flowpulse.types.enums.StreamMessageTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 进程内洞察数据引擎：保留最近的预测与告警，注入数据按频道推送给订阅者。
 */
@Slf4j
@Component
public class InMemoryInsightDataEngine implements IInsightDataEngine {

    private final StreamChannelDomainService channelDomainService;
    private final Clock clock;
    private final int retainLimit;
    private final Deque<Map<String, Object>> forecasts = new ConcurrentLinkedDeque<>();
    private final Deque<Map<String, Object>> alerts = new ConcurrentLinkedDeque<>();
    private final ConcurrentMap<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final AtomicLong processedCount = new AtomicLong();
    private final Instant startedAt;
    private volatile Instant lastInjectedAt;

    public InMemoryInsightDataEngine(StreamChannelDomainService channelDomainService,
                                     Clock clock,
                                     @Value("${stream.engine.retain-limit:50}") int retainLimit) {
        this.channelDomainService = channelDomainService;
        this.clock = clock;
        this.retainLimit = Math.max(retainLimit, 1);
        this.startedAt = clock.instant();
    }

    @Override
    public void subscribe(String clientId, Set<String> channels, Consumer<StreamMessage> listener) {
        if (clientId == null || listener == null) {
            return;
        }
        Set<String> copied = channels == null ? new LinkedHashSet<>() : new LinkedHashSet<>(channels);
        subscriptions.put(clientId, new Subscription(copied, listener));
    }

    @Override
    public void unsubscribe(String clientId) {
        if (clientId != null) {
            subscriptions.remove(clientId);
        }
    }

    @Override
    public List<Map<String, Object>> getForecasts() {
        return new ArrayList<>(forecasts);
    }

    @Override
    public List<Map<String, Object>> getActiveAlerts() {
        return new ArrayList<>(alerts);
    }

    @Override
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("running", true);
        status.put("startedAt", startedAt.toString());
        status.put("subscribers", subscriptions.size());
        status.put("forecastCount", forecasts.size());
        status.put("activeAlertCount", alerts.size());
        status.put("dataPointsProcessed", processedCount.get());
        Instant last = lastInjectedAt;
        status.put("lastInjectedAt", last == null ? null : last.toString());
        return status;
    }

    @Override
    public String injectData(String type, Map<String, Object> payload) {
        String channel = channelDomainService.routeDataType(type);
        Instant now = clock.instant();
        Map<String, Object> record = new LinkedHashMap<>();
        if (payload != null) {
            record.putAll(payload);
        }
        record.put("type", type);
        record.put("receivedAt", now.toString());
        if (Constants.CHANNEL_FORECASTS.equals(channel)) {
            retain(forecasts, record);
        } else if (Constants.CHANNEL_ALERTS.equals(channel)) {
            retain(alerts, record);
        }
        processedCount.incrementAndGet();
        lastInjectedAt = now;

        StreamMessage message = StreamMessage.builder()
                .type(StreamMessageTypeEnum.DATA)
                .payload(record)
                .timestamp(now)
                .channels(List.of(channel))
                .build();
        dispatch(channel, message);
        return channel;
    }

    private void retain(Deque<Map<String, Object>> buffer, Map<String, Object> record) {
        buffer.addFirst(record);
        while (buffer.size() > retainLimit) {
            buffer.pollLast();
        }
    }

    private void dispatch(String channel, StreamMessage message) {
        for (Map.Entry<String, Subscription> entry : subscriptions.entrySet()) {
            Subscription subscription = entry.getValue();
            if (!subscription.channels().contains(channel)) {
                continue;
            }
            try {
                subscription.listener().accept(message);
            } catch (Exception ex) {
                log.debug("Insight data dispatch failed. clientId={}, channel={}, error={}",
                        entry.getKey(), channel, ex.getMessage());
            }
        }
    }

    private record Subscription(Set<String> channels, Consumer<StreamMessage> listener) {
    }
}
