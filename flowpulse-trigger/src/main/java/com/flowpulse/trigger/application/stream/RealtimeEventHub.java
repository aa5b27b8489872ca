package com.flowpulse.trigger.application.stream;

import com.flowpulse.domain.state.model.entity.StateTransitionEntity;
import com.flowpulse.domain.state.model.entity.WorkflowStateEntity;
import com.flowpulse.domain.state.model.valobj.WorkflowStateChangedEvent;
import com.flowpulse.domain.stream.adapter.gateway.IInsightDataEngine;
import com.flowpulse.domain.stream.adapter.gateway.IStreamSink;
import com.flowpulse.domain.stream.adapter.registry.IClientConnectionRegistry;
import com.flowpulse.domain.stream.model.entity.ClientConnectionEntity;
import com.flowpulse.domain.stream.model.valobj.StreamMessage;
import com.flowpulse.trigger.event.WorkflowStateEventPublisher;
import com.flowpulse.types.common.Constants;
import com.flowpulse.types.enums.StreamMessageTypeEnum;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 实时事件推送中心。
 * <p>
 * 维护客户端连接的完整生命周期：建连快照、单连接心跳、定向/全量/频道广播、全局巡检与失败清理。
 * 计时器都挂在 daemonScheduler 上，由 Spring 生命周期统一启停。
 * </p>
 */
@Slf4j
@Service
public class RealtimeEventHub implements SmartLifecycle {

    private static final String STATE_SUBSCRIBER_ID = "realtime-event-hub";

    private final IClientConnectionRegistry connectionRegistry;
    private final IInsightDataEngine insightDataEngine;
    private final WorkflowStateEventPublisher workflowStateEventPublisher;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration heartbeatInterval;
    private final Duration sweepInterval;
    private final Counter connectCounter;
    private final Counter pushAttemptCounter;
    private final Counter pushFailCounter;
    private final Counter reapedCounter;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> sweepTask;

    public RealtimeEventHub(IClientConnectionRegistry connectionRegistry,
                            IInsightDataEngine insightDataEngine,
                            WorkflowStateEventPublisher workflowStateEventPublisher,
                            @Qualifier("daemonScheduler") TaskScheduler taskScheduler,
                            Clock clock,
                            ObjectProvider<MeterRegistry> meterRegistryProvider,
                            @Value("${stream.heartbeat-interval-ms:30000}") long heartbeatIntervalMs,
                            @Value("${stream.sweep-interval-ms:60000}") long sweepIntervalMs) {
        this.connectionRegistry = connectionRegistry;
        this.insightDataEngine = insightDataEngine;
        this.workflowStateEventPublisher = workflowStateEventPublisher;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.heartbeatInterval = Duration.ofMillis(Math.max(heartbeatIntervalMs, 1000L));
        this.sweepInterval = Duration.ofMillis(Math.max(sweepIntervalMs, 1000L));
        MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new);
        this.connectCounter = Counter.builder("flowpulse.stream.connect.total").register(meterRegistry);
        this.pushAttemptCounter = Counter.builder("flowpulse.stream.push.attempt.total").register(meterRegistry);
        this.pushFailCounter = Counter.builder("flowpulse.stream.push.fail.total").register(meterRegistry);
        this.reapedCounter = Counter.builder("flowpulse.stream.reaped.total").register(meterRegistry);
        Gauge.builder("flowpulse.stream.connections.active", connectionRegistry, IClientConnectionRegistry::size)
                .register(meterRegistry);
    }

    /**
     * 建立连接：登记（替换同名旧连接）、发送初始快照、订阅上游引擎并启动心跳。
     * 快照期间客户端断开时不再订阅；订阅期间断开则撤销订阅，心跳由连接自行取消。
     */
    public ClientConnectionEntity connect(String clientId, Set<String> channels, IStreamSink sink) {
        ClientConnectionEntity connection = new ClientConnectionEntity(clientId, channels, sink, clock.instant());
        ClientConnectionEntity replaced = connectionRegistry.register(connection);
        if (replaced != null && replaced != connection) {
            replaced.close();
            log.info("Stream connection replaced. clientId={}", connection.getClientId());
        }
        connectCounter.increment();

        Map<String, Object> connected = new LinkedHashMap<>();
        connected.put("clientId", connection.getClientId());
        connected.put("channels", new ArrayList<>(connection.getChannels()));
        boolean ok = deliver(connection, message(StreamMessageTypeEnum.CONNECTED, connected))
                && deliver(connection, message(StreamMessageTypeEnum.INITIAL_FORECASTS, insightDataEngine.getForecasts()))
                && deliver(connection, message(StreamMessageTypeEnum.INITIAL_ALERTS, insightDataEngine.getActiveAlerts()))
                && deliver(connection, message(StreamMessageTypeEnum.ENGINE_STATUS, insightDataEngine.getStatus()));
        if (!ok || connection.isClosed()) {
            return connection;
        }
        insightDataEngine.subscribe(connection.getClientId(), connection.getChannels(),
                upstream -> deliver(connection, upstream));
        connection.attachHeartbeat(taskScheduler.scheduleAtFixedRate(
                () -> deliver(connection, message(StreamMessageTypeEnum.PING, null)),
                taskScheduler.getClock().instant().plus(heartbeatInterval),
                heartbeatInterval));
        if (connection.isClosed()) {
            // 订阅期间连接已被清理：撤销本次订阅，同名新连接的订阅保持不动
            if (connectionRegistry.find(connection.getClientId()) == null) {
                insightDataEngine.unsubscribe(connection.getClientId());
            }
            return connection;
        }
        log.info("Stream connection opened. clientId={}, channels={}, activeConnections={}",
                connection.getClientId(), connection.getChannels(), connectionRegistry.size());
        return connection;
    }

    /**
     * 定向推送，客户端不存在或写失败返回 false。
     */
    public boolean sendToClient(String clientId, Object payload) {
        ClientConnectionEntity connection = clientId == null ? null : connectionRegistry.find(clientId.trim());
        if (connection == null) {
            return false;
        }
        return deliver(connection, message(StreamMessageTypeEnum.DATA, payload));
    }

    /**
     * 全量广播。
     *
     * @return 成功送达的连接数
     */
    public int broadcastToAll(Object payload) {
        StreamMessage message = message(StreamMessageTypeEnum.BROADCAST, payload);
        return deliverAll(connectionRegistry.findAll(), message);
    }

    /**
     * 频道广播，只送达订阅了任一目标频道的连接。
     */
    public int broadcastToChannels(Collection<String> channels, Object payload) {
        if (channels == null || channels.isEmpty()) {
            return 0;
        }
        StreamMessage message = StreamMessage.builder()
                .type(StreamMessageTypeEnum.CHANNEL_MESSAGE)
                .payload(payload)
                .timestamp(clock.instant())
                .channels(new ArrayList<>(channels))
                .build();
        return deliverAll(connectionRegistry.findByChannels(channels), message);
    }

    /**
     * 全局巡检：向所有连接发送 heartbeat，写失败的连接被清理。
     *
     * @return 本轮清理的连接数
     */
    public int sweep() {
        StreamMessage liveness = message(StreamMessageTypeEnum.HEARTBEAT, null);
        int reaped = 0;
        for (ClientConnectionEntity connection : connectionRegistry.findAll()) {
            if (!deliver(connection, liveness)) {
                reaped++;
            }
        }
        if (reaped > 0) {
            reapedCounter.increment(reaped);
            log.info("Stream sweep reaped dead connections. reaped={}, activeConnections={}",
                    reaped, connectionRegistry.size());
        }
        return reaped;
    }

    /**
     * 清理单个连接：仅当注册表中仍是该实例时才解除上游订阅。
     */
    public void disconnect(ClientConnectionEntity connection) {
        if (connection == null) {
            return;
        }
        if (connectionRegistry.remove(connection)) {
            insightDataEngine.unsubscribe(connection.getClientId());
        }
        if (connection.close()) {
            log.info("Stream connection closed. clientId={}, activeConnections={}",
                    connection.getClientId(), connectionRegistry.size());
        }
    }

    public int connectionCount() {
        return connectionRegistry.size();
    }

    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("engine", insightDataEngine.getStatus());
        status.put("connections", connectionRegistry.size());
        return status;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        workflowStateEventPublisher.subscribe(STATE_SUBSCRIBER_ID, this::onWorkflowStateChanged);
        sweepTask = taskScheduler.scheduleAtFixedRate(this::sweep,
                taskScheduler.getClock().instant().plus(sweepInterval), sweepInterval);
        log.info("Realtime event hub started. heartbeatIntervalMs={}, sweepIntervalMs={}",
                heartbeatInterval.toMillis(), sweepInterval.toMillis());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        workflowStateEventPublisher.unsubscribe(STATE_SUBSCRIBER_ID);
        ScheduledFuture<?> task = sweepTask;
        if (task != null) {
            task.cancel(false);
            sweepTask = null;
        }
        List<ClientConnectionEntity> connections = connectionRegistry.findAll();
        for (ClientConnectionEntity connection : connections) {
            disconnect(connection);
        }
        log.info("Realtime event hub stopped. closedConnections={}", connections.size());
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    void onWorkflowStateChanged(WorkflowStateChangedEvent event) {
        WorkflowStateEntity state = event.state();
        StateTransitionEntity transition = event.transition();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("workflow_id", state.getWorkflowId());
        payload.put("current_state", state.getCurrentState() == null ? null : state.getCurrentState().getCode());
        payload.put("previous_state", state.getPreviousState() == null ? null : state.getPreviousState().getCode());
        payload.put("transition_type", transition == null || transition.getTransitionType() == null
                ? null : transition.getTransitionType().getCode());
        payload.put("progress_percentage", state.getProgressPercentage());
        payload.put("timestamp", state.getUpdatedAt() == null ? null : state.getUpdatedAt().toString());
        broadcastToChannels(List.of(Constants.CHANNEL_WORKFLOWS), payload);
    }

    private int deliverAll(List<ClientConnectionEntity> connections, StreamMessage message) {
        int delivered = 0;
        for (ClientConnectionEntity connection : connections) {
            if (deliver(connection, message)) {
                delivered++;
            }
        }
        return delivered;
    }

    private boolean deliver(ClientConnectionEntity connection, StreamMessage message) {
        pushAttemptCounter.increment();
        try {
            connection.send(message, clock.instant());
            return true;
        } catch (IOException | RuntimeException ex) {
            pushFailCounter.increment();
            log.debug("Stream push failed. clientId={}, type={}, error={}",
                    connection.getClientId(), message.getType().getCode(), ex.getMessage());
            disconnect(connection);
            return false;
        }
    }

    private StreamMessage message(StreamMessageTypeEnum type, Object payload) {
        return StreamMessage.of(type, payload, clock.instant());
    }
}
