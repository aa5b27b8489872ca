package com.flowpulse.test;

import com.flowpulse.domain.state.model.entity.StateTransitionEntity;
import com.flowpulse.domain.state.model.entity.WorkflowStateEntity;
import com.flowpulse.domain.state.model.valobj.WorkflowStateChangedEvent;
import com.flowpulse.domain.stream.adapter.gateway.IStreamSink;
import com.flowpulse.domain.stream.model.entity.ClientConnectionEntity;
import com.flowpulse.domain.stream.model.valobj.StreamMessage;
import com.flowpulse.domain.stream.service.StreamChannelDomainService;
import com.flowpulse.infrastructure.stream.ConcurrentClientConnectionRegistry;
import com.flowpulse.infrastructure.stream.InMemoryInsightDataEngine;
import com.flowpulse.test.support.MutableClock;
import com.flowpulse.test.support.RecordingStreamSink;
import com.flowpulse.trigger.application.stream.RealtimeEventHub;
import com.flowpulse.trigger.event.WorkflowStateEventPublisher;
import com.flowpulse.types.enums.StreamMessageTypeEnum;
import com.flowpulse.types.enums.TransitionTypeEnum;
import com.flowpulse.types.enums.WorkflowStateEnum;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class RealtimeEventHubTest {

    private MutableClock clock;
    private ConcurrentClientConnectionRegistry registry;
    private InMemoryInsightDataEngine engine;
    private WorkflowStateEventPublisher publisher;
    private TaskScheduler taskScheduler;
    private ScheduledFuture<?> scheduledFuture;
    private MeterRegistry meterRegistry;
    private RealtimeEventHub hub;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(Instant.parse("2026-10-01T12:00:00Z"));
        registry = new ConcurrentClientConnectionRegistry();
        engine = new InMemoryInsightDataEngine(new StreamChannelDomainService(), clock, 50);
        publisher = new WorkflowStateEventPublisher();
        taskScheduler = mock(TaskScheduler.class);
        scheduledFuture = mock(ScheduledFuture.class);
        when(taskScheduler.getClock()).thenReturn(clock);
        doReturn(scheduledFuture).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        meterRegistry = new SimpleMeterRegistry();

        DefaultListableBeanFactory beanFactory = new DefaultListableBeanFactory();
        beanFactory.registerSingleton("meterRegistry", meterRegistry);
        ObjectProvider<MeterRegistry> meterRegistryProvider = beanFactory.getBeanProvider(MeterRegistry.class);

        hub = new RealtimeEventHub(registry, engine, publisher, taskScheduler, clock, meterRegistryProvider, 30000L, 60000L);
    }

    @Test
    public void shouldSendInitialSnapshotOnConnect() {
        RecordingStreamSink sink = new RecordingStreamSink();

        hub.connect("client-a", Set.of("alerts"), sink);

        Assertions.assertEquals(List.of(
                StreamMessageTypeEnum.CONNECTED,
                StreamMessageTypeEnum.INITIAL_FORECASTS,
                StreamMessageTypeEnum.INITIAL_ALERTS,
                StreamMessageTypeEnum.ENGINE_STATUS), sink.types());
        @SuppressWarnings("unchecked")
        Map<String, Object> connected = (Map<String, Object>) sink.getMessages().get(0).getPayload();
        Assertions.assertEquals("client-a", connected.get("clientId"));
        Assertions.assertEquals(1, hub.connectionCount());
        Assertions.assertEquals(1.0D, meterRegistry.counter("flowpulse.stream.connect.total").count());
    }

    @Test
    public void shouldPingOnHeartbeatTick() {
        RecordingStreamSink sink = new RecordingStreamSink();
        hub.connect("client-a", Set.of("alerts"), sink);

        ArgumentCaptor<Runnable> heartbeat = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).scheduleAtFixedRate(heartbeat.capture(), any(Instant.class), eq(Duration.ofSeconds(30)));
        heartbeat.getValue().run();

        Assertions.assertEquals(1, sink.messagesOfType(StreamMessageTypeEnum.PING).size());
    }

    @Test
    public void shouldDeliverChannelMessageOnlyToSubscribers() {
        RecordingStreamSink alertsSink = new RecordingStreamSink();
        RecordingStreamSink forecastsSink = new RecordingStreamSink();
        hub.connect("client-a", Set.of("alerts"), alertsSink);
        hub.connect("client-b", Set.of("forecasts"), forecastsSink);

        int delivered = hub.broadcastToChannels(List.of("alerts"), Map.of("level", "high"));

        Assertions.assertEquals(1, delivered);
        List<StreamMessage> received = alertsSink.messagesOfType(StreamMessageTypeEnum.CHANNEL_MESSAGE);
        Assertions.assertEquals(1, received.size());
        Assertions.assertEquals(List.of("alerts"), received.get(0).getChannels());
        Assertions.assertTrue(forecastsSink.messagesOfType(StreamMessageTypeEnum.CHANNEL_MESSAGE).isEmpty());
    }

    @Test
    public void shouldRouteInjectedDataBySubscribedChannel() {
        RecordingStreamSink alertsSink = new RecordingStreamSink();
        RecordingStreamSink forecastsSink = new RecordingStreamSink();
        hub.connect("client-a", Set.of("alerts"), alertsSink);
        hub.connect("client-b", Set.of("forecasts"), forecastsSink);

        String channel = engine.injectData("forecast", Map.of("value", 42));

        Assertions.assertEquals("forecasts", channel);
        Assertions.assertTrue(alertsSink.messagesOfType(StreamMessageTypeEnum.DATA).isEmpty());
        List<StreamMessage> data = forecastsSink.messagesOfType(StreamMessageTypeEnum.DATA);
        Assertions.assertEquals(1, data.size());
        Assertions.assertEquals(List.of("forecasts"), data.get(0).getChannels());
    }

    @Test
    public void shouldDropClientWhenWriteFails() {
        RecordingStreamSink healthy = new RecordingStreamSink();
        RecordingStreamSink broken = new RecordingStreamSink();
        hub.connect("client-a", Set.of("alerts"), healthy);
        hub.connect("client-b", Set.of("alerts"), broken);
        broken.setFailing(true);

        int delivered = hub.broadcastToAll(Map.of("notice", "maintenance"));

        Assertions.assertEquals(1, delivered);
        Assertions.assertEquals(1, hub.connectionCount());
        Assertions.assertTrue(broken.isClosed());
        Assertions.assertNull(registry.find("client-b"));
        Assertions.assertEquals(1, engine.getStatus().get("subscribers"));
        Assertions.assertFalse(hub.sendToClient("client-b", Map.of("x", 1)));
        Assertions.assertEquals(1.0D, meterRegistry.counter("flowpulse.stream.push.fail.total").count());
    }

    @Test
    public void shouldReapDeadConnectionsOnSweep() {
        RecordingStreamSink healthy = new RecordingStreamSink();
        RecordingStreamSink broken = new RecordingStreamSink();
        hub.connect("client-a", Set.of("insights"), healthy);
        hub.connect("client-b", Set.of("insights"), broken);
        broken.setFailing(true);

        int reaped = hub.sweep();

        Assertions.assertEquals(1, reaped);
        Assertions.assertEquals(1, healthy.messagesOfType(StreamMessageTypeEnum.HEARTBEAT).size());
        Assertions.assertEquals(1, hub.connectionCount());
        Assertions.assertEquals(1.0D, meterRegistry.counter("flowpulse.stream.reaped.total").count());
    }

    @Test
    public void shouldReplaceConnectionWithSameClientId() {
        RecordingStreamSink first = new RecordingStreamSink();
        RecordingStreamSink second = new RecordingStreamSink();
        ClientConnectionEntity oldConnection = hub.connect("client-a", Set.of("alerts"), first);
        hub.connect("client-a", Set.of("alerts"), second);

        Assertions.assertTrue(first.isClosed());
        Assertions.assertEquals(1, hub.connectionCount());

        hub.disconnect(oldConnection);
        Assertions.assertEquals(1, hub.connectionCount());
        Assertions.assertTrue(hub.sendToClient("client-a", Map.of("hello", "again")));
        Assertions.assertEquals(1, second.messagesOfType(StreamMessageTypeEnum.DATA).size());

        engine.injectData("alert", Map.of("severity", "critical"));
        Assertions.assertEquals(2, second.messagesOfType(StreamMessageTypeEnum.DATA).size());
        Assertions.assertEquals(0, first.messagesOfType(StreamMessageTypeEnum.DATA).size());
    }

    @Test
    public void shouldDiscardConnectionWhenInitialSnapshotFails() {
        RecordingStreamSink broken = new RecordingStreamSink();
        broken.setFailing(true);

        hub.connect("client-a", Set.of("alerts"), broken);

        Assertions.assertEquals(0, hub.connectionCount());
        Assertions.assertTrue(broken.isClosed());
        verify(taskScheduler, times(0)).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
    }

    @Test
    public void shouldNotSubscribeUpstreamWhenClientLeavesDuringSnapshot() {
        IStreamSink leaving = new IStreamSink() {
            @Override
            public void send(StreamMessage message) {
                if (message.getType() == StreamMessageTypeEnum.ENGINE_STATUS) {
                    hub.disconnect(registry.find("client-a"));
                }
            }

            @Override
            public void close() {
            }
        };

        ClientConnectionEntity connection = hub.connect("client-a", Set.of("alerts"), leaving);

        Assertions.assertTrue(connection.isClosed());
        Assertions.assertEquals(0, hub.connectionCount());
        Assertions.assertEquals(0, engine.getStatus().get("subscribers"));
        Assertions.assertNull(connection.getHeartbeatTask());
        verify(taskScheduler, times(0)).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
    }

    @Test
    public void shouldCancelHeartbeatAttachedAfterClose() {
        ClientConnectionEntity connection = new ClientConnectionEntity("client-a", Set.of("alerts"),
                new RecordingStreamSink(), clock.instant());
        connection.close();

        connection.attachHeartbeat(scheduledFuture);

        verify(scheduledFuture).cancel(false);
        Assertions.assertNull(connection.getHeartbeatTask());
    }

    @Test
    public void shouldBroadcastWorkflowChangesAndCloseAllOnStop() {
        RecordingStreamSink workflowsSink = new RecordingStreamSink();
        RecordingStreamSink alertsSink = new RecordingStreamSink();
        hub.start();
        hub.connect("client-a", Set.of("workflows"), workflowsSink);
        hub.connect("client-b", Set.of("alerts"), alertsSink);

        publisher.publish(new WorkflowStateChangedEvent(runningState(), startTransition(), true));

        List<StreamMessage> messages = workflowsSink.messagesOfType(StreamMessageTypeEnum.CHANNEL_MESSAGE);
        Assertions.assertEquals(1, messages.size());
        @SuppressWarnings("unchecked")
        Map<String, Object> payload = (Map<String, Object>) messages.get(0).getPayload();
        Assertions.assertEquals("wf-1", payload.get("workflow_id"));
        Assertions.assertEquals("running", payload.get("current_state"));
        Assertions.assertEquals("start", payload.get("transition_type"));
        Assertions.assertTrue(alertsSink.messagesOfType(StreamMessageTypeEnum.CHANNEL_MESSAGE).isEmpty());

        hub.stop();

        Assertions.assertFalse(hub.isRunning());
        Assertions.assertEquals(0, hub.connectionCount());
        Assertions.assertTrue(workflowsSink.isClosed());
        Assertions.assertTrue(alertsSink.isClosed());
        Assertions.assertEquals(0, publisher.subscriberCount());
        verify(scheduledFuture, times(3)).cancel(false);
    }

    private WorkflowStateEntity runningState() {
        WorkflowStateEntity state = new WorkflowStateEntity();
        state.setWorkflowId("wf-1");
        state.setCurrentState(WorkflowStateEnum.RUNNING);
        state.setPreviousState(WorkflowStateEnum.IDLE);
        state.setProgressPercentage(10);
        state.setUpdatedAt(LocalDateTime.of(2026, 10, 1, 12, 0, 0));
        return state;
    }

    private StateTransitionEntity startTransition() {
        StateTransitionEntity transition = new StateTransitionEntity();
        transition.setWorkflowId("wf-1");
        transition.setFromState(WorkflowStateEnum.IDLE);
        transition.setToState(WorkflowStateEnum.RUNNING);
        transition.setTransitionType(TransitionTypeEnum.START);
        return transition;
    }
}
