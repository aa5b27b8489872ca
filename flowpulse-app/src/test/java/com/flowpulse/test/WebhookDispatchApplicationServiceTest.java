package com.flowpulse.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowpulse.api.dto.EmergencyDispatchRequestDTO;
import com.flowpulse.api.dto.EmergencyDispatchResponseDTO;
import com.flowpulse.api.dto.OrchestrationStatusDTO;
import com.flowpulse.api.dto.WebhookDispatchRequestDTO;
import com.flowpulse.api.dto.WebhookDispatchResponseDTO;
import com.flowpulse.api.dto.WebhookEndpointDTO;
import com.flowpulse.api.dto.WebhookEndpointRegisterRequestDTO;
import com.flowpulse.api.dto.WebhookErrorHandlingDTO;
import com.flowpulse.api.dto.WebhookSecurityDTO;
import com.flowpulse.domain.state.model.entity.StateTransitionEntity;
import com.flowpulse.domain.state.model.entity.WorkflowStateEntity;
import com.flowpulse.domain.state.model.valobj.WorkflowStateChangedEvent;
import com.flowpulse.domain.webhook.model.entity.WebhookEndpointEntity;
import com.flowpulse.domain.webhook.model.valobj.OutboundWebhookRequest;
import com.flowpulse.domain.webhook.service.WebhookDispatchDomainService;
import com.flowpulse.domain.webhook.service.WebhookPayloadDomainService;
import com.flowpulse.domain.webhook.service.WebhookSignatureDomainService;
import com.flowpulse.test.support.InMemoryWebhookDeliveryRepository;
import com.flowpulse.test.support.InMemoryWebhookEndpointRepository;
import com.flowpulse.test.support.MutableClock;
import com.flowpulse.test.support.ScriptedWebhookTransport;
import com.flowpulse.trigger.application.command.WebhookDispatchApplicationService;
import com.flowpulse.trigger.application.stream.RealtimeEventHub;
import com.flowpulse.trigger.application.webhook.WebhookGatewayProperties;
import com.flowpulse.trigger.event.WorkflowStateEventPublisher;
import com.flowpulse.types.enums.FallbackActionEnum;
import com.flowpulse.types.enums.ResponseCode;
import com.flowpulse.types.enums.TransitionTypeEnum;
import com.flowpulse.types.enums.WorkflowStateEnum;
import com.flowpulse.types.exception.AppException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class WebhookDispatchApplicationServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final WebhookSignatureDomainService signatureDomainService = new WebhookSignatureDomainService();

    private MutableClock clock;
    private InMemoryWebhookEndpointRepository endpointRepository;
    private InMemoryWebhookDeliveryRepository deliveryRepository;
    private ScriptedWebhookTransport transport;
    private WebhookGatewayProperties properties;
    private RealtimeEventHub realtimeEventHub;
    private WorkflowStateEventPublisher publisher;
    private MeterRegistry meterRegistry;
    private final List<Long> sleeps = new ArrayList<>();
    private boolean sleepAdvancesClock;
    private WebhookDispatchApplicationService service;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(Instant.parse("2026-10-01T12:00:00Z"));
        endpointRepository = new InMemoryWebhookEndpointRepository();
        deliveryRepository = new InMemoryWebhookDeliveryRepository();
        transport = new ScriptedWebhookTransport();
        properties = new WebhookGatewayProperties();
        realtimeEventHub = mock(RealtimeEventHub.class);
        publisher = new WorkflowStateEventPublisher();
        meterRegistry = new SimpleMeterRegistry();

        DefaultListableBeanFactory beanFactory = new DefaultListableBeanFactory();
        beanFactory.registerSingleton("meterRegistry", meterRegistry);
        ObjectProvider<MeterRegistry> meterRegistryProvider = beanFactory.getBeanProvider(MeterRegistry.class);

        service = new WebhookDispatchApplicationService(endpointRepository, deliveryRepository, transport,
                new WebhookDispatchDomainService(new WebhookPayloadDomainService(), signatureDomainService),
                properties, realtimeEventHub, publisher, Runnable::run, objectMapper, clock, this::recordSleep,
                meterRegistryProvider);
    }

    @Test
    public void shouldRegisterEndpointWithDefaults() {
        String endpointId = service.register(registerRequest("crm", "https://crm.example.com/hook", null, null))
                .getEndpointId();

        WebhookEndpointEntity saved = endpointRepository.findByEndpointId(endpointId);
        Assertions.assertNotNull(saved);
        Assertions.assertEquals("POST", saved.getMethod());
        Assertions.assertTrue(saved.isEnabled());
        Assertions.assertEquals(3, saved.effectiveErrorHandling().getRetryAttempts());
        Assertions.assertEquals(1000L, saved.effectiveErrorHandling().getRetryDelayMs());
        Assertions.assertEquals(FallbackActionEnum.LOG, saved.effectiveErrorHandling().getFallbackAction());
        Assertions.assertEquals(0L, saved.getTriggerCount());
    }

    @Test
    public void shouldRejectInvalidRegistration() {
        assertIllegal(() -> service.register(registerRequest("crm", "ftp://crm.example.com", null, null)));
        assertIllegal(() -> service.register(registerRequest(" ", "https://crm.example.com", null, null)));

        WebhookEndpointRegisterRequestDTO badAuth = registerRequest("crm", "https://crm.example.com", null, null);
        WebhookSecurityDTO security = new WebhookSecurityDTO();
        security.setAuthentication("kerberos");
        badAuth.setSecurity(security);
        assertIllegal(() -> service.register(badAuth));

        Assertions.assertTrue(endpointRepository.findAll().isEmpty());
    }

    @Test
    public void shouldDispatchOnlyToMatchingEndpoints() throws Exception {
        String matching = register("a", "https://a.example.com", List.of("workflow.*"), 0, null);
        register("b", "https://b.example.com", List.of("invoice.paid"), 0, null);

        WebhookDispatchResponseDTO response = service.dispatch(dispatchRequest("wf-1", "workflow.completed", Map.of("k", "v")));

        Assertions.assertTrue(response.isSuccess());
        Assertions.assertEquals(1, response.getMatchedEndpoints());
        Assertions.assertEquals(1, transport.getRequests().size());
        OutboundWebhookRequest request = transport.getRequests().get(0);
        Assertions.assertEquals("POST", request.method());
        @SuppressWarnings("unchecked")
        Map<String, Object> body = objectMapper.readValue(request.body(), Map.class);
        Assertions.assertEquals("wf-1", body.get("workflow_id"));
        Assertions.assertEquals("workflow.completed", body.get("trigger_type"));
        Assertions.assertEquals(Map.of("k", "v"), body.get("data"));

        WebhookEndpointEntity endpoint = endpointRepository.findByEndpointId(matching);
        Assertions.assertEquals(1L, endpoint.getTriggerCount());
        Assertions.assertEquals(1L, endpoint.getSuccessCount());
        Assertions.assertNotNull(endpoint.getLastTriggered());
        Assertions.assertEquals(1.0D, meterRegistry.counter("flowpulse.webhook.dispatch.success.total").count());
    }

    @Test
    public void shouldReportFailureWhenNothingMatches() {
        register("a", "https://a.example.com", List.of("invoice.paid"), 0, null);

        WebhookDispatchResponseDTO response = service.dispatch(dispatchRequest("wf-1", "workflow.failed", null));

        Assertions.assertFalse(response.isSuccess());
        Assertions.assertEquals(0, response.getMatchedEndpoints());
        Assertions.assertTrue(transport.getRequests().isEmpty());
    }

    @Test
    public void shouldRequireWorkflowIdAndTriggerType() {
        assertIllegal(() -> service.dispatch(dispatchRequest(" ", "workflow.failed", null)));
        assertIllegal(() -> service.dispatch(dispatchRequest("wf-1", null, null)));
    }

    @Test
    public void shouldRetryUntilSuccess() {
        String endpointId = register("a", "https://a.example.com", List.of(), 3, null);
        transport.respond("https://a.example.com", 500, -1, 200);

        Assertions.assertTrue(service.dispatch("wf-1", "workflow.completed", Map.of()).success());

        Assertions.assertEquals(3, transport.getRequests().size());
        Assertions.assertEquals(List.of(1000L, 1000L), sleeps);
        Assertions.assertEquals(2.0D, meterRegistry.counter("flowpulse.webhook.dispatch.retry.total").count());
        Assertions.assertEquals(3, deliveryRepository.findAll().get(0).getAttempts());
        Assertions.assertEquals(0L, endpointRepository.findByEndpointId(endpointId).getErrorCount());
    }

    @Test
    public void shouldRaiseAlertWhenRetriesExhausted() {
        String endpointId = register("a", "https://a.example.com", List.of(), 1, "alert");
        transport.always("https://a.example.com", 503);

        Assertions.assertFalse(service.dispatch("wf-1", "workflow.failed", Map.of()).success());

        Assertions.assertEquals(2, transport.getRequests().size());
        WebhookEndpointEntity endpoint = endpointRepository.findByEndpointId(endpointId);
        Assertions.assertEquals(1L, endpoint.getErrorCount());
        Assertions.assertEquals(1L, endpoint.getTriggerCount());
        Assertions.assertEquals("HTTP 503", deliveryRepository.findAll().get(0).getMessage());

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(realtimeEventHub).broadcastToChannels(eq(List.of("alerts")), payload.capture());
        @SuppressWarnings("unchecked")
        Map<String, Object> alert = (Map<String, Object>) payload.getValue();
        Assertions.assertEquals("webhook_failure", alert.get("type"));
        Assertions.assertEquals(endpointId, alert.get("endpoint_id"));
        Assertions.assertEquals(2, alert.get("attempts"));
    }

    @Test
    public void shouldOnlyLogWhenFallbackIsLog() {
        register("a", "https://a.example.com", List.of(), 0, "log");
        transport.always("https://a.example.com", 500);

        service.dispatch("wf-1", "workflow.failed", Map.of());

        verify(realtimeEventHub, never()).broadcastToChannels(anyCollection(), any());
        Assertions.assertEquals(1.0D, meterRegistry.counter("flowpulse.webhook.dispatch.failure.total").count());
    }

    @Test
    public void shouldSkipDispatchInsideMinInterval() {
        properties.getDispatch().setMinIntervalMs(60000L);
        register("a", "https://a.example.com", List.of(), 0, null);

        Assertions.assertTrue(service.dispatch("wf-1", "workflow.running", Map.of()).success());
        Assertions.assertFalse(service.dispatch("wf-1", "workflow.completed", Map.of()).success());
        clock.advance(Duration.ofSeconds(61));
        Assertions.assertTrue(service.dispatch("wf-1", "workflow.completed", Map.of()).success());

        Assertions.assertEquals(2, transport.getRequests().size());
    }

    @Test
    public void shouldSignBodyWithResolvedSecret() {
        properties.getSecrets().put("crm-key", "s3cr3t");
        WebhookEndpointRegisterRequestDTO request = registerRequest("crm", "https://crm.example.com", List.of(), null);
        WebhookSecurityDTO security = new WebhookSecurityDTO();
        security.setAuthentication("webhook_signature");
        security.setSecretRef("crm-key");
        request.setSecurity(security);
        service.register(request);

        service.dispatch("wf-1", "workflow.completed", Map.of());

        OutboundWebhookRequest sent = transport.getRequests().get(0);
        Assertions.assertEquals("sha256=" + signatureDomainService.hmacSha256Hex("s3cr3t", sent.body()),
                sent.headers().get(WebhookDispatchDomainService.SIGNATURE_HEADER));
    }

    @Test
    public void shouldFallBackToSecondaryEndpointInEmergency() throws Exception {
        String primary = register("primary", "https://primary.example.com", List.of(), 0, "ignore");
        String secondary = register("secondary", "https://secondary.example.com", List.of(), 0, null);
        transport.always("https://primary.example.com", 502);

        EmergencyDispatchRequestDTO request = new EmergencyDispatchRequestDTO();
        request.setWorkflowId("wf-1");
        request.setPriorityLevel("critical");
        request.setPrimaryEndpointId(primary);
        request.setFallbackEndpointIds(List.of("missing", secondary));
        request.setData(Map.of("reason", "disk full"));

        EmergencyDispatchResponseDTO response = service.emergencyDispatch(request);

        Assertions.assertTrue(response.isSuccess());
        Assertions.assertEquals("critical", response.getPriorityLevel());
        Assertions.assertEquals(secondary, response.getDeliveredEndpointId());
        Assertions.assertEquals(List.of(primary, "missing", secondary), response.getAttemptedEndpointIds());
        OutboundWebhookRequest delivered = transport.requestsTo("https://secondary.example.com").get(0);
        @SuppressWarnings("unchecked")
        Map<String, Object> body = objectMapper.readValue(delivered.body(), Map.class);
        Assertions.assertEquals("emergency", body.get("trigger_type"));
        Assertions.assertEquals("critical", ((Map<?, ?>) body.get("data")).get("priority_level"));
    }

    @Test
    public void shouldStopRetryingWhenEmergencyDeadlineWouldPass() {
        sleepAdvancesClock = true;
        String primary = register("primary", "https://primary.example.com", List.of(), 3, "ignore");
        transport.always("https://primary.example.com", 500);

        EmergencyDispatchRequestDTO request = new EmergencyDispatchRequestDTO();
        request.setWorkflowId("wf-1");
        request.setPrimaryEndpointId(primary);
        request.setMaxDelayMs(1500L);

        EmergencyDispatchResponseDTO response = service.emergencyDispatch(request);

        Assertions.assertFalse(response.isSuccess());
        Assertions.assertEquals(2, transport.requestsTo("https://primary.example.com").size());
        Assertions.assertEquals(List.of(1000L), sleeps);
        Assertions.assertEquals(2, deliveryRepository.findAll().get(0).getAttempts());
        Assertions.assertEquals("HTTP 500 (deadline reached)", deliveryRepository.findAll().get(0).getMessage());
    }

    @Test
    public void shouldKeepDispatchingWhenCounterUpdateFails() {
        String first = register("a", "https://a.example.com", List.of(), 0, null);
        register("b", "https://b.example.com", List.of(), 0, null);
        endpointRepository.failCounterUpdates(new IllegalStateException("db down"));

        WebhookDispatchResponseDTO response = Assertions.assertDoesNotThrow(
                () -> service.dispatch(dispatchRequest("wf-1", "workflow.completed", Map.of())));

        Assertions.assertTrue(response.isSuccess());
        Assertions.assertEquals(1, transport.requestsTo("https://a.example.com").size());
        Assertions.assertEquals(1, transport.requestsTo("https://b.example.com").size());
        Assertions.assertEquals(2, deliveryRepository.findAll().size());
        Assertions.assertEquals(0L, endpointRepository.findByEndpointId(first).getTriggerCount());
    }

    @Test
    public void shouldBypassMinIntervalWhenOverridingConflicts() {
        properties.getDispatch().setMinIntervalMs(60000L);
        String endpointId = register("a", "https://a.example.com", List.of(), 0, null);
        service.dispatch("wf-1", "workflow.running", Map.of());

        EmergencyDispatchRequestDTO request = new EmergencyDispatchRequestDTO();
        request.setWorkflowId("wf-1");
        request.setPrimaryEndpointId(endpointId);
        request.setOverrideConflicts(true);

        EmergencyDispatchResponseDTO response = service.emergencyDispatch(request);

        Assertions.assertTrue(response.isSuccess());
        Assertions.assertEquals("high", response.getPriorityLevel());
        Assertions.assertEquals(2, transport.getRequests().size());
    }

    @Test
    public void shouldRejectUnknownPriority() {
        EmergencyDispatchRequestDTO request = new EmergencyDispatchRequestDTO();
        request.setWorkflowId("wf-1");
        request.setPrimaryEndpointId("x");
        request.setPriorityLevel("apocalyptic");

        assertIllegal(() -> service.emergencyDispatch(request));
    }

    @Test
    public void shouldSummarizeOrchestrationStatus() {
        register("ok", "https://ok.example.com", List.of(), 0, "ignore");
        register("bad", "https://bad.example.com", List.of(), 0, "ignore");
        WebhookEndpointRegisterRequestDTO inactive = registerRequest("off", "https://off.example.com", List.of(), null);
        inactive.setActive(false);
        service.register(inactive);
        transport.always("https://bad.example.com", 500);

        service.dispatch("wf-1", "workflow.completed", Map.of());
        OrchestrationStatusDTO status = service.statusView();

        Assertions.assertEquals(2, status.getActiveEndpoints());
        Assertions.assertEquals(3, status.getTotalEndpoints());
        Assertions.assertEquals(0, status.getQueuedEvents());
        Assertions.assertEquals(2L, status.getProcessedEvents());
        Assertions.assertEquals(1L, status.getFailedEvents());
        Assertions.assertEquals("critical", status.getSystemHealth());

        List<WebhookEndpointDTO> endpoints = service.listEndpoints();
        Assertions.assertEquals("active", endpoints.get(0).getStatus());
        Assertions.assertEquals("error", endpoints.get(1).getStatus());
        Assertions.assertEquals("inactive", endpoints.get(2).getStatus());
    }

    @Test
    public void shouldDispatchOnWorkflowStateChange() throws Exception {
        register("a", "https://a.example.com", List.of("workflow.completed"), 0, null);
        service.subscribeStateEvents();

        publisher.publish(new WorkflowStateChangedEvent(completedState(), completeTransition(), false));

        Assertions.assertEquals(1, transport.getRequests().size());
        @SuppressWarnings("unchecked")
        Map<String, Object> body = objectMapper.readValue(transport.getRequests().get(0).body(), Map.class);
        Assertions.assertEquals("wf-1", body.get("workflow_id"));
        Assertions.assertEquals("completed", ((Map<?, ?>) body.get("data")).get("current_state"));

        service.unsubscribeStateEvents();
        Assertions.assertEquals(0, publisher.subscriberCount());
    }

    private String register(String name, String url, List<String> triggers, Integer retryAttempts, String fallback) {
        WebhookErrorHandlingDTO errorHandling = new WebhookErrorHandlingDTO();
        errorHandling.setRetryAttempts(retryAttempts);
        errorHandling.setRetryDelay(1000L);
        errorHandling.setFallbackAction(fallback);
        return service.register(registerRequest(name, url, triggers, errorHandling)).getEndpointId();
    }

    private void recordSleep(long millis) {
        sleeps.add(millis);
        if (sleepAdvancesClock) {
            clock.advance(Duration.ofMillis(millis));
        }
    }

    private WebhookEndpointRegisterRequestDTO registerRequest(String name, String url, List<String> triggers,
                                                              WebhookErrorHandlingDTO errorHandling) {
        WebhookEndpointRegisterRequestDTO request = new WebhookEndpointRegisterRequestDTO();
        request.setName(name);
        request.setUrl(url);
        request.setTriggers(triggers);
        request.setErrorHandling(errorHandling);
        return request;
    }

    private WebhookDispatchRequestDTO dispatchRequest(String workflowId, String triggerType, Map<String, Object> data) {
        WebhookDispatchRequestDTO request = new WebhookDispatchRequestDTO();
        request.setWorkflowId(workflowId);
        request.setTriggerType(triggerType);
        request.setData(data);
        return request;
    }

    private void assertIllegal(Executable executable) {
        AppException ex = Assertions.assertThrows(AppException.class, executable);
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getCode());
    }

    private WorkflowStateEntity completedState() {
        WorkflowStateEntity state = new WorkflowStateEntity();
        state.setWorkflowId("wf-1");
        state.setCurrentState(WorkflowStateEnum.COMPLETED);
        state.setPreviousState(WorkflowStateEnum.RUNNING);
        state.setProgressPercentage(100);
        return state;
    }

    private StateTransitionEntity completeTransition() {
        StateTransitionEntity transition = new StateTransitionEntity();
        transition.setFromState(WorkflowStateEnum.RUNNING);
        transition.setToState(WorkflowStateEnum.COMPLETED);
        transition.setTransitionType(TransitionTypeEnum.COMPLETE);
        return transition;
    }
}
