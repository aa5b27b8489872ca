package com.flowpulse.test;

import com.fasterxml.jackson.databind.ObjectMapper;
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
import com.flowpulse.trigger.http.GlobalApiExceptionHandler;
import com.flowpulse.trigger.http.WebhookRegistryController;
import com.flowpulse.types.enums.ResponseCode;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;

import static org.mockito.Mockito.mock;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class WebhookRegistryControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ScriptedWebhookTransport transport;
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        transport = new ScriptedWebhookTransport();
        DefaultListableBeanFactory beanFactory = new DefaultListableBeanFactory();
        beanFactory.registerSingleton("meterRegistry", new SimpleMeterRegistry());
        ObjectProvider<MeterRegistry> meterRegistryProvider = beanFactory.getBeanProvider(MeterRegistry.class);
        WebhookDispatchApplicationService service = new WebhookDispatchApplicationService(
                new InMemoryWebhookEndpointRepository(), new InMemoryWebhookDeliveryRepository(), transport,
                new WebhookDispatchDomainService(new WebhookPayloadDomainService(), new WebhookSignatureDomainService()),
                new WebhookGatewayProperties(), mock(RealtimeEventHub.class), new WorkflowStateEventPublisher(),
                Runnable::run, objectMapper, new MutableClock(Instant.parse("2026-10-01T12:00:00Z")), millis -> {
                }, meterRegistryProvider);
        mockMvc = MockMvcBuilders.standaloneSetup(new WebhookRegistryController(service))
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldRegisterAndDispatch() throws Exception {
        String endpointId = register("{\"name\":\"crm\",\"url\":\"https://crm.example.com/hook\","
                + "\"triggers\":[\"workflow.*\"],\"errorHandling\":{\"retryAttempts\":0}}");

        mockMvc.perform(patch("/api/orchestration/webhooks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"workflowId\":\"wf-1\",\"triggerType\":\"workflow.completed\",\"data\":{\"k\":1}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.success").value(true))
                .andExpect(jsonPath("$.data.matchedEndpoints").value(1));

        mockMvc.perform(get("/api/orchestration/webhooks/endpoints"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].endpointId").value(endpointId))
                .andExpect(jsonPath("$.data[0].status").value("active"))
                .andExpect(jsonPath("$.data[0].successCount").value(1))
                .andExpect(jsonPath("$.data[0].errorHandling.fallbackAction").value("log"));

        Assertions.assertEquals(1, transport.requestsTo("https://crm.example.com/hook").size());
    }

    @Test
    public void shouldAcceptLegacyActiveFlag() throws Exception {
        register("{\"name\":\"off\",\"url\":\"https://off.example.com\",\"isActive\":false}");

        mockMvc.perform(get("/api/orchestration/webhooks"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.activeEndpoints").value(0))
                .andExpect(jsonPath("$.data.totalEndpoints").value(1))
                .andExpect(jsonPath("$.data.systemHealth").value("healthy"));
    }

    @Test
    public void shouldRejectInvalidEndpoint() throws Exception {
        mockMvc.perform(put("/api/orchestration/webhooks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"crm\",\"url\":\"not-a-url\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }

    @Test
    public void shouldRejectDispatchWithoutWorkflowId() throws Exception {
        mockMvc.perform(patch("/api/orchestration/webhooks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"triggerType\":\"workflow.completed\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void shouldDeliverEmergencyToFallback() throws Exception {
        String primary = register("{\"name\":\"primary\",\"url\":\"https://primary.example.com\","
                + "\"errorHandling\":{\"retryAttempts\":0,\"fallbackAction\":\"ignore\"}}");
        String backup = register("{\"name\":\"backup\",\"url\":\"https://backup.example.com\"}");
        transport.always("https://primary.example.com", 500);

        mockMvc.perform(post("/api/orchestration/webhooks/emergency")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"workflowId\":\"wf-1\",\"priorityLevel\":\"urgent\",\"primaryEndpointId\":\""
                                + primary + "\",\"fallbackEndpointIds\":[\"" + backup + "\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.success").value(true))
                .andExpect(jsonPath("$.data.priorityLevel").value("urgent"))
                .andExpect(jsonPath("$.data.deliveredEndpointId").value(backup))
                .andExpect(jsonPath("$.data.attemptedEndpointIds.length()").value(2));
    }

    private String register(String body) throws Exception {
        MvcResult result = mockMvc.perform(put("/api/orchestration/webhooks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).path("data").path("endpointId").asText();
    }
}
