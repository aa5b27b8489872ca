package com.flowpulse.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowpulse.api.response.Response;
import com.flowpulse.config.ObservabilityHttpLogProperties;
import com.flowpulse.config.RequestTraceLoggingFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class RequestTraceLoggingFilterTest {

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        ObservabilityHttpLogProperties properties = new ObservabilityHttpLogProperties();
        properties.setEnabled(true);
        properties.setLogRequestBody(true);
        properties.setSampleRate(1.0D);

        RequestTraceLoggingFilter filter = new RequestTraceLoggingFilter(new ObjectMapper(), properties);
        this.mockMvc = MockMvcBuilders.standaloneSetup(new TestController())
                .addFilters(filter)
                .build();
    }

    @Test
    public void shouldInjectTraceHeadersForApiRequests() throws Exception {
        mockMvc.perform(post("/api/workflow/state")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"workflow_id\":\"wf-1\"}"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Trace-Id"))
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.code").value("0000"));
    }

    @Test
    public void shouldPropagateIncomingTraceId() throws Exception {
        mockMvc.perform(post("/api/workflow/state")
                        .header("X-Trace-Id", "trace-123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Trace-Id", "trace-123"));
    }

    @Test
    public void shouldSkipExcludedStreamPath() throws Exception {
        mockMvc.perform(get("/api/stream"))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist("X-Trace-Id"))
                .andExpect(header().doesNotExist("X-Request-Id"));
    }

    @Test
    public void shouldKeepWebhookBodyIntact() throws Exception {
        String body = "{\"workflowId\":\"wf-1\",  \"execution\":{\"id\":\"e-1\"}}";

        mockMvc.perform(post("/api/webhooks/n8n")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Trace-Id"))
                .andExpect(content().string(body));
    }

    @RestController
    private static class TestController {

        @PostMapping("/api/workflow/state")
        public Response<Map<String, Object>> echo(@RequestBody(required = false) Map<String, Object> request) {
            return Response.<Map<String, Object>>builder()
                    .code("0000")
                    .info("成功")
                    .data(request)
                    .build();
        }

        @GetMapping("/api/stream")
        public Response<String> stream() {
            return Response.<String>builder()
                    .code("0000")
                    .info("成功")
                    .build();
        }

        @PostMapping("/api/webhooks/{platform}")
        public String webhook(@PathVariable("platform") String platform, @RequestBody String rawBody) {
            return rawBody;
        }
    }
}
