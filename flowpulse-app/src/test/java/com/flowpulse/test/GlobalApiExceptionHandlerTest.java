package com.flowpulse.test;

import com.flowpulse.api.response.Response;
import com.flowpulse.trigger.http.GlobalApiExceptionHandler;
import com.flowpulse.types.enums.ResponseCode;
import com.flowpulse.types.exception.AppException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class GlobalApiExceptionHandlerTest {

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        this.mockMvc = MockMvcBuilders.standaloneSetup(new ErrorController())
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldHandleAppException() throws Exception {
        mockMvc.perform(get("/api/test/app-error"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()))
                .andExpect(jsonPath("$.info").value("workflow_id is required"));
    }

    @Test
    public void shouldMapResponseCodeToHttpStatus() throws Exception {
        mockMvc.perform(get("/api/test/conflict"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value(ResponseCode.CONFLICT.getCode()));
        mockMvc.perform(get("/api/test/not-found"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(ResponseCode.NOT_FOUND.getCode()));
    }

    @Test
    public void shouldHandleUnknownException() throws Exception {
        mockMvc.perform(get("/api/test/runtime-error"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value(ResponseCode.UN_ERROR.getCode()))
                .andExpect(jsonPath("$.info").value(ResponseCode.UN_ERROR.getInfo()));
    }

    @Test
    public void shouldHandleTypeMismatchExceptionAsIllegalParameter() throws Exception {
        mockMvc.perform(get("/api/test/type-error/not-number"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }

    @Test
    public void shouldRejectUnsupportedMethod() throws Exception {
        mockMvc.perform(post("/api/test/runtime-error"))
                .andExpect(status().isMethodNotAllowed());
    }

    @Test
    public void shouldTruncateLongErrorInfo() throws Exception {
        mockMvc.perform(get("/api/test/long-error"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.info").value("x".repeat(300)));
    }

    @Test
    public void shouldNotWriteEnvelopeWhenStreamTimesOut() throws Exception {
        mockMvc.perform(get("/api/test/stream-timeout"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(content().string(""));
    }

    @RestController
    private static class ErrorController {

        @GetMapping("/api/test/long-error")
        public Response<Void> longError() {
            throw new IllegalArgumentException("x".repeat(400));
        }

        @GetMapping("/api/test/stream-timeout")
        public Response<Void> streamTimeout() {
            throw new AsyncRequestTimeoutException();
        }

        @GetMapping("/api/test/app-error")
        public Response<Void> appError() {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "workflow_id is required");
        }

        @GetMapping("/api/test/conflict")
        public Response<Void> conflict() {
            throw new AppException(ResponseCode.CONFLICT.getCode(), "Version mismatch");
        }

        @GetMapping("/api/test/not-found")
        public Response<Void> notFound() {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "Workflow state not found: wf-x");
        }

        @GetMapping("/api/test/runtime-error")
        public Response<Void> runtimeError() {
            throw new RuntimeException("boom");
        }

        @GetMapping("/api/test/type-error/{id}")
        public Response<String> typeError(@PathVariable("id") Long id) {
            return Response.<String>builder()
                    .code(ResponseCode.SUCCESS.getCode())
                    .info(ResponseCode.SUCCESS.getInfo())
                    .data(String.valueOf(id))
                    .build();
        }
    }
}
