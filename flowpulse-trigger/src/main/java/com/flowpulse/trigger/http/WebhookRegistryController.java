package com.flowpulse.trigger.http;

import com.flowpulse.api.dto.EmergencyDispatchRequestDTO;
import com.flowpulse.api.dto.EmergencyDispatchResponseDTO;
import com.flowpulse.api.dto.OrchestrationStatusDTO;
import com.flowpulse.api.dto.WebhookDispatchRequestDTO;
import com.flowpulse.api.dto.WebhookDispatchResponseDTO;
import com.flowpulse.api.dto.WebhookEndpointDTO;
import com.flowpulse.api.dto.WebhookEndpointRegisterRequestDTO;
import com.flowpulse.api.dto.WebhookEndpointRegisterResponseDTO;
import com.flowpulse.api.response.Response;
import com.flowpulse.trigger.application.command.WebhookDispatchApplicationService;
import com.flowpulse.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 外发 Webhook 编排 API。
 */
@RestController
@RequestMapping("/api/orchestration/webhooks")
public class WebhookRegistryController {

    private final WebhookDispatchApplicationService webhookDispatchApplicationService;

    public WebhookRegistryController(WebhookDispatchApplicationService webhookDispatchApplicationService) {
        this.webhookDispatchApplicationService = webhookDispatchApplicationService;
    }

    @PutMapping
    public Response<WebhookEndpointRegisterResponseDTO> register(@RequestBody WebhookEndpointRegisterRequestDTO request) {
        return success(webhookDispatchApplicationService.register(request));
    }

    @PatchMapping
    public Response<WebhookDispatchResponseDTO> dispatch(@RequestBody WebhookDispatchRequestDTO request) {
        return success(webhookDispatchApplicationService.dispatch(request));
    }

    @GetMapping
    public Response<OrchestrationStatusDTO> status() {
        return success(webhookDispatchApplicationService.statusView());
    }

    @GetMapping("/endpoints")
    public Response<List<WebhookEndpointDTO>> endpoints() {
        return success(webhookDispatchApplicationService.listEndpoints());
    }

    @PostMapping("/emergency")
    public Response<EmergencyDispatchResponseDTO> emergency(@RequestBody EmergencyDispatchRequestDTO request) {
        return success(webhookDispatchApplicationService.emergencyDispatch(request));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
