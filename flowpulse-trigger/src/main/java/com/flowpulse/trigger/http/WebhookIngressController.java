package com.flowpulse.trigger.http;

import com.flowpulse.api.dto.WebhookIngressResponseDTO;
import com.flowpulse.trigger.application.webhook.WebhookIngressApplicationService;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 入站 Webhook：每个平台一个路由，POST 投递事件，GET 完成订阅握手。
 */
@RestController
@RequestMapping("/api/webhooks")
public class WebhookIngressController {

    private final WebhookIngressApplicationService webhookIngressApplicationService;

    public WebhookIngressController(WebhookIngressApplicationService webhookIngressApplicationService) {
        this.webhookIngressApplicationService = webhookIngressApplicationService;
    }

    /**
     * 原始请求体按字符串接收，验签基于原文。
     */
    @PostMapping("/{platform}")
    public ResponseEntity<WebhookIngressResponseDTO> receive(@PathVariable("platform") String platform,
                                                             @RequestBody(required = false) String rawBody,
                                                             @RequestHeader HttpHeaders headers) {
        WebhookIngressApplicationService.IngressOutcome outcome =
                webhookIngressApplicationService.receive(platform, rawBody, headers);
        return ResponseEntity.status(outcome.httpStatus()).body(outcome.body());
    }

    @GetMapping("/{platform}")
    public ResponseEntity<String> handshake(@PathVariable("platform") String platform,
                                            @RequestParam(value = "hub.mode", required = false) String hubMode,
                                            @RequestParam(value = "mode", required = false) String mode,
                                            @RequestParam(value = "hub.verify_token", required = false) String hubVerifyToken,
                                            @RequestParam(value = "verify_token", required = false) String verifyToken,
                                            @RequestParam(value = "hub.challenge", required = false) String hubChallenge,
                                            @RequestParam(value = "challenge", required = false) String challenge) {
        String echoed = webhookIngressApplicationService.handshake(platform,
                StringUtils.defaultIfBlank(hubMode, mode),
                StringUtils.defaultIfBlank(hubVerifyToken, verifyToken),
                StringUtils.defaultIfBlank(hubChallenge, challenge));
        return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(echoed);
    }
}
