package com.flowpulse.trigger.http;

import com.flowpulse.api.dto.StreamControlRequestDTO;
import com.flowpulse.api.dto.StreamTokenRequestDTO;
import com.flowpulse.api.dto.StreamTokenResponseDTO;
import com.flowpulse.api.response.Response;
import com.flowpulse.domain.stream.model.entity.ClientConnectionEntity;
import com.flowpulse.domain.stream.service.StreamChannelDomainService;
import com.flowpulse.trigger.application.stream.RealtimeEventHub;
import com.flowpulse.trigger.application.stream.SseStreamSink;
import com.flowpulse.trigger.application.stream.StreamControlApplicationService;
import com.flowpulse.trigger.application.stream.StreamTokenApplicationService;
import com.flowpulse.types.enums.ResponseCode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 实时推送 SSE 入口、控制动作与连接令牌签发。
 */
@RestController
@RequestMapping("/api/stream")
public class StreamController {

    private final RealtimeEventHub realtimeEventHub;
    private final StreamTokenApplicationService streamTokenApplicationService;
    private final StreamControlApplicationService streamControlApplicationService;
    private final StreamChannelDomainService channelDomainService;
    private final long emitterTimeoutMs;

    public StreamController(RealtimeEventHub realtimeEventHub,
                            StreamTokenApplicationService streamTokenApplicationService,
                            StreamControlApplicationService streamControlApplicationService,
                            StreamChannelDomainService channelDomainService,
                            @Value("${stream.emitter-timeout-ms:1800000}") long emitterTimeoutMs) {
        this.realtimeEventHub = realtimeEventHub;
        this.streamTokenApplicationService = streamTokenApplicationService;
        this.streamControlApplicationService = streamControlApplicationService;
        this.channelDomainService = channelDomainService;
        this.emitterTimeoutMs = emitterTimeoutMs <= 0 ? 30L * 60L * 1000L : emitterTimeoutMs;
    }

    /**
     * 令牌校验通过后才建立推送流。
     */
    @GetMapping
    public SseEmitter connect(@RequestParam(value = "clientId", required = false) String clientId,
                              @RequestParam(value = "channels", required = false) String channels,
                              @RequestParam(value = "token", required = false) String token) {
        streamTokenApplicationService.verify(clientId, token);
        Set<String> resolvedChannels = channelDomainService.resolveChannels(channels);

        SseEmitter emitter = new SseEmitter(emitterTimeoutMs);
        AtomicReference<ClientConnectionEntity> connection = new AtomicReference<>();
        emitter.onCompletion(() -> realtimeEventHub.disconnect(connection.get()));
        emitter.onTimeout(() -> realtimeEventHub.disconnect(connection.get()));
        emitter.onError(ex -> realtimeEventHub.disconnect(connection.get()));
        connection.set(realtimeEventHub.connect(clientId.trim(), resolvedChannels, new SseStreamSink(emitter)));
        return emitter;
    }

    @PostMapping("/control")
    public Response<Map<String, Object>> control(@RequestBody StreamControlRequestDTO request) {
        return Response.<Map<String, Object>>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(streamControlApplicationService.execute(request))
                .build();
    }

    @PostMapping("/tokens")
    public Response<StreamTokenResponseDTO> issueToken(@RequestBody StreamTokenRequestDTO request) {
        return Response.<StreamTokenResponseDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(streamTokenApplicationService.issue(request))
                .build();
    }
}
