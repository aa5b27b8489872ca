package com.flowpulse.trigger.application.stream;

import com.flowpulse.api.dto.StreamMessageDTO;
import com.flowpulse.domain.stream.adapter.gateway.IStreamSink;
import com.flowpulse.domain.stream.model.valobj.StreamMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * 基于 SseEmitter 的推送输出端：事件名为消息类型，数据为消息信封 JSON。
 */
@Slf4j
public class SseStreamSink implements IStreamSink {

    private final SseEmitter emitter;

    public SseStreamSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void send(StreamMessage message) throws IOException {
        try {
            emitter.send(SseEmitter.event()
                    .name(message.getType().getCode())
                    .data(toDTO(message)));
        } catch (IllegalStateException ex) {
            throw new IOException("SSE emitter already completed", ex);
        }
    }

    @Override
    public void close() {
        try {
            emitter.complete();
        } catch (IllegalStateException ex) {
            log.debug("SSE emitter complete ignored. error={}", ex.getMessage());
        }
    }

    static StreamMessageDTO toDTO(StreamMessage message) {
        StreamMessageDTO dto = new StreamMessageDTO();
        dto.setType(message.getType().getCode());
        dto.setPayload(message.getPayload());
        dto.setTimestamp(message.getTimestamp() == null ? null : message.getTimestamp().toString());
        dto.setChannels(message.getChannels());
        return dto;
    }
}
