package com.flowpulse.domain.stream.model.valobj;

import com.flowpulse.types.enums.StreamMessageTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 推送消息：{type, payload?, timestamp, channels?}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamMessage {

    private StreamMessageTypeEnum type;
    private Object payload;
    private Instant timestamp;
    private List<String> channels;

    public static StreamMessage of(StreamMessageTypeEnum type, Object payload, Instant timestamp) {
        return StreamMessage.builder()
                .type(type)
                .payload(payload)
                .timestamp(timestamp)
                .build();
    }
}
