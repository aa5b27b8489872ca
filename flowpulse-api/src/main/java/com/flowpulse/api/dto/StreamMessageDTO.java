package com.flowpulse.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.List;

/**
 * 实时推送消息信封。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamMessageDTO {

    private String type;
    private Object payload;
    private String timestamp;
    private List<String> channels;
}
