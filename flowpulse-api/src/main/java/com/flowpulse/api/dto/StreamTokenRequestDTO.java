package com.flowpulse.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;

/**
 * 推送连接令牌签发请求。
 */
@Data
public class StreamTokenRequestDTO {

    @JsonAlias("client_id")
    private String clientId;
    @JsonAlias("ttl_seconds")
    private Long ttlSeconds;
}
