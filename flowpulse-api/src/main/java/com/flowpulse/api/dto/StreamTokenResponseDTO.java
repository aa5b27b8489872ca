package com.flowpulse.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 推送连接令牌。
 */
@Data
public class StreamTokenResponseDTO {

    private String clientId;
    private String token;
    private LocalDateTime expiresAt;
}
