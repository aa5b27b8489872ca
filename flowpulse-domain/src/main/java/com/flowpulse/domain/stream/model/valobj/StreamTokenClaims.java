package com.flowpulse.domain.stream.model.valobj;

/**
 * 连接令牌声明。
 *
 * @param clientId       绑定的客户端
 * @param expiresAtMillis 过期时间 (epoch 毫秒)
 */
public record StreamTokenClaims(String clientId, long expiresAtMillis) {
}
