package com.flowpulse.trigger.application.stream;

import com.flowpulse.api.dto.StreamTokenRequestDTO;
import com.flowpulse.api.dto.StreamTokenResponseDTO;
import com.flowpulse.domain.stream.model.valobj.StreamTokenClaims;
import com.flowpulse.domain.stream.service.StreamTokenDomainService;
import com.flowpulse.types.enums.ResponseCode;
import com.flowpulse.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;

/**
 * 推送连接令牌：签发与建连前校验。
 * <p>
 * signed 模式校验签名、clientId 绑定与有效期；permissive 模式只要求令牌非空。
 * </p>
 */
@Slf4j
@Service
public class StreamTokenApplicationService {

    public static final String MODE_SIGNED = "signed";
    public static final String MODE_PERMISSIVE = "permissive";

    private final StreamTokenDomainService streamTokenDomainService;
    private final Clock clock;
    private final String mode;
    private final String secret;
    private final long defaultTtlSeconds;
    private final long maxTtlSeconds;

    public StreamTokenApplicationService(StreamTokenDomainService streamTokenDomainService,
                                         Clock clock,
                                         @Value("${stream.auth.mode:signed}") String mode,
                                         @Value("${stream.auth.secret:}") String secret,
                                         @Value("${stream.auth.default-ttl-seconds:3600}") long defaultTtlSeconds,
                                         @Value("${stream.auth.max-ttl-seconds:86400}") long maxTtlSeconds) {
        this.streamTokenDomainService = streamTokenDomainService;
        this.clock = clock;
        this.mode = StringUtils.defaultIfBlank(mode, MODE_SIGNED).trim().toLowerCase();
        this.secret = secret;
        this.defaultTtlSeconds = Math.max(defaultTtlSeconds, 1L);
        this.maxTtlSeconds = Math.max(maxTtlSeconds, this.defaultTtlSeconds);
    }

    public StreamTokenResponseDTO issue(StreamTokenRequestDTO request) {
        if (request == null || StringUtils.isBlank(request.getClientId())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "clientId is required");
        }
        Long requestedTtl = request.getTtlSeconds();
        if (requestedTtl != null && requestedTtl <= 0) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "ttl_seconds must be > 0");
        }
        long ttl = Math.min(requestedTtl == null ? defaultTtlSeconds : requestedTtl, maxTtlSeconds);
        String clientId = request.getClientId().trim();
        long expiresAtMillis = clock.millis() + ttl * 1000L;
        String token = streamTokenDomainService.issue(new StreamTokenClaims(clientId, expiresAtMillis), secret);
        log.info("Stream token issued. clientId={}, ttlSeconds={}", clientId, ttl);

        StreamTokenResponseDTO response = new StreamTokenResponseDTO();
        response.setClientId(clientId);
        response.setToken(token);
        response.setExpiresAt(LocalDateTime.ofInstant(Instant.ofEpochMilli(expiresAtMillis), clock.getZone()));
        return response;
    }

    /**
     * 建连前校验，不通过抛出 UNAUTHORIZED。
     */
    public void verify(String clientId, String token) {
        if (StringUtils.isBlank(clientId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "clientId is required");
        }
        if (StringUtils.isBlank(token)) {
            throw new AppException(ResponseCode.UNAUTHORIZED.getCode(), "Stream token is required");
        }
        if (MODE_PERMISSIVE.equals(mode)) {
            return;
        }
        StreamTokenClaims claims = streamTokenDomainService.verify(token.trim(), clientId.trim(), secret, clock.millis());
        if (claims == null) {
            log.warn("Stream token rejected. clientId={}", clientId.trim());
            throw new AppException(ResponseCode.UNAUTHORIZED.getCode(), "Invalid or expired stream token");
        }
    }
}
