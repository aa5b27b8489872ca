package com.flowpulse.domain.stream.service;

import com.flowpulse.domain.stream.model.valobj.StreamTokenClaims;
import com.flowpulse.types.enums.ResponseCode;
import com.flowpulse.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * 推送连接令牌领域服务。
 * <p>
 * 令牌格式：base64url(clientId:expiresAtMillis).base64url(HMAC-SHA256)，
 * 校验时要求签名一致、clientId 一致且未过期。
 * </p>
 */
@Service
public class StreamTokenDomainService {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    public String issue(StreamTokenClaims claims, String secret) {
        if (claims == null || StringUtils.isBlank(claims.clientId())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "clientId is required");
        }
        requireSecret(secret);
        String body = claims.clientId() + ":" + claims.expiresAtMillis();
        String encodedBody = ENCODER.encodeToString(body.getBytes(StandardCharsets.UTF_8));
        return encodedBody + "." + ENCODER.encodeToString(sign(encodedBody, secret));
    }

    /**
     * 解析并校验令牌，任何一项不满足返回 null。
     */
    public StreamTokenClaims verify(String token, String expectedClientId, String secret, long nowMillis) {
        requireSecret(secret);
        if (StringUtils.isBlank(token) || StringUtils.isBlank(expectedClientId)) {
            return null;
        }
        int separator = token.indexOf('.');
        if (separator <= 0 || separator == token.length() - 1) {
            return null;
        }
        String encodedBody = token.substring(0, separator);
        byte[] providedSignature;
        String body;
        try {
            providedSignature = DECODER.decode(token.substring(separator + 1));
            body = new String(DECODER.decode(encodedBody), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            return null;
        }
        if (!MessageDigest.isEqual(sign(encodedBody, secret), providedSignature)) {
            return null;
        }
        int colon = body.lastIndexOf(':');
        if (colon <= 0) {
            return null;
        }
        String clientId = body.substring(0, colon);
        long expiresAt;
        try {
            expiresAt = Long.parseLong(body.substring(colon + 1));
        } catch (NumberFormatException ex) {
            return null;
        }
        if (!clientId.equals(expectedClientId.trim()) || expiresAt <= nowMillis) {
            return null;
        }
        return new StreamTokenClaims(clientId, expiresAt);
    }

    private byte[] sign(String content, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return mac.doFinal(content.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to sign stream token", ex);
        }
    }

    private void requireSecret(String secret) {
        if (StringUtils.isBlank(secret)) {
            throw new AppException(ResponseCode.CONFIG_ERROR.getCode(), "Stream token secret is not configured");
        }
    }
}
