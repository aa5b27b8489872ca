package com.flowpulse.domain.webhook.service;

import com.flowpulse.types.enums.ResponseCode;
import com.flowpulse.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Webhook 签名领域服务：HMAC-SHA256 计算与常量时间比较。
 */
@Service
public class WebhookSignatureDomainService {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final HexFormat HEX = HexFormat.of();

    /**
     * 校验签名。密钥缺失直接抛出 CONFIG_ERROR，不做放行。
     *
     * @param secret    平台共享密钥
     * @param rawBody   原始请求体
     * @param signature 请求头中的签名
     * @param prefix    签名前缀 (如 sha256=)，无前缀传空
     */
    public boolean verify(String secret, String rawBody, String signature, String prefix) {
        if (StringUtils.isBlank(secret)) {
            throw new AppException(ResponseCode.CONFIG_ERROR.getCode(), "Webhook secret is not configured");
        }
        if (StringUtils.isBlank(signature)) {
            return false;
        }
        String provided = signature.trim();
        if (StringUtils.isNotEmpty(prefix)) {
            if (!provided.toLowerCase(Locale.ROOT).startsWith(prefix.toLowerCase(Locale.ROOT))) {
                return false;
            }
            provided = provided.substring(prefix.length());
        }
        byte[] providedBytes;
        try {
            providedBytes = HEX.parseHex(provided.toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return false;
        }
        byte[] expected = hmacSha256(secret, rawBody == null ? "" : rawBody);
        return MessageDigest.isEqual(expected, providedBytes);
    }

    public String hmacSha256Hex(String secret, String content) {
        return HEX.formatHex(hmacSha256(secret, content == null ? "" : content));
    }

    /**
     * 常量时间字符串比较。
     */
    public boolean constantTimeEquals(String expected, String provided) {
        if (expected == null || provided == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8));
    }

    public String sha256Hex(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HEX.formatHex(digest.digest((content == null ? "" : content).getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "SHA-256 unavailable", ex);
        }
    }

    private byte[] hmacSha256(String secret, String content) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return mac.doFinal(content.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to compute webhook signature", ex);
        }
    }
}
