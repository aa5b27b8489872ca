package com.flowpulse.trigger.application.webhook;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Webhook 网关配置。
 * <p>
 * platforms：入站平台的共享密钥与握手校验令牌；secrets：外发端点 secret_ref 的取值表。
 * </p>
 */
@Data
@Component
@ConfigurationProperties(prefix = "webhook", ignoreInvalidFields = true)
public class WebhookGatewayProperties {

    private Map<String, Platform> platforms = new LinkedHashMap<>();

    private Map<String, String> secrets = new LinkedHashMap<>();

    private Dispatch dispatch = new Dispatch();

    private Idempotency idempotency = new Idempotency();

    private Inbound inbound = new Inbound();

    public String platformSecret(String platform) {
        Platform config = platformConfig(platform);
        return config == null ? null : StringUtils.trimToNull(config.getSecret());
    }

    public String platformVerifyToken(String platform) {
        Platform config = platformConfig(platform);
        return config == null ? null : StringUtils.trimToNull(config.getVerifyToken());
    }

    /**
     * 解析 secret_ref：优先查 secrets 表，未命中时按字面值使用。
     */
    public String resolveSecret(String secretRef) {
        if (StringUtils.isBlank(secretRef)) {
            return null;
        }
        String ref = secretRef.trim();
        String configured = secrets == null ? null : secrets.get(ref);
        return StringUtils.isNotBlank(configured) ? configured : ref;
    }

    private Platform platformConfig(String platform) {
        if (platforms == null || platform == null) {
            return null;
        }
        return platforms.get(platform.trim().toLowerCase(Locale.ROOT));
    }

    @Data
    public static class Platform {
        private String secret;
        private String verifyToken;
    }

    @Data
    public static class Dispatch {
        /** 同一端点两次外发的最小间隔，0 表示不限制 */
        private long minIntervalMs = 0L;
    }

    /**
     * 入站事件处理失败（版本冲突、存储异常）时的重试，在请求线程内同步进行。
     */
    @Data
    public static class Inbound {
        private int retryAttempts = 3;
        private long retryDelayMs = 5000L;
    }

    @Data
    public static class Idempotency {
        private long ttlMinutes = 60L;
        private long maximumSize = 10000L;
    }
}
