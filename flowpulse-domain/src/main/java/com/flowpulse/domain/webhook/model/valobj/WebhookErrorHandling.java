package com.flowpulse.domain.webhook.model.valobj;

import com.flowpulse.types.enums.FallbackActionEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 外发重试与兜底策略，默认 {3 次, 1000ms, log}。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookErrorHandling {

    public static final int DEFAULT_RETRY_ATTEMPTS = 3;
    public static final long DEFAULT_RETRY_DELAY_MS = 1000L;

    private Integer retryAttempts;
    private Long retryDelayMs;
    private FallbackActionEnum fallbackAction;

    public static WebhookErrorHandling defaults() {
        return WebhookErrorHandling.builder()
                .retryAttempts(DEFAULT_RETRY_ATTEMPTS)
                .retryDelayMs(DEFAULT_RETRY_DELAY_MS)
                .fallbackAction(FallbackActionEnum.LOG)
                .build();
    }

    /**
     * 缺省字段用默认值补齐。
     */
    public WebhookErrorHandling withDefaults() {
        return WebhookErrorHandling.builder()
                .retryAttempts(retryAttempts == null ? DEFAULT_RETRY_ATTEMPTS : Math.max(retryAttempts, 0))
                .retryDelayMs(retryDelayMs == null ? DEFAULT_RETRY_DELAY_MS : Math.max(retryDelayMs, 0L))
                .fallbackAction(fallbackAction == null ? FallbackActionEnum.LOG : fallbackAction)
                .build();
    }
}
