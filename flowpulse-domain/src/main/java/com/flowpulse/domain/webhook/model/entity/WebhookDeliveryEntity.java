package com.flowpulse.domain.webhook.model.entity;

import com.flowpulse.types.enums.DeliveryDirectionEnum;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Webhook 投递记录：入站一条事件一行，外发一个端点一次派发一行。
 *
 * @author flowpulse
 * @since 2026-10-19
 */
@Data
public class WebhookDeliveryEntity {

    private Long id;

    private DeliveryDirectionEnum direction;

    /**
     * 入站平台 (外发为空)
     */
    private String platform;

    /**
     * 外发端点 ID (入站为空)
     */
    private String endpointId;

    private String eventType;

    private String idempotencyId;

    private Boolean success;

    /**
     * 实际尝试次数
     */
    private Integer attempts;

    private String message;

    private LocalDateTime createdAt;
}
