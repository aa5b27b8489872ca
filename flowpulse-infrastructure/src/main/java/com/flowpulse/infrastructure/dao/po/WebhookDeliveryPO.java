package com.flowpulse.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Webhook 投递记录 PO (webhook_deliveries)
 *
 * @author flowpulse
 * @since 2026-10-19
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookDeliveryPO {

    private Long id;

    /**
     * inbound / outbound
     */
    private String direction;

    private String platform;

    private String endpointId;

    private String eventType;

    private String idempotencyId;

    private Boolean success;

    private Integer attempts;

    private String message;

    private LocalDateTime createdAt;
}
