package com.flowpulse.domain.webhook.service.platform;

import com.flowpulse.domain.webhook.model.valobj.CanonicalWebhookEvent;
import com.flowpulse.types.enums.WebhookPlatformEnum;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 平台载荷适配器：声明签名头与格式，并把平台原始载荷归一化为标准事件。
 */
public interface IWebhookPayloadAdapter {

    WebhookPlatformEnum platform();

    /**
     * 携带 HMAC 签名的请求头
     */
    String signatureHeader();

    /**
     * 签名值前缀，无前缀返回空串
     */
    String signaturePrefix();

    /**
     * 携带事件类型的请求头，平台不提供时返回 null
     */
    String eventTypeHeader();

    /**
     * 该平台会被处理的事件类型
     */
    Set<String> handledEventTypes();

    /**
     * 归一化。一次投递可能包含多个子事件。
     *
     * @param rawBody         原始请求体 (用于生成兜底幂等 ID)
     * @param body            解析后的请求体
     * @param headerEventType 事件类型请求头的值，可空
     * @param receivedAt      接收时间
     */
    List<CanonicalWebhookEvent> normalize(String rawBody,
                                          Map<String, Object> body,
                                          String headerEventType,
                                          LocalDateTime receivedAt);
}
