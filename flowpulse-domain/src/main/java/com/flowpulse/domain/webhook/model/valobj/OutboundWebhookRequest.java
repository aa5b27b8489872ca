package com.flowpulse.domain.webhook.model.valobj;

import java.util.Map;

/**
 * 外发 HTTP 请求。
 */
public record OutboundWebhookRequest(String url,
                                     String method,
                                     Map<String, String> headers,
                                     String body) {

    public OutboundWebhookRequest {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
