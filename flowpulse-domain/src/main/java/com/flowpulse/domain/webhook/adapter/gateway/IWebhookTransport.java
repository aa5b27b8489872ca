package com.flowpulse.domain.webhook.adapter.gateway;

import com.flowpulse.domain.webhook.model.valobj.OutboundWebhookRequest;

import java.io.IOException;

/**
 * 外发 HTTP 通道，实现必须设置连接与读取超时。
 */
public interface IWebhookTransport {

    /**
     * 发送请求
     *
     * @return HTTP 状态码
     * @throws IOException 网络错误或超时
     */
    int send(OutboundWebhookRequest request) throws IOException;
}
