package com.flowpulse.infrastructure.gateway;

import com.flowpulse.domain.webhook.adapter.gateway.IWebhookTransport;
import com.flowpulse.domain.webhook.model.valobj.OutboundWebhookRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * 基于 HttpURLConnection 的外发通道。
 * <p>
 * HttpURLConnection 不支持 PATCH，PATCH 以 POST + X-HTTP-Method-Override 发送。
 * </p>
 */
@Slf4j
@Component
public class HttpUrlConnectionWebhookTransport implements IWebhookTransport {

    private final int connectTimeoutMs;
    private final int readTimeoutMs;

    public HttpUrlConnectionWebhookTransport(
            @Value("${webhook.dispatch.connect-timeout-ms:5000}") int connectTimeoutMs,
            @Value("${webhook.dispatch.read-timeout-ms:10000}") int readTimeoutMs) {
        this.connectTimeoutMs = Math.max(connectTimeoutMs, 100);
        this.readTimeoutMs = Math.max(readTimeoutMs, 100);
    }

    @Override
    public int send(OutboundWebhookRequest request) throws IOException {
        HttpURLConnection connection = null;
        try {
            URL url = new URL(request.url());
            connection = (HttpURLConnection) url.openConnection();
            connection.setConnectTimeout(connectTimeoutMs);
            connection.setReadTimeout(readTimeoutMs);
            connection.setInstanceFollowRedirects(false);
            String method = request.method() == null ? "POST" : request.method().toUpperCase(Locale.ROOT);
            if ("PATCH".equals(method)) {
                connection.setRequestMethod("POST");
                connection.setRequestProperty("X-HTTP-Method-Override", "PATCH");
            } else {
                connection.setRequestMethod(method);
            }
            for (Map.Entry<String, String> header : request.headers().entrySet()) {
                connection.setRequestProperty(header.getKey(), header.getValue());
            }
            boolean writeBody = request.body() != null && !"GET".equals(method) && !"DELETE".equals(method);
            if (writeBody) {
                byte[] payload = request.body().getBytes(StandardCharsets.UTF_8);
                connection.setDoOutput(true);
                connection.setFixedLengthStreamingMode(payload.length);
                try (OutputStream output = connection.getOutputStream()) {
                    output.write(payload);
                }
            }
            int statusCode = connection.getResponseCode();
            drain(connection, statusCode);
            log.debug("Webhook outbound sent. url={}, method={}, status={}", request.url(), method, statusCode);
            return statusCode;
        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private void drain(HttpURLConnection connection, int statusCode) throws IOException {
        InputStream stream = statusCode >= 400 ? connection.getErrorStream() : connection.getInputStream();
        if (stream == null) {
            return;
        }
        try (InputStream input = stream) {
            input.readAllBytes();
        }
    }
}
