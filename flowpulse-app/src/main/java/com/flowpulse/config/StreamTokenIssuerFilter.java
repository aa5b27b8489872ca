package com.flowpulse.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowpulse.api.response.Response;
import com.flowpulse.types.enums.ResponseCode;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * 推送令牌签发接口鉴权：`POST /api/stream/tokens` 需携带签发方密钥。
 * <p>
 * 密钥取自 X-Stream-Issuer-Key 头或 Authorization: Bearer；未配置 stream.auth.issuer-key 时一律拒绝。
 * </p>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class StreamTokenIssuerFilter extends OncePerRequestFilter {

    public static final String HEADER_ISSUER_KEY = "X-Stream-Issuer-Key";

    private static final String TOKENS_PATH = "/api/stream/tokens";
    private static final String BEARER_PREFIX = "Bearer ";

    private final ObjectMapper objectMapper;
    private final String issuerKey;

    public StreamTokenIssuerFilter(ObjectMapper objectMapper,
                                   @Value("${stream.auth.issuer-key:}") String issuerKey) {
        this.objectMapper = objectMapper;
        this.issuerKey = StringUtils.trimToNull(issuerKey);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request == null) {
            return true;
        }
        return !"POST".equalsIgnoreCase(request.getMethod())
                || !TOKENS_PATH.equals(StringUtils.removeEnd(StringUtils.trimToEmpty(request.getRequestURI()), "/"));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        if (issuerKey == null) {
            log.warn("Stream token issue rejected, issuer key not configured. path={}", request.getRequestURI());
            writeUnauthorized(response, "Stream token issuing is disabled");
            return;
        }
        String presented = resolveKey(request);
        if (presented == null || !matches(presented)) {
            log.warn("Stream token issue rejected. path={}, keyPresent={}", request.getRequestURI(), presented != null);
            writeUnauthorized(response, "Invalid stream issuer key");
            return;
        }
        filterChain.doFilter(request, response);
    }

    private String resolveKey(HttpServletRequest request) {
        String key = StringUtils.trimToNull(request.getHeader(HEADER_ISSUER_KEY));
        if (key != null) {
            return key;
        }
        String authorization = StringUtils.trimToNull(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (authorization != null && StringUtils.startsWithIgnoreCase(authorization, BEARER_PREFIX)) {
            return StringUtils.trimToNull(authorization.substring(BEARER_PREFIX.length()));
        }
        return null;
    }

    private boolean matches(String presented) {
        return MessageDigest.isEqual(issuerKey.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }

    private void writeUnauthorized(HttpServletResponse response, String message) throws IOException {
        Response<Void> body = Response.<Void>builder()
                .code(ResponseCode.UNAUTHORIZED.getCode())
                .info(message)
                .build();
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
        response.getWriter().flush();
    }
}
