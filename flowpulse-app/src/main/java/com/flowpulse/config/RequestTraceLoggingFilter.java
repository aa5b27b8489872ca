package com.flowpulse.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * HTTP 链路日志过滤器：注入 traceId/requestId 到 MDC，输出 HTTP_IN / HTTP_OUT。
 * <p>
 * Webhook 路由的请求体参与验签，不做缓存包装；SSE 路由由配置整体排除。
 * </p>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    static final String HEADER_TRACE_ID = "X-Trace-Id";
    static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final String MDC_TRACE_ID = "traceId";
    private static final String MDC_REQUEST_ID = "requestId";

    private final ObjectMapper objectMapper;
    private final ObservabilityHttpLogProperties properties;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public RequestTraceLoggingFilter(ObjectMapper objectMapper,
                                     ObservabilityHttpLogProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!properties.isEnabled()) {
            return true;
        }
        String path = normalizePath(request.getRequestURI());
        if (matchesAny(path, properties.getExcludePathPatterns())) {
            return true;
        }
        List<String> includePatterns = properties.getIncludePathPatterns();
        return includePatterns != null && !includePatterns.isEmpty() && !matchesAny(path, includePatterns);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = headerOrRandom(request.getHeader(HEADER_TRACE_ID));
        String requestId = headerOrRandom(request.getHeader(HEADER_REQUEST_ID));
        String path = normalizePath(request.getRequestURI());
        String method = request.getMethod();
        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_REQUEST_ID, requestId);

        boolean cacheRequestBody = properties.isLogRequestBody() && !matchesAny(path, properties.getRawBodyPathPatterns());
        HttpServletRequest effectiveRequest = cacheRequestBody && !(request instanceof ContentCachingRequestWrapper)
                ? new ContentCachingRequestWrapper(request)
                : request;
        ContentCachingResponseWrapper responseWrapper = response instanceof ContentCachingResponseWrapper wrapper
                ? wrapper
                : new ContentCachingResponseWrapper(response);

        boolean sampled = sample();
        if (sampled) {
            log.info("HTTP_IN method={}, path={}, query={}, userAgent={}",
                    method, path, maskQuery(request.getQueryString()), StringUtils.truncate(request.getHeader("User-Agent"), 200));
        }
        long startNs = System.nanoTime();
        Throwable error = null;
        try {
            filterChain.doFilter(effectiveRequest, responseWrapper);
        } catch (IOException | ServletException | RuntimeException ex) {
            error = ex;
            throw ex;
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            if (sampled || error != null || costMs >= Math.max(properties.getSlowRequestThresholdMs(), 0L)) {
                logOutbound(method, path, responseWrapper, effectiveRequest, costMs, error);
            }
            responseWrapper.copyBodyToResponse();
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_TRACE_ID);
        }
    }

    private void logOutbound(String method,
                             String path,
                             ContentCachingResponseWrapper responseWrapper,
                             HttpServletRequest request,
                             long costMs,
                             Throwable error) {
        String responseCode = StringUtils.defaultIfBlank(readResponseCode(responseWrapper), "-");
        String bodySummary = summarizeRequestBody(request);
        if (error == null) {
            log.info("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, outcome=success, requestBodySummary={}",
                    method, path, responseWrapper.getStatus(), responseCode, costMs, bodySummary);
            return;
        }
        log.warn("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, outcome=error, errorType={}, errorMessage={}, requestBodySummary={}",
                method, path, responseWrapper.getStatus(), responseCode, costMs,
                error.getClass().getSimpleName(), StringUtils.truncate(error.getMessage(), 200), bodySummary);
    }

    private String readResponseCode(ContentCachingResponseWrapper responseWrapper) {
        byte[] body = responseWrapper.getContentAsByteArray();
        if (body.length == 0 || !isJson(responseWrapper.getContentType())) {
            return null;
        }
        try {
            return objectMapper.readTree(body).path("code").asText(null);
        } catch (IOException ex) {
            log.debug("Response code extraction skipped. error={}", ex.getMessage());
            return null;
        }
    }

    private String summarizeRequestBody(HttpServletRequest request) {
        if (!(request instanceof ContentCachingRequestWrapper wrapper) || wrapper.getContentAsByteArray().length == 0) {
            return "-";
        }
        String payload = new String(wrapper.getContentAsByteArray(), StandardCharsets.UTF_8);
        int maxLength = Math.max(64, properties.getMaxBodyLength());
        if (!isJson(wrapper.getContentType())) {
            return StringUtils.truncate(maskRawBody(payload), maxLength);
        }
        try {
            JsonNode source = objectMapper.readTree(payload);
            ObjectNode summary = objectMapper.createObjectNode();
            for (String key : properties.getRequestBodyWhitelist()) {
                if (StringUtils.isNotBlank(key) && source.has(key)) {
                    summary.set(key, isMaskField(key) ? TextNode.valueOf("***") : source.get(key));
                }
            }
            return summary.isEmpty() ? "-" : StringUtils.truncate(summary.toString(), maxLength);
        } catch (IOException ex) {
            return StringUtils.truncate(maskRawBody(payload), maxLength);
        }
    }

    /**
     * 敏感参数值替换为 ***，其余参数值最多保留 80 个字符。
     */
    String maskQuery(String queryString) {
        if (StringUtils.isBlank(queryString)) {
            return "-";
        }
        String masked = Arrays.stream(queryString.split("&"))
                .filter(StringUtils::isNotBlank)
                .map(part -> {
                    String name = StringUtils.substringBefore(part, "=");
                    String value = StringUtils.substringAfter(part, "=");
                    return name + "=" + (isMaskField(name) ? "***" : StringUtils.truncate(value, 80));
                })
                .collect(Collectors.joining("&"));
        return StringUtils.defaultIfEmpty(masked, "-");
    }

    private String maskRawBody(String payload) {
        String result = payload;
        for (String field : properties.getMaskFields()) {
            if (StringUtils.isNotBlank(field)) {
                result = result.replaceAll("(?i)(\"" + Pattern.quote(field) + "\"\\s*:\\s*\")[^\"]*(\")", "$1***$2");
            }
        }
        return result;
    }

    private boolean isMaskField(String key) {
        List<String> maskFields = properties.getMaskFields();
        return StringUtils.isNotBlank(key) && maskFields != null
                && maskFields.stream().anyMatch(field -> StringUtils.equalsIgnoreCase(StringUtils.trim(field), key.trim()));
    }

    private boolean isJson(String contentType) {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains(MediaType.APPLICATION_JSON_VALUE);
    }

    private boolean sample() {
        double rate = properties.getSampleRate();
        return rate >= 1D || (rate > 0D && ThreadLocalRandom.current().nextDouble() <= rate);
    }

    private boolean matchesAny(String path, List<String> patterns) {
        return patterns != null && patterns.stream()
                .anyMatch(pattern -> StringUtils.isNotBlank(pattern) && pathMatcher.match(pattern.trim(), path));
    }

    private String headerOrRandom(String value) {
        return StringUtils.isNotBlank(value) ? value.trim() : UUID.randomUUID().toString().replace("-", "");
    }

    private String normalizePath(String path) {
        return StringUtils.defaultIfBlank(path, "/").trim();
    }
}
