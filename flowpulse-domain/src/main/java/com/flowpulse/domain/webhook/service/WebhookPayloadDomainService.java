package com.flowpulse.domain.webhook.service;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 平台载荷的宽松读取与落库前脱敏。
 * 载荷来自外部 JSON，所有读取都容忍缺键与类型不符，返回空结构而不是抛错。
 */
@Service
public class WebhookPayloadDomainService {

    private static final Set<String> SENSITIVE_KEYS = Set.of("password", "secret", "token", "api_key");

    /**
     * 递归剔除 password/secret/token/api_key（忽略大小写），返回新 Map。
     */
    public Map<String, Object> sanitize(Map<String, Object> source) {
        Map<String, Object> sanitized = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((key, value) -> {
                if (key != null && !SENSITIVE_KEYS.contains(key.toLowerCase(Locale.ROOT))) {
                    sanitized.put(key, sanitizeValue(value));
                }
            });
        }
        return sanitized;
    }

    public Map<String, Object> readMap(Map<String, Object> source, String key) {
        Object value = source == null || key == null ? null : source.get(key);
        return value instanceof Map<?, ?> map ? stringKeyed(map) : new LinkedHashMap<>();
    }

    /**
     * 读取对象数组，非对象元素被跳过。
     */
    public List<Map<String, Object>> readMapList(Map<String, Object> source, String key) {
        Object value = source == null || key == null ? null : source.get(key);
        List<Map<String, Object>> items = new ArrayList<>();
        if (value instanceof List<?> list) {
            list.stream()
                    .filter(Map.class::isInstance)
                    .map(item -> stringKeyed((Map<?, ?>) item))
                    .forEach(items::add);
        }
        return items;
    }

    /**
     * 按候选键顺序取第一个非空标量文本；对象与数组不算文本。
     */
    public String readText(Map<String, Object> source, String... keys) {
        if (source == null || keys == null) {
            return null;
        }
        for (String key : keys) {
            Object value = StringUtils.isBlank(key) ? null : source.get(key);
            if (value != null && !(value instanceof Map<?, ?>) && !(value instanceof List<?>)) {
                String text = StringUtils.trimToNull(String.valueOf(value));
                if (text != null) {
                    return text;
                }
            }
        }
        return null;
    }

    private Object sanitizeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return sanitize(stringKeyed(map));
        }
        if (value instanceof List<?> list) {
            List<Object> items = new ArrayList<>(list.size());
            list.forEach(item -> items.add(sanitizeValue(item)));
            return items;
        }
        return value;
    }

    private Map<String, Object> stringKeyed(Map<?, ?> source) {
        Map<String, Object> copied = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null) {
                copied.put(String.valueOf(key), value);
            }
        });
        return copied;
    }
}
