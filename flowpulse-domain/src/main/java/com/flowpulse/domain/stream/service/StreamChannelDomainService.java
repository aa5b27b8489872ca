package com.flowpulse.domain.stream.service;

import com.flowpulse.types.common.Constants;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * 频道解析与路由领域服务。频道名是开放字符串，不做枚举限制。
 */
@Service
public class StreamChannelDomainService {

    /**
     * 解析逗号分隔的频道参数，空则返回默认频道。
     */
    public Set<String> resolveChannels(String rawChannels) {
        if (StringUtils.isBlank(rawChannels)) {
            return defaultChannels();
        }
        return normalize(Arrays.asList(rawChannels.split(Constants.SPLIT)));
    }

    public Set<String> normalize(Collection<String> channels) {
        Set<String> normalized = new LinkedHashSet<>();
        if (channels == null) {
            return normalized;
        }
        for (String channel : channels) {
            String text = StringUtils.trimToEmpty(channel);
            if (!text.isEmpty()) {
                normalized.add(text);
            }
        }
        return normalized;
    }

    public Set<String> defaultChannels() {
        return new LinkedHashSet<>(Arrays.asList(Constants.DEFAULT_STREAM_CHANNELS));
    }

    /**
     * 注入数据的频道路由：forecast → forecasts，alert → alerts，其余 → insights。
     */
    public String routeDataType(String dataType) {
        String normalized = StringUtils.trimToEmpty(dataType).toLowerCase(Locale.ROOT);
        if ("forecast".equals(normalized) || Constants.CHANNEL_FORECASTS.equals(normalized)) {
            return Constants.CHANNEL_FORECASTS;
        }
        if ("alert".equals(normalized) || Constants.CHANNEL_ALERTS.equals(normalized)) {
            return Constants.CHANNEL_ALERTS;
        }
        return Constants.CHANNEL_INSIGHTS;
    }
}
