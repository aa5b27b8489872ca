package com.flowpulse.infrastructure.repository.webhook;

import com.flowpulse.domain.webhook.adapter.repository.IWebhookEndpointRepository;
import com.flowpulse.domain.webhook.model.entity.WebhookEndpointEntity;
import com.flowpulse.domain.webhook.model.valobj.WebhookErrorHandling;
import com.flowpulse.domain.webhook.model.valobj.WebhookSecurity;
import com.flowpulse.infrastructure.dao.WebhookEndpointDao;
import com.flowpulse.infrastructure.dao.po.WebhookEndpointPO;
import com.flowpulse.infrastructure.util.JsonCodec;
import com.flowpulse.types.enums.FallbackActionEnum;
import com.flowpulse.types.enums.WebhookAuthModeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 外发端点仓储实现类。
 * <p>
 * security / triggers / error_handling 以 JSONB 存储，键名使用 snake_case。
 * </p>
 *
 * @author flowpulse
 * @since 2026-10-19
 */
@Slf4j
@Repository
public class WebhookEndpointRepositoryImpl implements IWebhookEndpointRepository {

    private final WebhookEndpointDao webhookEndpointDao;
    private final JsonCodec jsonCodec;

    public WebhookEndpointRepositoryImpl(WebhookEndpointDao webhookEndpointDao, JsonCodec jsonCodec) {
        this.webhookEndpointDao = webhookEndpointDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public WebhookEndpointEntity save(WebhookEndpointEntity entity) {
        entity.validate();
        WebhookEndpointPO po = toPO(entity);
        webhookEndpointDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public WebhookEndpointEntity findByEndpointId(String endpointId) {
        WebhookEndpointPO po = webhookEndpointDao.selectByEndpointId(endpointId);
        return po == null ? null : toEntity(po);
    }

    @Override
    public List<WebhookEndpointEntity> findAll() {
        return webhookEndpointDao.selectAll().stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<WebhookEndpointEntity> findActive() {
        return webhookEndpointDao.selectActive().stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public void incrementTriggerCount(String endpointId, LocalDateTime now) {
        warnIfMissing(webhookEndpointDao.incrementTriggerCount(endpointId, now), endpointId, "trigger");
    }

    @Override
    public void recordSuccess(String endpointId, LocalDateTime now) {
        warnIfMissing(webhookEndpointDao.incrementSuccessCount(endpointId, now), endpointId, "success");
    }

    @Override
    public void recordError(String endpointId, LocalDateTime now) {
        warnIfMissing(webhookEndpointDao.incrementErrorCount(endpointId, now), endpointId, "error");
    }

    private void warnIfMissing(int affected, String endpointId, String counter) {
        if (affected == 0) {
            log.warn("Webhook endpoint counter update skipped. endpointId={}, counter={}", endpointId, counter);
        }
    }

    private WebhookEndpointEntity toEntity(WebhookEndpointPO po) {
        WebhookEndpointEntity entity = new WebhookEndpointEntity();
        entity.setId(po.getId());
        entity.setEndpointId(po.getEndpointId());
        entity.setName(po.getName());
        entity.setUrl(po.getUrl());
        entity.setMethod(po.getMethod());
        entity.setActive(po.getIsActive());
        entity.setSecurity(readSecurity(po.getSecurity()));
        List<String> triggers = jsonCodec.readStringList(po.getTriggers());
        entity.setTriggers(triggers == null ? new ArrayList<>() : triggers);
        entity.setErrorHandling(readErrorHandling(po.getErrorHandling()));
        entity.setTriggerCount(po.getTriggerCount());
        entity.setSuccessCount(po.getSuccessCount());
        entity.setErrorCount(po.getErrorCount());
        entity.setLastTriggered(po.getLastTriggered());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private WebhookEndpointPO toPO(WebhookEndpointEntity entity) {
        return WebhookEndpointPO.builder()
                .id(entity.getId())
                .endpointId(entity.getEndpointId())
                .name(entity.getName())
                .url(entity.getUrl())
                .method(entity.getMethod())
                .isActive(entity.getActive())
                .security(jsonCodec.writeValue(writeSecurity(entity.getSecurity())))
                .triggers(jsonCodec.writeValue(entity.getTriggers() == null ? new ArrayList<>() : entity.getTriggers()))
                .errorHandling(jsonCodec.writeValue(writeErrorHandling(entity.effectiveErrorHandling())))
                .triggerCount(entity.getTriggerCount() == null ? 0L : entity.getTriggerCount())
                .successCount(entity.getSuccessCount() == null ? 0L : entity.getSuccessCount())
                .errorCount(entity.getErrorCount() == null ? 0L : entity.getErrorCount())
                .lastTriggered(entity.getLastTriggered())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    private Map<String, Object> writeSecurity(WebhookSecurity security) {
        WebhookSecurity value = security == null ? WebhookSecurity.none() : security;
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("authentication", value.getAuthentication() == null
                ? WebhookAuthModeEnum.NONE.getCode()
                : value.getAuthentication().getCode());
        json.put("secret_ref", value.getSecretRef());
        json.put("header_name", value.getHeaderName());
        return json;
    }

    private WebhookSecurity readSecurity(String json) {
        Map<String, Object> map = jsonCodec.readMap(json);
        if (map == null) {
            return WebhookSecurity.none();
        }
        Object authentication = map.get("authentication");
        return WebhookSecurity.builder()
                .authentication(authentication == null
                        ? WebhookAuthModeEnum.NONE
                        : WebhookAuthModeEnum.fromCode(String.valueOf(authentication)))
                .secretRef(textOf(map.get("secret_ref")))
                .headerName(textOf(map.get("header_name")))
                .build();
    }

    private Map<String, Object> writeErrorHandling(WebhookErrorHandling errorHandling) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("retry_attempts", errorHandling.getRetryAttempts());
        json.put("retry_delay_ms", errorHandling.getRetryDelayMs());
        json.put("fallback_action", errorHandling.getFallbackAction().getCode());
        return json;
    }

    private WebhookErrorHandling readErrorHandling(String json) {
        Map<String, Object> map = jsonCodec.readMap(json);
        if (map == null) {
            return WebhookErrorHandling.defaults();
        }
        Object retryAttempts = map.get("retry_attempts");
        Object retryDelay = map.get("retry_delay_ms");
        Object fallback = map.get("fallback_action");
        return WebhookErrorHandling.builder()
                .retryAttempts(retryAttempts instanceof Number number ? number.intValue() : null)
                .retryDelayMs(retryDelay instanceof Number number ? number.longValue() : null)
                .fallbackAction(fallback == null ? null : FallbackActionEnum.fromCode(String.valueOf(fallback)))
                .build()
                .withDefaults();
    }

    private String textOf(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
