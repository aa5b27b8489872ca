package com.flowpulse.domain.webhook.model.valobj;

import com.flowpulse.types.enums.WebhookAuthModeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 外发端点认证配置。secretRef 为密钥引用名，解析失败时按字面值使用。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookSecurity {

    private WebhookAuthModeEnum authentication;
    private String secretRef;
    private String headerName;

    public static WebhookSecurity none() {
        return WebhookSecurity.builder().authentication(WebhookAuthModeEnum.NONE).build();
    }
}
