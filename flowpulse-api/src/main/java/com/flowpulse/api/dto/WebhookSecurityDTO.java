package com.flowpulse.api.dto;

import lombok.Data;

/**
 * 外发端点认证配置，secretRef 指向配置中的密钥名。
 */
@Data
public class WebhookSecurityDTO {

    private String authentication;
    private String secretRef;
    private String headerName;
}
