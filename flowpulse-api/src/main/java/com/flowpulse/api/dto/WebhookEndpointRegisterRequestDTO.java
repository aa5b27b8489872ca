package com.flowpulse.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;

import java.util.List;

/**
 * 外发端点注册请求。
 */
@Data
public class WebhookEndpointRegisterRequestDTO {

    private String name;
    private String url;
    private String method;
    private WebhookSecurityDTO security;
    private List<String> triggers;
    private WebhookErrorHandlingDTO errorHandling;
    @JsonAlias({"isActive", "is_active"})
    private Boolean active;
}
