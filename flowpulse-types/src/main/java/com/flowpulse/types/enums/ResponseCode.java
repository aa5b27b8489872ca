package com.flowpulse.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义 API 响应码、描述信息以及对应的 HTTP 状态码。
 * </p>
 *
 * @author flowpulse
 * @since 2026-10-19
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功", 200),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败", 500),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数", 400),

    /** 认证失败（签名或令牌无效） */
    UNAUTHORIZED("0003", "认证失败", 401),

    /** 资源不存在 */
    NOT_FOUND("0004", "资源不存在", 404),

    /** 非法状态迁移 */
    INVALID_TRANSITION("0005", "非法状态迁移", 400),

    /** 并发冲突 */
    CONFLICT("0006", "并发冲突，请重试", 409),

    /** 服务端配置缺失 */
    CONFIG_ERROR("0007", "服务端配置缺失", 500),

    /** 禁止访问 */
    FORBIDDEN("0008", "禁止访问", 403);

    private final String code;
    private final String info;
    private final int httpStatus;

    ResponseCode(String code, String info, int httpStatus) {
        this.code = code;
        this.info = info;
        this.httpStatus = httpStatus;
    }

    public static ResponseCode fromCode(String code) {
        if (code == null) {
            return UN_ERROR;
        }
        for (ResponseCode responseCode : ResponseCode.values()) {
            if (responseCode.code.equals(code)) {
                return responseCode;
            }
        }
        return UN_ERROR;
    }

}
