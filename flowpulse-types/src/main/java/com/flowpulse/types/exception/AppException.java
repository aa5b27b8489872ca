package com.flowpulse.types.exception;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用自定义异常类。
 * <p>
 * 统一承载业务异常，包含异常码和异常描述信息。
 * 异常码取自 {@link com.flowpulse.types.enums.ResponseCode}，由 HTTP 层映射为具体状态码。
 * </p>
 *
 * @author flowpulse
 * @since 2026-10-19
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 3190458712294410583L;

    /** 异常码 */
    private String code;

    /** 异常信息 */
    private String info;

    /**
     * 创建包含异常码的 AppException。
     *
     * @param code 异常码
     */
    public AppException(String code) {
        super(code);
        this.code = code;
        this.info = code;
    }

    /**
     * 创建包含异常码和原因的 AppException。
     *
     * @param code 异常码
     * @param cause 异常原因
     */
    public AppException(String code, Throwable cause) {
        super(cause == null ? null : cause.getMessage(), cause);
        this.code = code;
        this.info = cause == null ? null : cause.getMessage();
    }

    /**
     * 创建包含异常码和描述信息的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     */
    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    /**
     * 创建包含异常码、描述信息和原因的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     * @param cause 异常原因
     */
    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    @Override
    public String toString() {
        return "AppException{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}
