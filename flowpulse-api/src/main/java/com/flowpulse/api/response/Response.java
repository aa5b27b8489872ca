package com.flowpulse.api.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 统一响应结果封装类。
 * <p>
 * 封装所有 API 接口的响应结果，包含响应码、响应描述和响应数据。
 * HTTP 状态码由控制器或全局异常处理器按响应码设置。
 * </p>
 *
 * @param <T> 响应数据的类型
 * @author flowpulse
 * @since 2026-10-19
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Response<T> implements Serializable {

    private static final long serialVersionUID = 2865093371487402245L;

    /** 响应码，成功为"0000" */
    private String code;

    /** 响应描述信息 */
    private String info;

    /** 响应数据，泛型类型 */
    private T data;

}
