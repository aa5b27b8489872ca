package com.flowpulse.trigger.http;

import com.flowpulse.api.response.Response;
import com.flowpulse.types.enums.ResponseCode;
import com.flowpulse.types.exception.AppException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestNotUsableException;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 统一 API 异常处理：{@link ResponseCode} 映射为真实 HTTP 状态码，信封保持 {code, info}。
 * <p>
 * SSE 长连接超时或客户端断开时响应体已是 text/event-stream，只记录日志、不再写 JSON。
 * </p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    private static final int MAX_INFO_LENGTH = 300;

    @ExceptionHandler(AppException.class)
    public ResponseEntity<Response<Object>> handleAppException(AppException ex, HttpServletRequest request) {
        ResponseCode responseCode = ResponseCode.fromCode(ex.getCode());
        String code = StringUtils.defaultIfBlank(ex.getCode(), ResponseCode.UN_ERROR.getCode());
        String info = StringUtils.defaultIfBlank(ex.getInfo(), responseCode.getInfo());
        return reply(responseCode.getHttpStatus(), code, info, ex, request);
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            BindException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<Response<Object>> handleBadRequestException(Exception ex, HttpServletRequest request) {
        ResponseCode badRequest = ResponseCode.ILLEGAL_PARAMETER;
        return reply(badRequest.getHttpStatus(), badRequest.getCode(),
                StringUtils.defaultIfBlank(ex.getMessage(), badRequest.getInfo()), ex, request);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Response<Object>> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex,
                                                                     HttpServletRequest request) {
        return reply(HttpStatus.METHOD_NOT_ALLOWED.value(), ResponseCode.ILLEGAL_PARAMETER.getCode(),
                ex.getMessage(), ex, request);
    }

    @ExceptionHandler({AsyncRequestTimeoutException.class, AsyncRequestNotUsableException.class})
    public ResponseEntity<Void> handleStreamTermination(Exception ex, HttpServletRequest request) {
        log.debug("Stream request ended. path={}, traceId={}, reason={}",
                resolvePath(request), MDC.get("traceId"), ex.getClass().getSimpleName());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Response<Object>> handleUnknownException(Exception ex, HttpServletRequest request) {
        ResponseCode unknown = ResponseCode.UN_ERROR;
        logError(unknown.getHttpStatus(), unknown.getCode(), ex.getMessage(), ex, request);
        return ResponseEntity.status(unknown.getHttpStatus())
                .body(envelope(unknown.getCode(), unknown.getInfo()));
    }

    private ResponseEntity<Response<Object>> reply(int httpStatus, String code, String info,
                                                   Exception ex, HttpServletRequest request) {
        String message = StringUtils.truncate(info, MAX_INFO_LENGTH);
        logError(httpStatus, code, message, ex, request);
        return ResponseEntity.status(httpStatus).body(envelope(code, message));
    }

    /**
     * 5xx 记 error（未知异常附带堆栈），4xx 记 warn。
     */
    private void logError(int httpStatus, String code, String message, Exception ex, HttpServletRequest request) {
        String line = "HTTP_ERROR path={}, method={}, status={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}";
        Object[] args = {
                resolvePath(request),
                request == null ? "-" : request.getMethod(),
                httpStatus,
                StringUtils.defaultIfBlank(MDC.get("traceId"), "-"),
                StringUtils.defaultIfBlank(MDC.get("requestId"), "-"),
                ex.getClass().getSimpleName(),
                code,
                StringUtils.truncate(message, MAX_INFO_LENGTH)
        };
        if (httpStatus < 500) {
            log.warn(line, args);
        } else if (ex instanceof AppException) {
            log.error(line, args);
        } else {
            log.error(line, ArrayUtils.add(args, ex));
        }
    }

    private Response<Object> envelope(String code, String info) {
        return Response.<Object>builder()
                .code(code)
                .info(info)
                .build();
    }

    private String resolvePath(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getRequestURI(), "-");
    }
}
