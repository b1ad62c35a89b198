package com.offerflow.trigger.http;

import com.offerflow.api.response.Response;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.EnumMap;
import java.util.Map;

/**
 * 统一 API 异常处理：异常一律转为 {@link Response} 信封，业务码决定 HTTP 状态。
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    private static final int MAX_INFO_LENGTH = 300;

    private static final Map<ResponseCode, HttpStatus> STATUS_BY_CODE = new EnumMap<>(ResponseCode.class);

    static {
        STATUS_BY_CODE.put(ResponseCode.ILLEGAL_PARAMETER, HttpStatus.BAD_REQUEST);
        STATUS_BY_CODE.put(ResponseCode.SELF_REFERENCE, HttpStatus.BAD_REQUEST);
        STATUS_BY_CODE.put(ResponseCode.PROJECT_MISMATCH, HttpStatus.BAD_REQUEST);
        STATUS_BY_CODE.put(ResponseCode.NOT_FOUND, HttpStatus.NOT_FOUND);
        STATUS_BY_CODE.put(ResponseCode.INVALID_TRANSITION, HttpStatus.CONFLICT);
        STATUS_BY_CODE.put(ResponseCode.SEQUENCE_VIOLATION, HttpStatus.CONFLICT);
        STATUS_BY_CODE.put(ResponseCode.DUPLICATE_EDGE, HttpStatus.CONFLICT);
        STATUS_BY_CODE.put(ResponseCode.ALREADY_EXISTS, HttpStatus.CONFLICT);
        STATUS_BY_CODE.put(ResponseCode.CONCURRENT_MODIFICATION, HttpStatus.CONFLICT);
        STATUS_BY_CODE.put(ResponseCode.UPSTREAM_FAILURE, HttpStatus.BAD_GATEWAY);
    }

    @ExceptionHandler(AppException.class)
    public ResponseEntity<Response<Object>> handleAppException(AppException ex, HttpServletRequest request) {
        String code = StringUtils.defaultIfBlank(ex.getCode(), ResponseCode.UN_ERROR.getCode());
        String info = truncate(StringUtils.defaultIfBlank(ex.getInfo(), ResponseCode.UN_ERROR.getInfo()));
        HttpStatus status = statusOf(code);
        if (status.is5xxServerError() && status != HttpStatus.BAD_GATEWAY) {
            log.error("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorCode={}, errorMessage={}",
                    resolvePath(request), resolveMethod(request), resolveTraceId(), resolveRequestId(),
                    code, info, ex);
        } else {
            log.warn("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorCode={}, errorMessage={}",
                    resolvePath(request), resolveMethod(request), resolveTraceId(), resolveRequestId(),
                    code, info);
        }
        return ResponseEntity.status(status).body(envelope(code, info));
    }

    @ExceptionHandler({
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<Response<Object>> handleBadRequestException(Exception ex, HttpServletRequest request) {
        String info = truncate(StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.ILLEGAL_PARAMETER.getInfo()));
        log.warn("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request), resolveMethod(request), resolveTraceId(), resolveRequestId(),
                ex.getClass().getSimpleName(), ResponseCode.ILLEGAL_PARAMETER.getCode(), info);
        return ResponseEntity.badRequest().body(envelope(ResponseCode.ILLEGAL_PARAMETER.getCode(), info));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Response<Object>> handleUnknownException(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request), resolveMethod(request), resolveTraceId(), resolveRequestId(),
                ex.getClass().getSimpleName(), ResponseCode.UN_ERROR.getCode(), truncate(ex.getMessage()), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(envelope(ResponseCode.UN_ERROR.getCode(), ResponseCode.UN_ERROR.getInfo()));
    }

    static HttpStatus statusOf(String code) {
        for (Map.Entry<ResponseCode, HttpStatus> entry : STATUS_BY_CODE.entrySet()) {
            if (entry.getKey().getCode().equals(code)) {
                return entry.getValue();
            }
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
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

    private String resolveMethod(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getMethod(), "-");
    }

    private String resolveTraceId() {
        return StringUtils.defaultIfBlank(MDC.get("traceId"), "-");
    }

    private String resolveRequestId() {
        return StringUtils.defaultIfBlank(MDC.get("requestId"), "-");
    }

    private String truncate(String text) {
        if (StringUtils.isBlank(text) || text.length() <= MAX_INFO_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_INFO_LENGTH);
    }
}
