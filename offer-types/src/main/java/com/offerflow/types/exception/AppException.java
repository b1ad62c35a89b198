package com.offerflow.types.exception;

import com.offerflow.types.enums.ResponseCode;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用业务异常。
 * <p>
 * 领域服务与应用服务通过它抛出带响应码的失败，HTTP 边界统一转换为 {@code Response{code, info}}。
 * </p>
 *
 * @author offerflow
 * @since 2026-10-19
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 5317680961212299217L;

    /** 异常码 */
    private String code;

    /** 异常信息 */
    private String info;

    /**
     * 使用响应码默认描述创建异常。
     *
     * @param responseCode 响应码
     */
    public AppException(ResponseCode responseCode) {
        this(responseCode.getCode(), responseCode.getInfo());
    }

    /**
     * 使用响应码和自定义描述创建异常。
     *
     * @param responseCode 响应码
     * @param message 异常描述信息
     */
    public AppException(ResponseCode responseCode, String message) {
        this(responseCode.getCode(), message);
    }

    /**
     * 使用响应码、描述和原因创建异常。
     *
     * @param responseCode 响应码
     * @param message 异常描述信息
     * @param cause 异常原因
     */
    public AppException(ResponseCode responseCode, String message, Throwable cause) {
        this(responseCode.getCode(), message, cause);
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

    /**
     * 判断异常是否对应给定响应码。
     */
    public boolean is(ResponseCode responseCode) {
        return responseCode != null && responseCode.getCode().equals(code);
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    @Override
    public String toString() {
        return "AppException{code='" + code + "', info='" + info + "'}";
    }

}
