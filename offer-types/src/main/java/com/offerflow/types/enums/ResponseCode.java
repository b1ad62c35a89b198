package com.offerflow.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 0xxx 为通用码，1xxx 为规划与生命周期业务码。
 * </p>
 *
 * @author offerflow
 * @since 2026-10-19
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 资源不存在 */
    NOT_FOUND("1001", "资源不存在"),

    /** 当前状态不允许该操作 */
    INVALID_TRANSITION("1002", "状态流转非法"),

    /** 前序阶段未审批 */
    SEQUENCE_VIOLATION("1003", "前序阶段尚未审批"),

    /** 依赖边重复 */
    DUPLICATE_EDGE("1004", "依赖关系已存在"),

    /** 依赖边自引用 */
    SELF_REFERENCE("1005", "依赖关系不能指向自身"),

    /** 端点不属于同一项目 */
    PROJECT_MISMATCH("1006", "工作项不属于该项目"),

    /** 资源已存在 */
    ALREADY_EXISTS("1007", "资源已存在"),

    /** 模型调用失败 */
    UPSTREAM_FAILURE("1008", "模型调用失败"),

    /** 并发修改冲突 */
    CONCURRENT_MODIFICATION("1009", "数据已被并发修改");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
