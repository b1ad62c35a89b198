package com.offerflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 依赖关系状态枚举。RESOLVED 的依赖不参与关键路径计算。
 *
 * @author offerflow
 * @since 2026-10-19
 */
public enum DependencyStatusEnum {

    /** 待处理 */
    PENDING("pending"),

    /** 处理中 */
    IN_PROGRESS("in_progress"),

    /** 已解除 */
    RESOLVED("resolved"),

    /** 受阻 */
    BLOCKED("blocked");

    private final String code;

    DependencyStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static DependencyStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (DependencyStatusEnum item : DependencyStatusEnum.values()) {
            if (item.code.equalsIgnoreCase(code.trim())) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown dependency status code: " + code);
    }
}
