package com.offerflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 依赖关系类型枚举
 *
 * @author offerflow
 * @since 2026-10-19
 */
public enum DependencyTypeEnum {

    /** 源阻塞目标 */
    BLOCKS("blocks"),

    /** 源依赖目标 */
    DEPENDS_ON("depends_on"),

    /** 仅关联 */
    RELATED("related");

    private final String code;

    DependencyTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static DependencyTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (DependencyTypeEnum item : DependencyTypeEnum.values()) {
            if (item.code.equalsIgnoreCase(code.trim())) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown dependency type code: " + code);
    }
}
