package com.offerflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 优先级评分模型枚举
 *
 * @author offerflow
 * @since 2026-10-19
 */
public enum PrioritizationModelEnum {

    RICE("rice"),

    WSJF("wsjf");

    private final String code;

    PrioritizationModelEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static PrioritizationModelEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (PrioritizationModelEnum item : PrioritizationModelEnum.values()) {
            if (item.code.equalsIgnoreCase(code.trim())) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown prioritization model code: " + code);
    }
}
