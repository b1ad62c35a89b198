package com.offerflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 假设验证状态枚举。
 *
 * @author offerflow
 * @since 2026-10-19
 */
public enum AssumptionStatusEnum {

    UNVALIDATED("unvalidated"),

    VALIDATING("validating"),

    VALIDATED("validated"),

    INVALIDATED("invalidated");

    private final String code;

    AssumptionStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 已得出验证结论（成立或不成立）
     */
    public boolean isConcluded() {
        return this == VALIDATED || this == INVALIDATED;
    }

    public static AssumptionStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (AssumptionStatusEnum item : AssumptionStatusEnum.values()) {
            if (item.code.equalsIgnoreCase(code.trim())) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown assumption status code: " + code);
    }
}
