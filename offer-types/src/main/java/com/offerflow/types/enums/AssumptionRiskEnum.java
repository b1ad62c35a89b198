package com.offerflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 假设风险等级枚举，按声明顺序由低到高。
 *
 * @author offerflow
 * @since 2026-10-19
 */
public enum AssumptionRiskEnum {

    LOW("low"),

    MEDIUM("medium"),

    HIGH("high"),

    CRITICAL("critical");

    private final String code;

    AssumptionRiskEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static AssumptionRiskEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (AssumptionRiskEnum item : AssumptionRiskEnum.values()) {
            if (item.code.equalsIgnoreCase(code.trim())) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown assumption risk code: " + code);
    }
}
