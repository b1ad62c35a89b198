package com.offerflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 决策记录状态枚举。
 *
 * @author offerflow
 * @since 2026-10-19
 */
public enum DecisionStatusEnum {

    /** 提议中 */
    PROPOSED("proposed"),

    /** 已采纳，采纳时记录决策日期 */
    ACCEPTED("accepted"),

    /** 已被新决策取代 */
    SUPERSEDED("superseded"),

    /** 已废弃 */
    DEPRECATED("deprecated");

    private final String code;

    DecisionStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static DecisionStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (DecisionStatusEnum item : DecisionStatusEnum.values()) {
            if (item.code.equalsIgnoreCase(code.trim())) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown decision status code: " + code);
    }
}
