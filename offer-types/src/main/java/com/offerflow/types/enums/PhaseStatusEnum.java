package com.offerflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 生命周期阶段状态枚举
 *
 * @author offerflow
 * @since 2026-10-19
 */
public enum PhaseStatusEnum {

    /** 未开始 */
    NOT_STARTED("not_started"),

    /** 进行中 */
    IN_PROGRESS("in_progress"),

    /** 待审批 */
    PENDING_APPROVAL("pending_approval"),

    /** 已审批（终态） */
    APPROVED("approved"),

    /** 已跳过（终态） */
    SKIPPED("skipped");

    private final String code;

    PhaseStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == APPROVED || this == SKIPPED;
    }

    public static PhaseStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (PhaseStatusEnum item : PhaseStatusEnum.values()) {
            if (item.code.equalsIgnoreCase(code.trim())) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown phase status code: " + code);
    }
}
