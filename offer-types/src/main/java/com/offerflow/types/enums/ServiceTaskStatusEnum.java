package com.offerflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 服务任务状态枚举
 *
 * @author offerflow
 * @since 2026-10-19
 */
public enum ServiceTaskStatusEnum {

    NOT_STARTED("not_started"),

    IN_PROGRESS("in_progress"),

    BLOCKED("blocked"),

    COMPLETED("completed"),

    DEFERRED("deferred"),

    NOT_APPLICABLE("not_applicable");

    private final String code;

    ServiceTaskStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isCompleted() {
        return this == COMPLETED;
    }

    public static ServiceTaskStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ServiceTaskStatusEnum item : ServiceTaskStatusEnum.values()) {
            if (item.code.equalsIgnoreCase(code.trim())) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown service task status code: " + code);
    }
}
