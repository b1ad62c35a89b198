package com.offerflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 服务任务来源枚举
 *
 * @author offerflow
 * @since 2026-10-19
 */
public enum TaskSourceEnum {

    /** 模型生成 */
    AI_GENERATED("ai_generated"),

    /** 模板导入 */
    TEMPLATE("template"),

    /** 手工创建 */
    MANUAL("manual");

    private final String code;

    TaskSourceEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static TaskSourceEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TaskSourceEnum item : TaskSourceEnum.values()) {
            if (item.code.equalsIgnoreCase(code.trim())) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown task source code: " + code);
    }
}
