package com.offerflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 工作项类型枚举：依赖图节点的类型标签
 *
 * @author offerflow
 * @since 2026-10-19
 */
public enum WorkItemTypeEnum {

    /** 史诗 */
    EPIC("epic"),

    /** 用户故事 */
    STORY("story"),

    /** 开发任务 */
    TASK("task");

    private final String code;

    WorkItemTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static WorkItemTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (WorkItemTypeEnum item : WorkItemTypeEnum.values()) {
            if (item.code.equalsIgnoreCase(code.trim())) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown work item type code: " + code);
    }
}
