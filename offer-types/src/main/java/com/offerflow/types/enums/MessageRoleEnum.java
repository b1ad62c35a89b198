package com.offerflow.types.enums;

/**
 * 模型对话消息角色枚举。
 */
public enum MessageRoleEnum {
    SYSTEM,
    USER,
    ASSISTANT,
    TOOL
}
