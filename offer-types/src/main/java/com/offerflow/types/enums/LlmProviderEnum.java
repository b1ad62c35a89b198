package com.offerflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 工具调用模型提供方枚举
 *
 * @author offerflow
 * @since 2026-10-19
 */
public enum LlmProviderEnum {

    /** 确定性桩实现，用于开发与测试 */
    STUB("stub"),

    /** Spring AI OpenAI ChatModel */
    OPENAI("openai");

    private final String code;

    LlmProviderEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static LlmProviderEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (LlmProviderEnum item : LlmProviderEnum.values()) {
            if (item.code.equalsIgnoreCase(code.trim())) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown llm provider code: " + code);
    }
}
