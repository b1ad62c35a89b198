package com.offerflow.domain.ai.model.valobj;

import com.offerflow.types.enums.MessageRoleEnum;

/**
 * 单条模型对话消息。
 */
public record ChatTurn(MessageRoleEnum role, String content) {

    public static ChatTurn system(String content) {
        return new ChatTurn(MessageRoleEnum.SYSTEM, content);
    }

    public static ChatTurn user(String content) {
        return new ChatTurn(MessageRoleEnum.USER, content);
    }
}
