package com.offerflow.domain.ai.adapter.gateway;

import com.offerflow.domain.ai.model.valobj.ChatTurn;
import com.offerflow.domain.ai.model.valobj.LlmProviderConfig;
import com.offerflow.domain.ai.model.valobj.ToolCallingResult;
import com.offerflow.domain.ai.model.valobj.ToolSpecification;

import java.util.List;

/**
 * 工具调用模型端口。
 * <p>
 * 实现方只负责一次同步调用并返回工具调用结果，不执行工具、不重试。
 * 任何失败以异常抛出，由调用方统一转换为上游失败。
 * </p>
 */
public interface IToolCallingModelGateway {

    /**
     * 调用模型。
     *
     * @param config 提供方配置
     * @param messages 对话消息
     * @param tools 可用工具声明
     * @return 模型应答
     */
    ToolCallingResult complete(LlmProviderConfig config, List<ChatTurn> messages, List<ToolSpecification> tools);
}
