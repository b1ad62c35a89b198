package com.offerflow.test.support;

import com.offerflow.domain.ai.adapter.gateway.IToolCallingModelGateway;
import com.offerflow.domain.ai.model.valobj.ChatTurn;
import com.offerflow.domain.ai.model.valobj.LlmProviderConfig;
import com.offerflow.domain.ai.model.valobj.ToolCallingResult;
import com.offerflow.domain.ai.model.valobj.ToolInvocation;
import com.offerflow.domain.ai.model.valobj.ToolSpecification;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 预置回答的模型网关：按顺序返回预置的工具调用，或抛出预置异常。
 */
public class ScriptedToolCallingModelGateway implements IToolCallingModelGateway {

    private final List<ToolInvocation> invocations = new ArrayList<>();
    private RuntimeException failure;
    private List<ChatTurn> lastMessages;
    private List<ToolSpecification> lastTools;

    public ScriptedToolCallingModelGateway answer(String toolName, Map<String, Object> arguments) {
        invocations.add(new ToolInvocation(toolName, arguments));
        return this;
    }

    public ScriptedToolCallingModelGateway failWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    @Override
    public ToolCallingResult complete(LlmProviderConfig config, List<ChatTurn> messages, List<ToolSpecification> tools) {
        this.lastMessages = messages;
        this.lastTools = tools;
        if (failure != null) {
            throw failure;
        }
        return new ToolCallingResult(null, new ArrayList<>(invocations));
    }

    public List<ChatTurn> getLastMessages() {
        return lastMessages;
    }

    public List<ToolSpecification> getLastTools() {
        return lastTools;
    }
}
