package com.offerflow.infrastructure.ai;

import com.offerflow.domain.ai.adapter.gateway.IToolCallingModelGateway;
import com.offerflow.domain.ai.model.valobj.ChatTurn;
import com.offerflow.domain.ai.model.valobj.LlmProviderConfig;
import com.offerflow.domain.ai.model.valobj.ToolCallingResult;
import com.offerflow.domain.ai.model.valobj.ToolInvocation;
import com.offerflow.domain.ai.model.valobj.ToolSpecification;
import com.offerflow.infrastructure.util.JsonCodec;
import com.offerflow.types.enums.LlmProviderEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 工具调用模型网关实现类。
 * <p>
 * 负责：
 * <ul>
 *   <li>STUB：委托 {@link StubToolCallingModel} 返回固定工具参数</li>
 *   <li>OPENAI：通过 Spring AI {@link ChatModel} 同步调用，关闭内部工具执行，只读取模型给出的工具调用</li>
 * </ul>
 * 不做重试，异常原样抛出。
 * </p>
 */
@Slf4j
@Component
public class ToolCallingModelGatewayImpl implements IToolCallingModelGateway {

    private final ObjectProvider<ChatModel> chatModelProvider;
    private final StubToolCallingModel stubToolCallingModel;
    private final JsonCodec jsonCodec;

    public ToolCallingModelGatewayImpl(ObjectProvider<ChatModel> chatModelProvider,
                                       StubToolCallingModel stubToolCallingModel,
                                       JsonCodec jsonCodec) {
        this.chatModelProvider = chatModelProvider;
        this.stubToolCallingModel = stubToolCallingModel;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public ToolCallingResult complete(LlmProviderConfig config, List<ChatTurn> messages, List<ToolSpecification> tools) {
        LlmProviderEnum provider = config == null ? LlmProviderEnum.STUB : config.providerOrDefault();
        if (provider == LlmProviderEnum.STUB) {
            return stubToolCallingModel.complete(tools);
        }
        return completeWithChatModel(config, messages, tools);
    }

    private ToolCallingResult completeWithChatModel(LlmProviderConfig config,
                                                    List<ChatTurn> messages,
                                                    List<ToolSpecification> tools) {
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            throw new IllegalStateException("ChatModel bean not found");
        }
        OpenAiChatOptions.Builder options = OpenAiChatOptions.builder()
                .toolCallbacks(buildToolCallbacks(tools))
                .internalToolExecutionEnabled(false);
        if (StringUtils.isNotBlank(config.model())) {
            options.model(config.model());
        }

        long startedAt = System.currentTimeMillis();
        ChatResponse response = chatModel.call(new Prompt(toMessages(messages), options.build()));
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new IllegalStateException("Empty chat response");
        }
        AssistantMessage output = response.getResult().getOutput();

        List<ToolInvocation> invocations = new ArrayList<>();
        if (output.hasToolCalls()) {
            for (AssistantMessage.ToolCall toolCall : output.getToolCalls()) {
                invocations.add(new ToolInvocation(toolCall.name(), jsonCodec.readArguments(toolCall.arguments())));
            }
        }
        log.info("Chat model answered. model={}, toolCalls={}, costMs={}",
                config.model(), invocations.size(), System.currentTimeMillis() - startedAt);
        return new ToolCallingResult(output.getText(), invocations);
    }

    private List<ToolCallback> buildToolCallbacks(List<ToolSpecification> tools) {
        if (tools == null || tools.isEmpty()) {
            return Collections.emptyList();
        }
        List<ToolCallback> callbacks = new ArrayList<>();
        for (ToolSpecification tool : tools) {
            ToolDefinition definition = ToolDefinition.builder()
                    .name(tool.name())
                    .description(StringUtils.defaultIfBlank(tool.description(), tool.name()))
                    .inputSchema(jsonCodec.writeValue(tool.parameters()))
                    .build();
            callbacks.add(new DeclaredToolCallback(definition));
        }
        return callbacks;
    }

    private List<Message> toMessages(List<ChatTurn> turns) {
        List<Message> messages = new ArrayList<>();
        if (turns == null) {
            return messages;
        }
        for (ChatTurn turn : turns) {
            String content = StringUtils.defaultString(turn.content());
            switch (turn.role()) {
                case SYSTEM -> messages.add(new SystemMessage(content));
                case ASSISTANT -> messages.add(new AssistantMessage(content));
                case USER, TOOL -> messages.add(new UserMessage(content));
            }
        }
        return messages;
    }
}
