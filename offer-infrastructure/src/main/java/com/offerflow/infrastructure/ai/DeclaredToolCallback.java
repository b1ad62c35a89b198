package com.offerflow.infrastructure.ai;

import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * 仅声明、不执行的工具回调。
 * <p>
 * 模型调用关闭了内部工具执行，工具调用由领域层读取参数后自行处理，
 * 因此 {@link #call(String)} 不应被触发。
 * </p>
 */
public class DeclaredToolCallback implements ToolCallback {

    private final ToolDefinition toolDefinition;

    public DeclaredToolCallback(ToolDefinition toolDefinition) {
        this.toolDefinition = toolDefinition;
    }

    @Override
    public ToolDefinition getToolDefinition() {
        return toolDefinition;
    }

    @Override
    public String call(String toolInput) {
        throw new UnsupportedOperationException("Tool is declaration only: " + toolDefinition.name());
    }
}
