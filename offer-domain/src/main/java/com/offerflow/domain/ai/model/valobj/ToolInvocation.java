package com.offerflow.domain.ai.model.valobj;

import java.util.Collections;
import java.util.Map;

/**
 * 模型返回的一次工具调用，参数已解析为 Map。
 */
public record ToolInvocation(String toolName, Map<String, Object> arguments) {

    public ToolInvocation {
        arguments = arguments == null ? Collections.emptyMap() : arguments;
    }
}
