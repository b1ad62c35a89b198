package com.offerflow.domain.ai.model.valobj;

import java.util.Collections;
import java.util.List;

/**
 * 工具调用模型的应答：可选文本内容与零到多次工具调用。
 */
public record ToolCallingResult(String content, List<ToolInvocation> invocations) {

    public ToolCallingResult {
        invocations = invocations == null ? Collections.emptyList() : List.copyOf(invocations);
    }
}
