package com.offerflow.domain.ai.model.valobj;

import java.util.Collections;
import java.util.Map;

/**
 * 提供给模型的工具声明。
 *
 * @param name 工具名
 * @param description 工具描述
 * @param parameters 参数 JSON Schema（对象结构，由网关序列化）
 */
public record ToolSpecification(String name, String description, Map<String, Object> parameters) {

    public ToolSpecification {
        parameters = parameters == null ? Collections.emptyMap() : parameters;
    }
}
