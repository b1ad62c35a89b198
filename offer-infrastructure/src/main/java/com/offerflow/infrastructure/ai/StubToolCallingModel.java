package com.offerflow.infrastructure.ai;

import com.offerflow.domain.ai.model.valobj.ToolCallingResult;
import com.offerflow.domain.ai.model.valobj.ToolInvocation;
import com.offerflow.domain.ai.model.valobj.ToolSpecification;
import com.offerflow.infrastructure.util.JsonCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 本地桩模型：按工具名返回类路径 {@code stub/<toolName>.json} 中的固定参数。
 * <p>
 * 用于开发与测试，结果确定。没有对应资源的工具不产生调用，只返回提示文本。
 * </p>
 */
@Slf4j
@Component
public class StubToolCallingModel {

    static final String STUB_CONTENT = "[STUB] This is a stub response. Configure an OpenAI model for real responses.";

    private static final String RESOURCE_PATTERN = "stub/%s.json";

    private final JsonCodec jsonCodec;

    public StubToolCallingModel(JsonCodec jsonCodec) {
        this.jsonCodec = jsonCodec;
    }

    public ToolCallingResult complete(List<ToolSpecification> tools) {
        List<ToolInvocation> invocations = new ArrayList<>();
        if (tools != null) {
            for (ToolSpecification tool : tools) {
                Map<String, Object> arguments = loadArguments(tool.name());
                if (arguments != null) {
                    invocations.add(new ToolInvocation(tool.name(), arguments));
                }
            }
        }
        log.info("Stub model answered. tools={}, invocations={}", tools == null ? 0 : tools.size(), invocations.size());
        return new ToolCallingResult(invocations.isEmpty() ? STUB_CONTENT : null, invocations);
    }

    private Map<String, Object> loadArguments(String toolName) {
        ClassPathResource resource = new ClassPathResource(String.format(RESOURCE_PATTERN, toolName));
        if (!resource.exists()) {
            log.debug("No stub answer for tool: {}", toolName);
            return null;
        }
        try {
            return jsonCodec.readMap(resource.getInputStream());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read stub answer for tool: " + toolName, ex);
        }
    }
}
