package com.offerflow.domain.ai.service;

import com.offerflow.domain.ai.adapter.gateway.IToolCallingModelGateway;
import com.offerflow.domain.ai.model.valobj.ChatTurn;
import com.offerflow.domain.ai.model.valobj.LlmProviderConfig;
import com.offerflow.domain.ai.model.valobj.ToolCallingResult;
import com.offerflow.domain.ai.model.valobj.ToolInvocation;
import com.offerflow.domain.ai.model.valobj.ToolSpecification;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 工具调用领域服务：调用模型并只保留期望工具的调用参数。
 * <p>
 * 模型失败统一转换为 {@link ResponseCode#UPSTREAM_FAILURE}，不做重试。
 * </p>
 */
@Slf4j
@Service
public class ToolCallingDomainService {

    private final IToolCallingModelGateway toolCallingModelGateway;

    public ToolCallingDomainService(IToolCallingModelGateway toolCallingModelGateway) {
        this.toolCallingModelGateway = toolCallingModelGateway;
    }

    /**
     * 调用模型并提取指定工具的参数列表。
     *
     * @param config 提供方配置
     * @param messages 对话消息
     * @param tool 唯一可用工具
     * @return 该工具每次调用的参数，按模型返回顺序
     */
    public List<Map<String, Object>> invokeTool(LlmProviderConfig config,
                                                List<ChatTurn> messages,
                                                ToolSpecification tool) {
        LlmProviderConfig effective = config == null ? LlmProviderConfig.stub() : config;
        ToolCallingResult result;
        try {
            result = toolCallingModelGateway.complete(effective, messages, List.of(tool));
        } catch (AppException ex) {
            throw new AppException(ResponseCode.UPSTREAM_FAILURE,
                    "模型调用失败: " + StringUtils.defaultIfBlank(ex.getInfo(), ex.getCode()), ex);
        } catch (RuntimeException ex) {
            throw new AppException(ResponseCode.UPSTREAM_FAILURE,
                    "模型调用失败: " + StringUtils.defaultIfBlank(ex.getMessage(), ex.getClass().getSimpleName()), ex);
        }
        return selectArguments(result, tool.name());
    }

    /**
     * 过滤出指定工具名的调用参数，其它工具调用被忽略。
     */
    public List<Map<String, Object>> selectArguments(ToolCallingResult result, String toolName) {
        if (result == null || result.invocations().isEmpty()) {
            return Collections.emptyList();
        }
        List<Map<String, Object>> arguments = new ArrayList<>();
        for (ToolInvocation invocation : result.invocations()) {
            if (invocation == null || !StringUtils.equals(toolName, invocation.toolName())) {
                log.warn("Ignore unexpected tool invocation. expectedTool={}, actualTool={}",
                        toolName, invocation == null ? null : invocation.toolName());
                continue;
            }
            arguments.add(invocation.arguments());
        }
        return arguments;
    }

    public static String getString(Map<String, Object> source, String key) {
        if (source == null) {
            return null;
        }
        Object value = source.get(key);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    public static Double getDouble(Map<String, Object> source, String key) {
        Object value = source == null ? null : source.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && StringUtils.isNotBlank(text)) {
            try {
                return Double.valueOf(text.trim());
            } catch (NumberFormatException ex) {
                log.debug("Ignore non numeric tool argument. key={}, value={}", key, text);
                return null;
            }
        }
        return null;
    }

    public static Integer getInteger(Map<String, Object> source, String key) {
        Double value = getDouble(source, key);
        return value == null ? null : (int) Math.round(value);
    }

    public static Long getLong(Map<String, Object> source, String key) {
        Double value = getDouble(source, key);
        return value == null ? null : Math.round(value);
    }

    public static Boolean getBoolean(Map<String, Object> source, String key) {
        Object value = source == null ? null : source.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text && StringUtils.isNotBlank(text)) {
            return Boolean.parseBoolean(text.trim());
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> getObjectList(Map<String, Object> source, String key) {
        Object value = source == null ? null : source.get(key);
        if (!(value instanceof List<?> items)) {
            return Collections.emptyList();
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : items) {
            if (item instanceof Map<?, ?>) {
                result.add((Map<String, Object>) item);
            }
        }
        return result;
    }

    public static List<String> getStringList(Map<String, Object> source, String key) {
        Object value = source == null ? null : source.get(key);
        if (!(value instanceof List<?> items)) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        for (Object item : items) {
            if (item != null && StringUtils.isNotBlank(String.valueOf(item))) {
                result.add(String.valueOf(item).trim());
            }
        }
        return result;
    }
}
