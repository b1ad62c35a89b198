package com.offerflow.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * JSON 编解码工具，用于工具参数、工具 Schema 与文本列字段的序列化。
 */
@Component
public class JsonCodec {

    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<Map<String, Object>>() {};
    private static final TypeReference<List<String>> STRING_LIST_REF = new TypeReference<List<String>>() {};

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 解析工具调用参数；空白参数视为空对象。
     *
     * @throws AppException 参数不是合法 JSON 对象
     */
    public Map<String, Object> readArguments(String json) {
        if (StringUtils.isBlank(json)) {
            return Collections.emptyMap();
        }
        try {
            Map<String, Object> value = objectMapper.readValue(json, MAP_REF);
            return value == null ? Collections.emptyMap() : value;
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UPSTREAM_FAILURE, "工具参数不是合法 JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * 读取类路径资源中的 JSON 对象。
     */
    public Map<String, Object> readMap(InputStream inputStream) {
        try (InputStream in = inputStream) {
            return objectMapper.readValue(in, MAP_REF);
        } catch (IOException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to parse json", ex);
        }
    }

    /**
     * 读取库中以 JSON 数组保存的字符串列表；空列返回 null。
     */
    public List<String> readStringList(String json) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, STRING_LIST_REF);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Stored value is not a json array", ex);
        }
    }

    /**
     * 写出为 JSON 字符串。
     */
    public String writeValue(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to write json", ex);
        }
    }
}
