package com.offerflow.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.offerflow.infrastructure.util.JsonCodec;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

public class JsonCodecTest {

    private final JsonCodec jsonCodec = new JsonCodec(new ObjectMapper());

    @Test
    public void shouldReadToolArguments() {
        Map<String, Object> arguments = jsonCodec.readArguments("{\"estimate_p50\":6,\"reasoning\":\"similar story\"}");

        Assertions.assertEquals(6, arguments.get("estimate_p50"));
        Assertions.assertEquals("similar story", arguments.get("reasoning"));
        Assertions.assertTrue(jsonCodec.readArguments("  ").isEmpty());
        Assertions.assertTrue(jsonCodec.readArguments(null).isEmpty());
    }

    @Test
    public void shouldReportMalformedArgumentsAsUpstreamFailure() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> jsonCodec.readArguments("{\"estimate_p50\": 6,"));

        Assertions.assertTrue(ex.is(ResponseCode.UPSTREAM_FAILURE));
        Assertions.assertTrue(ex.getInfo().startsWith("工具参数不是合法 JSON: "));
        Assertions.assertNotNull(ex.getCause());
    }

    @Test
    public void shouldReadStreamAndWriteValue() {
        Map<String, Object> value = jsonCodec.readMap(
                new ByteArrayInputStream("{\"phases\":[\"concept\"]}".getBytes(StandardCharsets.UTF_8)));

        Assertions.assertEquals(List.of("concept"), value.get("phases"));
        Assertions.assertEquals("{\"phases\":[\"concept\"]}", jsonCodec.writeValue(value));
        Assertions.assertNull(jsonCodec.writeValue(null));
    }

    @Test
    public void shouldReadStoredStringList() {
        String stored = jsonCodec.writeValue(List.of("variable APR", "tiered APR"));

        Assertions.assertEquals(List.of("variable APR", "tiered APR"), jsonCodec.readStringList(stored));
        Assertions.assertNull(jsonCodec.readStringList(null));
        Assertions.assertNull(jsonCodec.readStringList(""));

        AppException ex = Assertions.assertThrows(AppException.class, () -> jsonCodec.readStringList("variable APR"));
        Assertions.assertTrue(ex.is(ResponseCode.UN_ERROR));
    }
}
