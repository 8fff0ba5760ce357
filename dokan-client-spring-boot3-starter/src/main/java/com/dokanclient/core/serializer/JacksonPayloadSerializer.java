package com.dokanclient.core.serializer;

import com.dokanclient.core.spi.PayloadSerializer;
import com.dokanclient.exception.SerializationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;

public class JacksonPayloadSerializer implements PayloadSerializer {

    private final ObjectMapper mapper;

    /** 使用推荐的默认配置构造 */
    public JacksonPayloadSerializer() {
        this(createDefaultMapper());
    }

    /** 允许外部传入自定义 ObjectMapper */
    public JacksonPayloadSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public byte[] serialize(Object payload) {
        if (payload == null) {
            return null;
        }
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new SerializationException("failed to marshal request body: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public <T> T deserialize(byte[] json, TypeReference<T> typeRef) {
        if (json == null || json.length == 0) {
            return null;
        }
        try {
            return mapper.readValue(json, typeRef);
        } catch (IOException e) {
            throw new SerializationException("failed to unmarshal response: " + e.getMessage(), e);
        }
    }

    @Override
    public <T> T deserialize(byte[] json, Class<T> type) {
        if (json == null || json.length == 0) {
            return null;
        }
        try {
            return mapper.readValue(json, type);
        } catch (IOException e) {
            throw new SerializationException("failed to unmarshal response: " + e.getMessage(), e);
        }
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    public static ObjectMapper createDefaultMapper() {
        ObjectMapper m = new ObjectMapper();
        // 日期按 ISO-8601 字符串输出, 与 WordPress REST 一致
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // 反序列化忽略未知字段，增强前后兼容
        m.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        // 空字符串 -> null
        m.enable(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT);
        // 自动发现 JSR310 等模块
        m.findAndRegisterModules();
        return m;
    }
}
