package com.dokanclient.core.spi;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * 请求/响应体序列化
 */
public interface PayloadSerializer {

    /** 将对象序列化为 JSON 字节 */
    byte[] serialize(Object payload);

    /** 反序列化 JSON 为指定泛型类型 */
    <T> T deserialize(byte[] json, TypeReference<T> typeRef);

    <T> T deserialize(byte[] json, Class<T> type);
}
