package com.dokanclient.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * 单次 API 调用的描述, 每次调用新建, 不可变
 */
@Value
@Builder
public class RequestDescription {

    public static final String DEFAULT_RESOURCE = "default";

    /** HTTP 方法, GET/POST/PUT/DELETE */
    String method;

    /** 相对路径, 如 /products/42 */
    String path;

    /** 带 @QueryParam 字段的查询对象, 可为 null */
    Object query;

    /** 请求体, 可为 null */
    Object body;

    /** 额外请求头, 最后写入, 可覆盖默认头 */
    @Singular
    Map<String, String> headers;

    /** 逻辑资源名, 用于限流/熔断/指标分组 */
    @Builder.Default
    String resource = DEFAULT_RESOURCE;

    public String getResource() {
        return resource == null || resource.isEmpty() ? DEFAULT_RESOURCE : resource;
    }

    public static RequestDescriptionBuilder get(String path) {
        return builder().method("GET").path(path);
    }

    public static RequestDescriptionBuilder post(String path) {
        return builder().method("POST").path(path);
    }

    public static RequestDescriptionBuilder put(String path) {
        return builder().method("PUT").path(path);
    }

    public static RequestDescriptionBuilder delete(String path) {
        return builder().method("DELETE").path(path);
    }
}
