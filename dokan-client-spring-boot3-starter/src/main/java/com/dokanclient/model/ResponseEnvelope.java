package com.dokanclient.model;

import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 一次 HTTP 交换的原始结果
 */
@Getter
public final class ResponseEnvelope {

    private final int statusCode;

    /** key 为小写头名, 保持服务端返回顺序 */
    private final Map<String, List<String>> headers;

    private final byte[] body;

    public ResponseEnvelope(int statusCode, Map<String, List<String>> headers, byte[] body) {
        this.statusCode = statusCode;
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((k, v) -> copy.computeIfAbsent(k.toLowerCase(Locale.ROOT), x -> new ArrayList<>())
                    .addAll(v));
        }
        this.headers = Collections.unmodifiableMap(copy);
        this.body = body == null ? new byte[0] : body;
    }

    public static ResponseEnvelope of(int statusCode, Map<String, List<String>> headers, String body) {
        return new ResponseEnvelope(statusCode, headers,
                body == null ? null : body.getBytes(StandardCharsets.UTF_8));
    }

    /** 首个值, 不存在返回 null */
    public String header(String name) {
        List<String> values = headers(name);
        return values.isEmpty() ? null : values.get(0);
    }

    public List<String> headers(String name) {
        return headers.getOrDefault(name.toLowerCase(Locale.ROOT), List.of());
    }

    /**
     * 整数头, 缺失或非数字时为 0
     */
    public int intHeader(String name) {
        String v = header(name);
        if (v == null) {
            return 0;
        }
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public boolean hasBody() {
        return body.length > 0;
    }
}
