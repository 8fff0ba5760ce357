package com.dokanclient.model;

import lombok.Getter;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 已组装完成、交给传输层发送的请求
 */
@Getter
public final class OutgoingRequest {

    private final String method;
    private final URI uri;
    private final Map<String, String> headers;
    /** 无请求体时为 null */
    private final byte[] body;
    private final Duration timeout;
    private final String resource;

    private OutgoingRequest(Builder b) {
        this.method = b.method;
        this.uri = b.uri;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.body = b.body;
        this.timeout = b.timeout;
        this.resource = b.resource;
    }

    public static Builder builder(String method, URI uri) {
        return new Builder(method, uri);
    }

    public String header(String name) {
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) {
                return e.getValue();
            }
        }
        return null;
    }

    public static final class Builder {
        private final String method;
        private final URI uri;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body;
        private Duration timeout;
        private String resource = "default";

        private Builder(String method, URI uri) {
            this.method = Objects.requireNonNull(method, "method");
            this.uri = Objects.requireNonNull(uri, "uri");
        }

        /** 同名头(忽略大小写)会被覆盖 */
        public Builder header(String name, String value) {
            headers.keySet().removeIf(k -> k.equalsIgnoreCase(name));
            headers.put(name, value);
            return this;
        }

        public String header(String name) {
            for (Map.Entry<String, String> e : headers.entrySet()) {
                if (e.getKey().equalsIgnoreCase(name)) {
                    return e.getValue();
                }
            }
            return null;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder resource(String resource) {
            this.resource = resource;
            return this;
        }

        public OutgoingRequest build() {
            return new OutgoingRequest(this);
        }
    }
}
