package com.dokanclient.core.failure;

import com.dokanclient.exception.ApiException;
import com.dokanclient.exception.AuthenticationException;
import com.dokanclient.exception.DokanException;
import com.dokanclient.exception.NotFoundException;
import com.dokanclient.exception.RateLimitedException;
import com.dokanclient.model.ApiErrorPayload;
import com.dokanclient.model.ResponseEnvelope;
import com.dokanclient.model.enums.ErrorKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Optional;

/**
 * 将 HTTP 状态码/响应体/响应头映射为错误
 * 结构化错误体中 code 非空时优先, 否则按状态码兜底
 */
@Slf4j
public class ErrorClassifier {

    public static final long DEFAULT_RETRY_AFTER_SECONDS = 60;

    private final ObjectMapper mapper;

    private final long defaultRetryAfterSeconds;

    /** 403 是否单独归为 FORBIDDEN */
    private final boolean distinguishForbidden;

    public ErrorClassifier(ObjectMapper mapper) {
        this(mapper, DEFAULT_RETRY_AFTER_SECONDS, false);
    }

    public ErrorClassifier(ObjectMapper mapper, long defaultRetryAfterSeconds, boolean distinguishForbidden) {
        this.mapper = mapper;
        this.defaultRetryAfterSeconds = defaultRetryAfterSeconds;
        this.distinguishForbidden = distinguishForbidden;
    }

    public Optional<DokanException> classify(ResponseEnvelope response) {
        int status = response.getStatusCode();
        if (status < 400) {
            return Optional.empty();
        }
        ApiErrorPayload payload = parsePayload(response);
        if (payload != null && payload.getCode() != null && !payload.getCode().isEmpty()) {
            return Optional.of(new ApiException(payload.getCode(), payload.getMessage(), status, payload.getData()));
        }
        return Optional.of(fallback(status, response));
    }

    private DokanException fallback(int status, ResponseEnvelope response) {
        switch (status) {
            case 401:
                return new AuthenticationException(ErrorKind.UNAUTHORIZED, 401, "unauthorized access");
            case 403:
                return new AuthenticationException(
                        distinguishForbidden ? ErrorKind.FORBIDDEN : ErrorKind.UNAUTHORIZED, 403, "forbidden access");
            case 404:
                return new NotFoundException("resource", "unknown");
            case 429:
                return new RateLimitedException(429, retryAfter(response));
            case 400:
                return new ApiException("bad_request", "bad request", 400);
            case 500:
                return new ApiException("internal_error", "internal server error", 500);
            default:
                return new ApiException("http_error", "HTTP " + status + " error", status);
        }
    }

    private long retryAfter(ResponseEnvelope response) {
        String v = response.header("Retry-After");
        if (v != null) {
            try {
                long seconds = Long.parseLong(v.trim());
                if (seconds >= 0) {
                    return seconds;
                }
            } catch (NumberFormatException e) {
                log.debug("[Classifier] non-numeric Retry-After '{}', using default {}s", v, defaultRetryAfterSeconds);
            }
        }
        return defaultRetryAfterSeconds;
    }

    private ApiErrorPayload parsePayload(ResponseEnvelope response) {
        if (!response.hasBody()) {
            return null;
        }
        try {
            return mapper.readValue(response.getBody(), ApiErrorPayload.class);
        } catch (IOException e) {
            // 非 JSON 错误体按状态码兜底
            log.debug("[Classifier] error body is not a structured payload, status={}", response.getStatusCode());
            return null;
        }
    }
}
