package com.dokanclient.core.executor;

import com.dokanclient.core.failure.ErrorClassifier;
import com.dokanclient.core.guard.RequestGuard;
import com.dokanclient.core.metric.ClientMetrics;
import com.dokanclient.core.query.QuerySerializer;
import com.dokanclient.core.spi.Authenticator;
import com.dokanclient.core.spi.HttpTransport;
import com.dokanclient.core.spi.PayloadSerializer;
import com.dokanclient.exception.CancelledException;
import com.dokanclient.exception.DokanException;
import com.dokanclient.exception.NetworkException;
import com.dokanclient.exception.SerializationException;
import com.dokanclient.model.OutgoingRequest;
import com.dokanclient.model.RequestDescription;
import com.dokanclient.model.ResponseEnvelope;
import com.dokanclient.model.ctx.CallContext;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;

/**
 * 执行单次 HTTP 交换: 组装请求 → 附加凭证 → 发送 → 错误分类
 * 自身不重试, 也不跨调用保存状态
 */
@Slf4j
public class RequestExecutor {

    private final HttpTransport transport;

    private final Authenticator authenticator;

    private final PayloadSerializer serializer;

    private final ErrorClassifier classifier;

    private final RequestGuard guard;

    private final ClientMetrics metrics;

    private final Duration timeout;

    private final String userAgent;

    public RequestExecutor(HttpTransport transport, Authenticator authenticator, PayloadSerializer serializer,
                           ErrorClassifier classifier, RequestGuard guard, ClientMetrics metrics,
                           Duration timeout, String userAgent) {
        this.transport = transport;
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
        this.serializer = serializer;
        this.classifier = classifier;
        this.guard = guard == null ? RequestGuard.disabled() : guard;
        this.metrics = metrics;
        this.timeout = timeout;
        this.userAgent = userAgent;
    }

    public ResponseEnvelope execute(CallContext ctx, String baseAddress, RequestDescription desc) {
        // 序列化失败在任何网络 I/O 之前抛出
        URI uri = buildUri(baseAddress, desc);
        byte[] body = desc.getBody() == null ? null : serializer.serialize(desc.getBody());

        OutgoingRequest.Builder rb = OutgoingRequest.builder(desc.getMethod(), uri)
                .timeout(timeout)
                .resource(desc.getResource())
                .body(body);
        rb.header("Accept", "application/json");
        if (body != null) {
            rb.header("Content-Type", "application/json");
        }
        if (userAgent != null && !userAgent.isEmpty()) {
            rb.header("User-Agent", userAgent);
        }
        if (desc.getHeaders() != null) {
            desc.getHeaders().forEach(rb::header);
        }
        authenticator.authenticate(rb);
        OutgoingRequest request = rb.build();

        ctx.checkActive();
        log.debug("[Executor] {} {}", request.getMethod(), request.getUri());
        long start = System.nanoTime();
        ResponseEnvelope response;
        try {
            response = guard.execute(desc.getResource(), () -> exchange(ctx, request));
        } catch (DokanException e) {
            throw e;
        } catch (Exception e) {
            throw new NetworkException(e);
        } finally {
            if (metrics != null) {
                metrics.recordExchangeNanos(System.nanoTime() - start);
            }
        }

        Optional<DokanException> err = classifier.classify(response);
        if (err.isPresent()) {
            log.debug("[Executor] {} {} -> {} {}", request.getMethod(), request.getUri(),
                    response.getStatusCode(), err.get().getKind());
            throw err.get();
        }
        return response;
    }

    private ResponseEnvelope exchange(CallContext ctx, OutgoingRequest request) {
        try {
            return ctx.await(transport.send(request));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof DokanException de) {
                throw de;
            }
            throw new NetworkException(cause);
        } catch (CancellationException e) {
            throw new CancelledException("request cancelled", e);
        }
    }

    /**
     * base 去掉末尾 "/" + "/" + path 去掉开头 "/"
     */
    static URI buildUri(String baseAddress, RequestDescription desc) {
        String base = baseAddress;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String path = desc.getPath() == null ? "" : desc.getPath();
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        String url = base + "/" + path;
        String query = QuerySerializer.encode(desc.getQuery());
        if (!query.isEmpty()) {
            url = url + (url.contains("?") ? "&" : "?") + query;
        }
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            throw new SerializationException("invalid request URL: " + url, e);
        }
    }
}
