package com.dokanclient.core.transport;

import com.dokanclient.core.spi.HttpTransport;
import com.dokanclient.model.OutgoingRequest;
import com.dokanclient.model.ResponseEnvelope;
import io.micrometer.core.instrument.util.NamedThreadFactory;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 基于 java.net.http 的默认传输实现
 */
public class JdkHttpTransport implements HttpTransport, AutoCloseable {

    private final HttpClient client;

    /** 自建线程池时由本实例负责关闭 */
    private final ExecutorService ownedExecutor;

    public JdkHttpTransport(Duration connectTimeout) {
        this.ownedExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("dokan-http"));
        this.client = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .executor(ownedExecutor)
                .build();
    }

    public JdkHttpTransport(HttpClient client) {
        this.client = client;
        this.ownedExecutor = null;
    }

    @Override
    public CompletableFuture<ResponseEnvelope> send(OutgoingRequest request) {
        HttpRequest.BodyPublisher publisher = request.getBody() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.getBody());
        HttpRequest.Builder b = HttpRequest.newBuilder(request.getUri())
                .method(request.getMethod(), publisher);
        if (request.getTimeout() != null) {
            b.timeout(request.getTimeout());
        }
        request.getHeaders().forEach(b::header);
        return client.sendAsync(b.build(), HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(r -> new ResponseEnvelope(r.statusCode(), r.headers().map(), r.body()));
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }
}
