package com.dokanclient.client;

import com.dokanclient.core.executor.RequestExecutor;
import com.dokanclient.core.metric.ClientMetrics;
import com.dokanclient.core.retry.RetryController;
import com.dokanclient.core.retry.RetryPolicy;
import com.dokanclient.core.spi.Authenticator;
import com.dokanclient.core.spi.PayloadSerializer;
import com.dokanclient.model.RequestDescription;
import com.dokanclient.model.ResponseEnvelope;
import com.dokanclient.model.ctx.CallContext;
import com.dokanclient.resource.OrderService;
import com.dokanclient.resource.ProductService;
import com.dokanclient.resource.StoreService;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Dokan REST API 客户端入口, 线程安全
 * 每次调用: RetryController → RequestExecutor → Authenticator → HttpTransport
 */
@Slf4j
@Getter
public class DokanClient implements AutoCloseable {

    private final String baseAddress;

    private final RetryPolicy retryPolicy;

    private final Authenticator authenticator;

    private final PayloadSerializer serializer;

    private final ClientMetrics metrics;

    private final RequestExecutor executor;

    private final RetryController retryController;

    private final ProductService products;

    private final OrderService orders;

    private final StoreService stores;

    /** 由客户端创建的传输层, 关闭时一并释放 */
    @Getter(AccessLevel.NONE)
    private final AutoCloseable ownedTransport;

    DokanClient(String baseAddress, RetryPolicy retryPolicy, Authenticator authenticator,
                PayloadSerializer serializer, ClientMetrics metrics, RequestExecutor executor,
                RetryController retryController, AutoCloseable ownedTransport) {
        this.baseAddress = baseAddress;
        this.retryPolicy = retryPolicy;
        this.authenticator = authenticator;
        this.serializer = serializer;
        this.metrics = metrics;
        this.executor = executor;
        this.retryController = retryController;
        this.ownedTransport = ownedTransport;
        this.products = new ProductService(this);
        this.orders = new OrderService(this);
        this.stores = new StoreService(this);
        log.info("[Client] dokan client created, baseAddress={}, auth={}, maxAttempts={}",
                baseAddress, authenticator.type(), retryPolicy.getMaxAttempts());
    }

    public static DokanClientBuilder builder() {
        return new DokanClientBuilder();
    }

    public ProductService products() {
        return products;
    }

    public OrderService orders() {
        return orders;
    }

    public StoreService stores() {
        return stores;
    }

    /**
     * 通用调用入口, 带重试
     */
    public ResponseEnvelope execute(CallContext ctx, RequestDescription desc) {
        return retryController.run(ctx, retryPolicy, desc.getResource(),
                () -> executor.execute(ctx, baseAddress, desc));
    }

    public ResponseEnvelope execute(RequestDescription desc) {
        return execute(CallContext.background(), desc);
    }

    @Override
    public void close() throws Exception {
        if (ownedTransport != null) {
            ownedTransport.close();
        }
    }
}
