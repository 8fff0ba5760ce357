package com.dokanclient.client;

import com.dokanclient.config.DokanClientProperties;
import com.dokanclient.core.auth.BasicAuthenticator;
import com.dokanclient.core.auth.BearerTokenAuthenticator;
import com.dokanclient.core.backoff.LinearScaledBackoffPolicy;
import com.dokanclient.core.executor.RequestExecutor;
import com.dokanclient.core.failure.ErrorClassifier;
import com.dokanclient.core.failure.FailureDeciders;
import com.dokanclient.core.guard.RequestGuard;
import com.dokanclient.core.metric.ClientMeterRegistryProvider;
import com.dokanclient.core.metric.ClientMetrics;
import com.dokanclient.core.retry.RetryController;
import com.dokanclient.core.retry.RetryPolicy;
import com.dokanclient.core.serializer.JacksonPayloadSerializer;
import com.dokanclient.core.spi.Authenticator;
import com.dokanclient.core.spi.BackoffPolicy;
import com.dokanclient.core.spi.HttpTransport;
import com.dokanclient.core.spi.TokenRefresher;
import com.dokanclient.core.spi.failure.FailureDecider;
import com.dokanclient.core.transport.JdkHttpTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * DokanClient 构造器, 配置非法时抛出 IllegalArgumentException
 */
public class DokanClientBuilder {

    public static final String DEFAULT_USER_AGENT = "dokan-java-client/1.0.0";

    private String baseAddress;
    private Duration timeout = Duration.ofSeconds(30);
    private Duration connectTimeout = Duration.ofSeconds(10);
    private String userAgent = DEFAULT_USER_AGENT;
    private int retryCount = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
    private Duration baseDelay = RetryPolicy.DEFAULT_BASE_DELAY;
    private Duration maxDelay = RetryPolicy.DEFAULT_MAX_DELAY;
    private double multiplier = RetryPolicy.DEFAULT_MULTIPLIER;
    private long defaultRetryAfterSeconds = ErrorClassifier.DEFAULT_RETRY_AFTER_SECONDS;
    private boolean distinguishForbidden;
    private Authenticator authenticator;
    private HttpTransport transport;
    private ObjectMapper objectMapper;
    private MeterRegistry meterRegistry;
    private DokanClientProperties.Guard guard;
    private BackoffPolicy backoffPolicy;
    private FailureDecider failureDecider;

    DokanClientBuilder() {
    }

    public DokanClientBuilder baseAddress(String baseAddress) {
        this.baseAddress = baseAddress;
        return this;
    }

    /** 单次 HTTP 交换超时 */
    public DokanClientBuilder timeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    public DokanClientBuilder connectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        return this;
    }

    public DokanClientBuilder userAgent(String userAgent) {
        this.userAgent = userAgent;
        return this;
    }

    /** 总尝试次数(含首次) */
    public DokanClientBuilder retryCount(int retryCount) {
        this.retryCount = retryCount;
        return this;
    }

    public DokanClientBuilder baseDelay(Duration baseDelay) {
        this.baseDelay = baseDelay;
        return this;
    }

    public DokanClientBuilder maxDelay(Duration maxDelay) {
        this.maxDelay = maxDelay;
        return this;
    }

    public DokanClientBuilder multiplier(double multiplier) {
        this.multiplier = multiplier;
        return this;
    }

    public DokanClientBuilder basicAuth(String username, String password) {
        this.authenticator = new BasicAuthenticator(username, password);
        return this;
    }

    public DokanClientBuilder bearerAuth(String token) {
        this.authenticator = new BearerTokenAuthenticator(token);
        return this;
    }

    public DokanClientBuilder bearerAuth(String token, Instant expiresAt) {
        this.authenticator = new BearerTokenAuthenticator(token, expiresAt);
        return this;
    }

    public DokanClientBuilder bearerAuth(String token, Instant expiresAt, String refreshToken,
                                         TokenRefresher refresher) {
        this.authenticator = new BearerTokenAuthenticator(token, expiresAt, refreshToken, refresher, Clock.systemUTC());
        return this;
    }

    public DokanClientBuilder authenticator(Authenticator authenticator) {
        this.authenticator = authenticator;
        return this;
    }

    /** 自定义传输层, 由调用方负责关闭 */
    public DokanClientBuilder transport(HttpTransport transport) {
        this.transport = transport;
        return this;
    }

    public DokanClientBuilder objectMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        return this;
    }

    public DokanClientBuilder meterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        return this;
    }

    public DokanClientBuilder guard(DokanClientProperties.Guard guard) {
        this.guard = guard;
        return this;
    }

    public DokanClientBuilder backoffPolicy(BackoffPolicy backoffPolicy) {
        this.backoffPolicy = backoffPolicy;
        return this;
    }

    public DokanClientBuilder failureDecider(FailureDecider failureDecider) {
        this.failureDecider = failureDecider;
        return this;
    }

    public DokanClientBuilder defaultRetryAfter(long seconds) {
        this.defaultRetryAfterSeconds = seconds;
        return this;
    }

    public DokanClientBuilder distinguishForbidden(boolean distinguishForbidden) {
        this.distinguishForbidden = distinguishForbidden;
        return this;
    }

    public DokanClient build() {
        validate();
        RetryPolicy policy = RetryPolicy.builder()
                .maxAttempts(retryCount)
                .baseDelay(baseDelay)
                .maxDelay(maxDelay)
                .multiplier(multiplier)
                .build();

        ObjectMapper mapper = objectMapper != null ? objectMapper : JacksonPayloadSerializer.createDefaultMapper();
        JacksonPayloadSerializer serializer = new JacksonPayloadSerializer(mapper);
        ErrorClassifier classifier = new ErrorClassifier(mapper, defaultRetryAfterSeconds, distinguishForbidden);

        ClientMetrics metrics = ClientMetrics.create(meterRegistry != null
                ? meterRegistry : new ClientMeterRegistryProvider(List.of()).getRegistry());

        HttpTransport effective = transport;
        AutoCloseable owned = null;
        if (effective == null) {
            JdkHttpTransport jdk = new JdkHttpTransport(connectTimeout);
            effective = jdk;
            owned = jdk;
        }

        RequestExecutor executor = new RequestExecutor(effective, authenticator, serializer, classifier,
                new RequestGuard(guard), metrics, timeout, userAgent);
        RetryController controller = new RetryController(
                failureDecider != null ? failureDecider : FailureDeciders.defaultDecider(),
                backoffPolicy != null ? backoffPolicy : new LinearScaledBackoffPolicy(),
                metrics);
        return new DokanClient(trimmedBase(), policy, authenticator, serializer, metrics, executor, controller, owned);
    }

    private void validate() {
        if (baseAddress == null || baseAddress.isBlank()) {
            throw new IllegalArgumentException("base URL is required");
        }
        URI uri;
        try {
            uri = URI.create(baseAddress.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid base URL: " + baseAddress, e);
        }
        if (uri.getScheme() == null || uri.getHost() == null
                || !("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()))) {
            throw new IllegalArgumentException("base URL must be an absolute http(s) URL: " + baseAddress);
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connect timeout must be positive");
        }
        if (retryCount < 1) {
            throw new IllegalArgumentException("retry count must be >= 1, got " + retryCount);
        }
        if (defaultRetryAfterSeconds < 0) {
            throw new IllegalArgumentException("default retry-after must not be negative");
        }
        if (authenticator == null) {
            throw new IllegalArgumentException("authentication is required");
        }
    }

    private String trimmedBase() {
        String base = baseAddress.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }
}
