package com.dokanclient.core.retry;

import com.dokanclient.core.failure.FailureDeciders;
import com.dokanclient.core.metric.ClientMetrics;
import com.dokanclient.core.backoff.LinearScaledBackoffPolicy;
import com.dokanclient.exception.ApiException;
import com.dokanclient.exception.CancelledException;
import com.dokanclient.exception.DokanException;
import com.dokanclient.exception.NetworkException;
import com.dokanclient.exception.RateLimitedException;
import com.dokanclient.exception.UnknownFailureException;
import com.dokanclient.model.ctx.CallContext;
import com.dokanclient.model.enums.ErrorKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryControllerTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    private final RetryController controller = new RetryController(
            FailureDeciders.defaultDecider(), new LinearScaledBackoffPolicy(), ClientMetrics.create(registry));

    private static RetryPolicy fast(int attempts) {
        return RetryPolicy.builder()
                .maxAttempts(attempts)
                .baseDelay(Duration.ofMillis(5))
                .maxDelay(Duration.ofMillis(20))
                .multiplier(1.0)
                .build();
    }

    @Test
    void networkFailureUsesEveryAttempt() {
        AtomicInteger calls = new AtomicInteger();
        assertThatThrownBy(() -> controller.run(CallContext.background(), fast(3), () -> {
            calls.incrementAndGet();
            throw new NetworkException(new IOException("connection reset #" + calls.get()));
        }))
                .isInstanceOf(NetworkException.class)
                .hasMessageContaining("#3");
        assertThat(calls.get()).isEqualTo(3);
        assertThat(registry.get("dokan.client.retries").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("dokan.client.failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void notFoundStopsAfterOneAttempt() {
        AtomicInteger calls = new AtomicInteger();
        assertThatThrownBy(() -> controller.run(CallContext.background(), fast(3), () -> {
            calls.incrementAndGet();
            throw new ApiException("http_error", "HTTP 404 error", 404);
        })).isInstanceOf(ApiException.class);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void rateLimitedRetriesUntilExhausted() {
        AtomicInteger calls = new AtomicInteger();
        assertThatThrownBy(() -> controller.run(CallContext.background(), fast(5), () -> {
            calls.incrementAndGet();
            throw new RateLimitedException(429, 60);
        })).isInstanceOf(RateLimitedException.class);
        assertThat(calls.get()).isEqualTo(5);
    }

    @Test
    void succeedsAfterTransientFailures() {
        AtomicInteger calls = new AtomicInteger();
        String result = controller.run(CallContext.background(), fast(3), () -> {
            if (calls.incrementAndGet() < 3) {
                throw new ApiException("internal_error", "internal server error", 500);
            }
            return "ok";
        });
        assertThat(result).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(3);
        assertThat(registry.get("dokan.client.success").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("dokan.client.attempts").summary().max()).isEqualTo(3.0);
    }

    @Test
    void singleAttemptPolicyNeverRetries() {
        AtomicInteger calls = new AtomicInteger();
        assertThatThrownBy(() -> controller.run(CallContext.background(), RetryPolicy.noRetry(), () -> {
            calls.incrementAndGet();
            throw new NetworkException(new IOException("down"));
        })).isInstanceOf(NetworkException.class);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void foreignExceptionsAreWrappedAsUnknownAndRetried() {
        AtomicInteger calls = new AtomicInteger();
        assertThatThrownBy(() -> controller.run(CallContext.background(), fast(2), () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("weird");
        }))
                .isInstanceOf(UnknownFailureException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .satisfies(e -> assertThat(((DokanException) e).getKind()).isEqualTo(ErrorKind.UNKNOWN));
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void expiredDeadlineFailsBeforeFirstAttempt() {
        AtomicInteger calls = new AtomicInteger();
        CallContext ctx = CallContext.withDeadline(Instant.now().minusSeconds(1));
        long start = System.nanoTime();

        assertThatThrownBy(() -> controller.run(ctx, RetryPolicy.defaults(), () -> {
            calls.incrementAndGet();
            return "never";
        }))
                .isInstanceOf(CancelledException.class)
                .satisfies(e -> assertThat(((CancelledException) e).isDeadlineExceeded()).isTrue());

        assertThat(calls.get()).isZero();
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofMillis(500));
    }

    @Test
    void deadlineDuringBackoffCancelsWaitImmediately() {
        RetryPolicy slow = RetryPolicy.builder()
                .maxAttempts(3)
                .baseDelay(Duration.ofSeconds(10))
                .maxDelay(Duration.ofSeconds(30))
                .build();
        CallContext ctx = CallContext.withTimeout(Duration.ofMillis(200));
        AtomicInteger calls = new AtomicInteger();
        long start = System.nanoTime();

        assertThatThrownBy(() -> controller.run(ctx, slow, () -> {
            calls.incrementAndGet();
            throw new NetworkException(new IOException("down"));
        })).isInstanceOf(CancelledException.class);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    void explicitCancelDuringBackoffStopsWaiting() {
        RetryPolicy slow = RetryPolicy.builder()
                .maxAttempts(3)
                .baseDelay(Duration.ofSeconds(10))
                .maxDelay(Duration.ofSeconds(30))
                .build();
        CallContext ctx = CallContext.background();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(ctx::cancel, 100, TimeUnit.MILLISECONDS);
            long start = System.nanoTime();

            assertThatThrownBy(() -> controller.run(ctx, slow, () -> {
                throw new NetworkException(new IOException("down"));
            }))
                    .isInstanceOf(CancelledException.class)
                    .satisfies(e -> assertThat(((CancelledException) e).isDeadlineExceeded()).isFalse());

            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
        } finally {
            scheduler.shutdownNow();
        }
    }
}
