package com.dokanclient.model.ctx;

import com.dokanclient.exception.CancelledException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CallContextTest {

    @Test
    void backgroundIsActiveUntilCancelled() {
        CallContext ctx = CallContext.background();
        assertThat(ctx.isDone()).isFalse();
        assertThat(ctx.getDeadline()).isEmpty();

        ctx.cancel();

        assertThat(ctx.isDone()).isTrue();
        assertThatThrownBy(ctx::checkActive)
                .isInstanceOf(CancelledException.class)
                .hasMessage("context canceled");
    }

    @Test
    void pastDeadlineIsDoneImmediately() {
        CallContext ctx = CallContext.withDeadline(Instant.now().minusMillis(1));
        assertThat(ctx.isDone()).isTrue();
        assertThatThrownBy(ctx::checkActive).hasMessage("context deadline exceeded");
    }

    @Test
    void sleepCompletesNormallyWithoutCancellation() {
        CallContext ctx = CallContext.background();
        long start = System.nanoTime();
        ctx.sleep(Duration.ofMillis(30));
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(25));
    }

    @Test
    void sleepIsCutShortByDeadline() {
        CallContext ctx = CallContext.withTimeout(Duration.ofMillis(50));
        long start = System.nanoTime();
        assertThatThrownBy(() -> ctx.sleep(Duration.ofSeconds(10)))
                .isInstanceOf(CancelledException.class);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    void awaitReturnsFutureResult() throws Exception {
        CallContext ctx = CallContext.background();
        assertThat(ctx.await(CompletableFuture.completedFuture("v"))).isEqualTo("v");
    }

    @Test
    void awaitSurfacesFutureFailure() {
        CallContext ctx = CallContext.background();
        assertThatThrownBy(() -> ctx.await(CompletableFuture.failedFuture(new IOException("boom"))))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void deadlineCancelsInFlightFuture() {
        CallContext ctx = CallContext.withTimeout(Duration.ofMillis(50));
        CompletableFuture<String> never = new CompletableFuture<>();

        assertThatThrownBy(() -> ctx.await(never))
                .isInstanceOf(CancelledException.class)
                .satisfies(e -> assertThat(((CancelledException) e).isDeadlineExceeded()).isTrue());
        assertThat(never.isCancelled()).isTrue();
    }

    @Test
    void closeReleasesPendingDeadline() {
        CallContext ctx = CallContext.withTimeout(Duration.ofHours(1));
        assertThat(ctx.deadlinePending()).isTrue();

        try (ctx) {
            assertThat(ctx.isDone()).isFalse();
        }

        assertThat(ctx.deadlinePending()).isFalse();
        assertThat(ctx.isDone()).isTrue();
    }
}
