package com.dokanclient.core.guard;

import com.dokanclient.config.DokanClientProperties;
import com.dokanclient.exception.NetworkException;
import com.dokanclient.exception.RateLimitedException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestGuardTest {

    @Test
    void disabledGuardPassesThrough() throws Exception {
        RequestGuard guard = RequestGuard.disabled();
        assertThat(guard.execute("products", () -> "ok")).isEqualTo("ok");
        assertThat(guard.getCircuitBreakerIfEnabled("products")).isNull();
    }

    @Test
    void limiterRejectionBecomesRateLimited() throws Exception {
        DokanClientProperties.Guard props = new DokanClientProperties.Guard();
        DokanClientProperties.RlConfig rl = props.getRateLimiter();
        rl.setEnabled(true);
        rl.setLimitForPeriod(1);
        rl.setLimitRefreshPeriod(Duration.ofMillis(1500));
        rl.setTimeoutDuration(Duration.ZERO);
        RequestGuard guard = new RequestGuard(props);

        assertThat(guard.execute("orders", () -> 1)).isEqualTo(1);
        assertThatThrownBy(() -> guard.execute("orders", () -> 2))
                .isInstanceOf(RateLimitedException.class)
                .satisfies(e -> {
                    RateLimitedException rle = (RateLimitedException) e;
                    assertThat(rle.getRetryAfterSeconds()).isEqualTo(2);
                    assertThat(rle.getStatusCode()).isZero();
                });
    }

    @Test
    void openCircuitBecomesNetworkFailure() {
        DokanClientProperties.Guard props = new DokanClientProperties.Guard();
        DokanClientProperties.CbConfig cb = new DokanClientProperties.CbConfig();
        cb.setEnabled(true);
        props.setCbPerResource(Map.of("stores", cb));
        RequestGuard guard = new RequestGuard(props);

        CircuitBreaker breaker = guard.getCircuitBreakerIfEnabled("stores");
        assertThat(breaker).isNotNull();
        assertThat(guard.getCircuitBreakerIfEnabled("products")).isNull();
        breaker.transitionToOpenState();

        assertThatThrownBy(() -> guard.execute("stores", () -> "x"))
                .isInstanceOf(NetworkException.class)
                .hasCauseInstanceOf(CallNotPermittedException.class);
    }

    @Test
    void exchangeFailuresPropagateUnchanged() {
        DokanClientProperties.Guard props = new DokanClientProperties.Guard();
        props.getCircuitBreaker().setEnabled(true);
        RequestGuard guard = new RequestGuard(props);

        assertThatThrownBy(() -> guard.execute("products", () -> {
            throw new IOException("reset");
        })).isInstanceOf(IOException.class);
    }

    @Test
    void missingResourceNameFallsBackToDefault() throws Exception {
        DokanClientProperties.Guard props = new DokanClientProperties.Guard();
        props.getCircuitBreaker().setEnabled(true);
        props.getRateLimiter().setEnabled(true);
        RequestGuard guard = new RequestGuard(props);

        assertThat(guard.execute(null, () -> "ok")).isEqualTo("ok");
        assertThat(guard.getCircuitBreakerIfEnabled("default")).isNotNull();
    }
}
