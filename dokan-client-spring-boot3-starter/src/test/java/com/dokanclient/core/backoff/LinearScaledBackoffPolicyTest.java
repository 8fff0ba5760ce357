package com.dokanclient.core.backoff;

import com.dokanclient.core.retry.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class LinearScaledBackoffPolicyTest {

    private final LinearScaledBackoffPolicy backoff = new LinearScaledBackoffPolicy();

    @Test
    void delayGrowsLinearlyWithRetryNumber() {
        RetryPolicy policy = RetryPolicy.defaults();
        assertThat(backoff.delay(1, policy)).isEqualTo(Duration.ofSeconds(2));
        assertThat(backoff.delay(2, policy)).isEqualTo(Duration.ofSeconds(4));
        assertThat(backoff.delay(3, policy)).isEqualTo(Duration.ofSeconds(6));
    }

    @Test
    void delayIsCappedAtMax() {
        RetryPolicy policy = RetryPolicy.builder()
                .baseDelay(Duration.ofSeconds(1))
                .maxDelay(Duration.ofSeconds(5))
                .multiplier(2.0)
                .build();
        assertThat(backoff.delay(10, policy)).isEqualTo(Duration.ofSeconds(5));
    }
}
