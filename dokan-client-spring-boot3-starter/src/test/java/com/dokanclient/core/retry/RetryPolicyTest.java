package com.dokanclient.core.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void defaults() {
        RetryPolicy p = RetryPolicy.defaults();
        assertThat(p.getMaxAttempts()).isEqualTo(3);
        assertThat(p.getBaseDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(p.getMaxDelay()).isEqualTo(Duration.ofSeconds(30));
        assertThat(p.getMultiplier()).isEqualTo(2.0);
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> RetryPolicy.builder().maxAttempts(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.builder().baseDelay(Duration.ofMillis(-1)).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.builder().multiplier(0.0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.builder().multiplier(Double.NaN).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
