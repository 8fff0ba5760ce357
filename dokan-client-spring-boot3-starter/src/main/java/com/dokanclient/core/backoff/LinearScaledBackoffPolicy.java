package com.dokanclient.core.backoff;

import com.dokanclient.core.retry.RetryPolicy;
import com.dokanclient.core.spi.BackoffPolicy;

import java.time.Duration;

/**
 * delay(n) = min(base * n * multiplier, max), 无抖动
 */
public class LinearScaledBackoffPolicy implements BackoffPolicy {

    @Override
    public String name() {
        return "linear-scaled";
    }

    @Override
    public Duration delay(int retry, RetryPolicy policy) {
        long base = policy.getBaseDelay().toMillis();
        long max = policy.getMaxDelay().toMillis();
        // retry 从 1 开始: 1 -> base * mult, 2 -> base * 2 * mult ...
        double ideal = (double) base * Math.max(1, retry) * policy.getMultiplier();
        long millis = (long) Math.min(ideal, (double) max);
        return Duration.ofMillis(Math.max(0, millis));
    }
}
