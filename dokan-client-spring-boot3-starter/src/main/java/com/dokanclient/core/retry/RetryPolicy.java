package com.dokanclient.core.retry;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 重试参数, 不可变
 */
@Getter
@ToString
public final class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);
    public static final double DEFAULT_MULTIPLIER = 2.0;

    /** 总尝试次数(含首次), >= 1 */
    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double multiplier;

    @Builder
    private RetryPolicy(Integer maxAttempts, Duration baseDelay, Duration maxDelay, Double multiplier) {
        this.maxAttempts = maxAttempts == null ? DEFAULT_MAX_ATTEMPTS : maxAttempts;
        this.baseDelay = baseDelay == null ? DEFAULT_BASE_DELAY : baseDelay;
        this.maxDelay = maxDelay == null ? DEFAULT_MAX_DELAY : maxDelay;
        this.multiplier = multiplier == null ? DEFAULT_MULTIPLIER : multiplier;
        if (this.maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + this.maxAttempts);
        }
        if (this.baseDelay.isNegative() || this.maxDelay.isNegative()) {
            throw new IllegalArgumentException("retry delays must not be negative");
        }
        if (!(this.multiplier > 0) || Double.isInfinite(this.multiplier)) {
            throw new IllegalArgumentException("multiplier must be a positive number, got " + this.multiplier);
        }
    }

    public static RetryPolicy defaults() {
        return builder().build();
    }

    /** 只尝试一次 */
    public static RetryPolicy noRetry() {
        return builder().maxAttempts(1).build();
    }
}
