package com.dokanclient.core.retry;

import com.dokanclient.core.backoff.LinearScaledBackoffPolicy;
import com.dokanclient.core.metric.ClientMetrics;
import com.dokanclient.core.spi.BackoffPolicy;
import com.dokanclient.core.spi.failure.FailureDecider;
import com.dokanclient.exception.CancelledException;
import com.dokanclient.exception.DokanException;
import com.dokanclient.exception.UnknownFailureException;
import com.dokanclient.model.ctx.CallContext;
import com.dokanclient.model.ctx.RetryAttemptContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * 有界重试循环: 首次不等待, 之后按 BackoffPolicy 可中断等待
 * 每次失败交给 FailureDecider 判定是否继续
 */
@Slf4j
public class RetryController {

    private final FailureDecider decider;

    private final BackoffPolicy backoff;

    private final ClientMetrics metrics;

    public RetryController(FailureDecider decider) {
        this(decider, new LinearScaledBackoffPolicy(), null);
    }

    public RetryController(FailureDecider decider, BackoffPolicy backoff, ClientMetrics metrics) {
        this.decider = decider;
        this.backoff = backoff;
        this.metrics = metrics;
    }

    public <T> T run(CallContext ctx, RetryPolicy policy, Callable<T> work) {
        return run(ctx, policy, "default", work);
    }

    public <T> T run(CallContext ctx, RetryPolicy policy, String resource, Callable<T> work) {
        // 已结束的上下文不发起任何尝试
        ctx.checkActive();
        if (metrics != null) {
            metrics.incRequests();
        }
        DokanException last = null;
        int attempt = 0;
        while (attempt < policy.getMaxAttempts()) {
            if (attempt > 0) {
                Duration delay = backoff.delay(attempt, policy);
                log.debug("[Retry] resource={} waiting {}ms before attempt {}/{}",
                        resource, delay.toMillis(), attempt + 1, policy.getMaxAttempts());
                long start = System.nanoTime();
                try {
                    ctx.sleep(delay);
                } catch (CancelledException ce) {
                    fail(attempt);
                    throw ce;
                } finally {
                    if (metrics != null) {
                        metrics.recordBackoffNanos(System.nanoTime() - start);
                    }
                }
                if (metrics != null) {
                    metrics.incRetries();
                }
            }
            attempt++;
            try {
                T result = work.call();
                if (metrics != null) {
                    metrics.incSuccess();
                    metrics.recordAttempts(attempt);
                }
                return result;
            } catch (Exception e) {
                last = normalize(e);
            }

            RetryAttemptContext actx = RetryAttemptContext.builder()
                    .resource(resource)
                    .attempt(attempt)
                    .maxAttempts(policy.getMaxAttempts())
                    .deadline(ctx.getDeadline().orElse(null))
                    .err(last.getMessage())
                    .build();
            FailureDecider.Decision d = decider.decide(last, actx);
            if (!d.isRetry()) {
                log.debug("[Retry] resource={} attempt {} failed with non-retryable {} ({}), giving up",
                        resource, attempt, last.getKind(), d.getCode());
                fail(attempt);
                throw last;
            }
            log.debug("[Retry] resource={} attempt {}/{} failed, category={}, err={}",
                    resource, attempt, policy.getMaxAttempts(), d.getCategory(), last.getMessage());
        }
        log.warn("[Retry] resource={} exhausted {} attempts, last error: {}",
                resource, policy.getMaxAttempts(), last.getMessage());
        fail(attempt);
        throw last;
    }

    private void fail(int attempts) {
        if (metrics != null) {
            metrics.incFailed();
            metrics.recordAttempts(attempts);
        }
    }

    private static DokanException normalize(Exception e) {
        if (e instanceof DokanException de) {
            return de;
        }
        return new UnknownFailureException(0, e);
    }
}
