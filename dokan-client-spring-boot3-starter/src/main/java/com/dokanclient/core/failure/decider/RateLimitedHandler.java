package com.dokanclient.core.failure.decider;

import com.dokanclient.core.spi.failure.FailureCaseHandler;
import com.dokanclient.core.spi.failure.FailureDecider;
import com.dokanclient.exception.RateLimitedException;
import com.dokanclient.model.ctx.RetryAttemptContext;

/**
 * 限流(服务端 429 或本地限流器拒绝)
 */
public class RateLimitedHandler implements FailureCaseHandler<RateLimitedException> {
    @Override
    public Class<RateLimitedException> exceptionType() {
        return RateLimitedException.class;
    }

    @Override
    public FailureDecider.Decision execute(RateLimitedException ex, RetryAttemptContext ctx) {
        return FailureDecider.Decision.retry(FailureDecider.Category.RATE_LIMITED)
                .withCode("RATE_LIMIT")
                .withMsg("retry after " + ex.getRetryAfterSeconds() + "s");
    }
}
