package com.dokanclient.core.failure.decider;

import com.dokanclient.core.spi.failure.FailureCaseHandler;
import com.dokanclient.core.spi.failure.FailureDecider;
import com.dokanclient.model.ctx.RetryAttemptContext;

/**
 * 未知异常, 兜底重试
 */
public class UnknownHandler implements FailureCaseHandler<Throwable> {
    @Override
    public Class<Throwable> exceptionType() {
        return Throwable.class;
    }

    @Override
    public FailureDecider.Decision execute(Throwable ex, RetryAttemptContext ctx) {
        return FailureDecider.Decision.retry(FailureDecider.Category.UNKNOWN)
                .withCode("UNHANDLED");
    }
}
