package com.dokanclient.core.failure.decider;

import com.dokanclient.core.spi.failure.FailureCaseHandler;
import com.dokanclient.core.spi.failure.FailureDecider;
import com.dokanclient.exception.DokanException;
import com.dokanclient.model.ctx.RetryAttemptContext;

/**
 * 通用判定: 4xx(429 除外)与本地错误终止, 网络/5xx/未知重试
 */
public class DokanErrorHandler implements FailureCaseHandler<DokanException> {

    @Override
    public Class<DokanException> exceptionType() {
        return DokanException.class;
    }

    @Override
    public FailureDecider.Decision execute(DokanException ex, RetryAttemptContext ctx) {
        int status = ex.getStatusCode();
        if (status >= 400 && status < 500 && status != 429) {
            return FailureDecider.Decision.fail(FailureDecider.Category.CLIENT_4XX).withCode("HTTP_" + status);
        }
        switch (ex.getKind()) {
            case AUTH_FAILURE:
                return FailureDecider.Decision.fail(FailureDecider.Category.AUTH).withCode("AUTH");
            case SERIALIZATION:
            case VALIDATION:
                return FailureDecider.Decision.fail(FailureDecider.Category.LOCAL).withCode(ex.getKind().name());
            case CANCELLED:
                return FailureDecider.Decision.fail(FailureDecider.Category.CANCELLED).withCode("CANCELLED");
            case NETWORK_FAILURE:
                return FailureDecider.Decision.retry(FailureDecider.Category.NETWORK).withCode("IO");
            case RATE_LIMITED:
                return FailureDecider.Decision.retry(FailureDecider.Category.RATE_LIMITED).withCode("RATE_LIMIT");
            default:
                break;
        }
        if (status >= 500) {
            return FailureDecider.Decision.retry(FailureDecider.Category.SERVER_5XX).withCode("HTTP_" + status);
        }
        return FailureDecider.Decision.retry(FailureDecider.Category.UNKNOWN).withCode(ex.getKind().name());
    }
}
