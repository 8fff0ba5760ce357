package com.dokanclient.exception;

import com.dokanclient.model.enums.ErrorKind;
import lombok.Getter;

@Getter
public class RateLimitedException extends DokanException {

    private final long retryAfterSeconds;

    public RateLimitedException(int statusCode, long retryAfterSeconds) {
        super(ErrorKind.RATE_LIMITED, statusCode,
                "rate limit exceeded, retry after " + retryAfterSeconds + " seconds");
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public RateLimitedException(long retryAfterSeconds, Throwable cause) {
        super(ErrorKind.RATE_LIMITED, 0,
                "rate limit exceeded, retry after " + retryAfterSeconds + " seconds", cause);
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
