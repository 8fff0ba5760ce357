package com.dokanclient.core.failure;

import com.dokanclient.core.failure.decider.DokanErrorHandler;
import com.dokanclient.core.failure.decider.RateLimitedHandler;
import com.dokanclient.core.failure.decider.UnknownHandler;
import com.dokanclient.core.spi.failure.FailureCaseHandler;
import com.dokanclient.core.spi.failure.FailureDecider;

import java.util.ArrayList;
import java.util.List;

public final class FailureDeciders {

    private FailureDeciders() {
    }

    /** 内置处理器集合 */
    public static List<FailureCaseHandler<?>> defaultHandlers() {
        List<FailureCaseHandler<?>> handlers = new ArrayList<>();
        handlers.add(new DokanErrorHandler());
        handlers.add(new RateLimitedHandler());
        handlers.add(new UnknownHandler());
        return handlers;
    }

    public static FailureDecider defaultDecider() {
        return new RouterFailureDecider(defaultHandlers());
    }
}
