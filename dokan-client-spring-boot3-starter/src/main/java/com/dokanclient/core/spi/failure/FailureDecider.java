package com.dokanclient.core.spi.failure;

import com.dokanclient.model.ctx.RetryAttemptContext;
import lombok.Getter;

/**
 * 失败判定器 按异常类型给出决策
 */
public interface FailureDecider {

    /**
     * 根据异常做出决策
     */
    Decision decide(Throwable t, RetryAttemptContext ctx);

    @Getter
    final class Decision {
        private final Outcome outcome;
        private final Category category;
        private final String code;
        private final String message;

        private Decision(Outcome o, Category c, String code, String msg) {
            this.outcome = o; this.category = c;
            this.code = code; this.message = msg;
        }
        public static Decision of(Outcome o, Category c) { return new Decision(o, c, null, null); }
        public static Decision retry(Category c) { return of(Outcome.RETRY, c); }
        public static Decision fail(Category c) { return of(Outcome.FAIL, c); }
        public Decision withCode(String code){ return new Decision(outcome, category, code, message); }
        public Decision withMsg(String msg){ return new Decision(outcome, category, code, msg); }

        public boolean isRetry() { return outcome == Outcome.RETRY; }
    }

    enum Outcome { RETRY, FAIL }

    enum Category { NETWORK, RATE_LIMITED, SERVER_5XX, CLIENT_4XX, AUTH, LOCAL, CANCELLED, UNKNOWN }
}
