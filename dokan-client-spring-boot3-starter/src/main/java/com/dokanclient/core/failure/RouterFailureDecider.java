package com.dokanclient.core.failure;

import com.dokanclient.core.spi.failure.FailureCaseHandler;
import com.dokanclient.core.spi.failure.FailureDecider;
import com.dokanclient.model.ctx.RetryAttemptContext;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;

public class RouterFailureDecider implements FailureDecider {

    private final List<FailureCaseHandler<?>> handlers;

    /** 未匹配时的默认决策 */
    private final Decision defaultDecision;

    public RouterFailureDecider(List<FailureCaseHandler<?>> handlers) {
        this(handlers, Decision.fail(Category.UNKNOWN).withCode("UNHANDLED"));
    }

    public RouterFailureDecider(List<FailureCaseHandler<?>> handlers, Decision defaultDecision) {
        // 去重, 保持注册顺序
        this.handlers = new ArrayList<>(new LinkedHashSet<>(handlers));
        this.defaultDecision = defaultDecision;
    }

    /**
     * 同类型匹配时选择离异常类最近的处理器
     * 只看异常本体, 不沿 cause 链下钻: 失败在进入判定前已被归一化为 DokanException
     */
    @Override
    public Decision decide(Throwable t, RetryAttemptContext ctx) {
        FailureCaseHandler<?> matched = findBestHandler(t);
        if (matched != null) {
            return safeCall(matched, t, ctx);
        }
        return defaultDecision;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Decision safeCall(FailureCaseHandler h, Throwable e, RetryAttemptContext ctx) {
        return h.execute(e, ctx);
    }

    private FailureCaseHandler<?> findBestHandler(Throwable e) {
        // 过滤 supports 再按继承层级深度排序
        return handlers.stream()
                .filter(h -> h.supports(e))
                .min(Comparator.comparingInt(h -> distance(e.getClass(), h.exceptionType())))
                .orElse(null);
    }

    private static int distance(Class<?> from, Class<?> to) {
        // 计算from向上继承到to的距离
        int d = 0;
        Class<?> c = from;
        while (c != null && !to.equals(c)) {
            c = c.getSuperclass();
            ++ d;
        }
        return (c == null) ? Integer.MAX_VALUE : d;
    }
}
