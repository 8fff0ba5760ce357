package com.dokanclient.model.ctx;

import com.dokanclient.exception.CancelledException;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 调用上下文: 取消信号 + 可选截止时间
 * 截止时间由共享时间轮触发, 触发后退避等待与在途请求都会被中断
 * 带截止时间的上下文用完后应 close, 否则截止任务会留在时间轮上直到到期
 */
public final class CallContext implements AutoCloseable {

    /** 全局共享时间轮, 线程为 daemon */
    private static final HashedWheelTimer DEADLINE_TIMER = new HashedWheelTimer(
            new NamedThreadFactory("dokan-deadline-timer"), 10, TimeUnit.MILLISECONDS, 512);

    private final CompletableFuture<CancelledException> done = new CompletableFuture<>();

    private final Instant deadline;

    private final Clock clock;

    private final Timeout deadlineTimeout;

    private CallContext(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
        if (deadline == null) {
            this.deadlineTimeout = null;
            return;
        }
        long delayMillis = Duration.between(clock.instant(), deadline).toMillis();
        if (delayMillis <= 0) {
            done.complete(CancelledException.deadlineExceeded());
            this.deadlineTimeout = null;
        } else {
            this.deadlineTimeout = DEADLINE_TIMER.newTimeout(
                    t -> done.complete(CancelledException.deadlineExceeded()), delayMillis, TimeUnit.MILLISECONDS);
        }
    }

    /** 无截止时间, 仅可被显式取消 */
    public static CallContext background() {
        return new CallContext(null, Clock.systemUTC());
    }

    public static CallContext withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        Clock clock = Clock.systemUTC();
        return new CallContext(clock.instant().plus(timeout), clock);
    }

    public static CallContext withDeadline(Instant deadline) {
        return withDeadline(deadline, Clock.systemUTC());
    }

    public static CallContext withDeadline(Instant deadline, Clock clock) {
        return new CallContext(Objects.requireNonNull(deadline, "deadline"), clock);
    }

    public void cancel() {
        done.complete(CancelledException.cancelled());
        if (deadlineTimeout != null) {
            deadlineTimeout.cancel();
        }
    }

    /**
     * 调用结束后释放时间轮中的截止任务, 等同 {@link #cancel()}
     */
    @Override
    public void close() {
        cancel();
    }

    /** 截止任务仍挂在时间轮上 */
    boolean deadlinePending() {
        return deadlineTimeout != null && !deadlineTimeout.isExpired() && !deadlineTimeout.isCancelled();
    }

    public boolean isDone() {
        if (done.isDone()) {
            return true;
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            done.complete(CancelledException.deadlineExceeded());
            return true;
        }
        return false;
    }

    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * 已取消或已过截止时间时抛出 {@link CancelledException}
     */
    public void checkActive() {
        if (isDone()) {
            throw done.join();
        }
    }

    /**
     * 可中断等待, 上下文结束时立即抛出 CANCELLED
     */
    public void sleep(Duration delay) {
        checkActive();
        long waitMillis = delay.toMillis();
        boolean cutByDeadline = false;
        if (deadline != null) {
            long remain = Duration.between(clock.instant(), deadline).toMillis();
            if (remain < waitMillis) {
                waitMillis = Math.max(0, remain);
                cutByDeadline = true;
            }
        }
        try {
            throw done.get(waitMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException elapsed) {
            if (cutByDeadline) {
                done.complete(CancelledException.deadlineExceeded());
                throw done.join();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancelledException("interrupted while waiting", ie);
        } catch (ExecutionException ee) {
            throw new IllegalStateException("cancellation signal failed", ee.getCause());
        }
    }

    /**
     * 等待在途 future, 上下文先结束时取消该 future 并抛出 CANCELLED
     *
     * @throws ExecutionException future 自身失败
     */
    public <T> T await(CompletableFuture<T> future) throws ExecutionException {
        checkActive();
        try {
            CompletableFuture.anyOf(future, done).get();
        } catch (InterruptedException ie) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancelledException("interrupted while waiting for response", ie);
        } catch (ExecutionException ee) {
            // done 不会异常完成, 这里只可能是 future 失败
            throw ee;
        }
        if (!future.isDone()) {
            future.cancel(true);
            throw done.join();
        }
        try {
            return future.get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancelledException("interrupted while waiting for response", ie);
        }
    }
}
