package com.dokanclient.core.guard;

import com.dokanclient.config.DokanClientProperties;
import com.dokanclient.exception.CancelledException;
import com.dokanclient.exception.NetworkException;
import com.dokanclient.exception.RateLimitedException;
import com.dokanclient.model.RequestDescription;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 对单次 HTTP 交换增加 RateLimiter / CircuitBreaker 装饰, 按资源名缓存实例
 */
@Slf4j
public class RequestGuard {

    private final DokanClientProperties.Guard props;

    private final ConcurrentHashMap<String, CircuitBreaker> cbCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RateLimiter>    rlCache = new ConcurrentHashMap<>();

    public RequestGuard(DokanClientProperties.Guard props) {
        this.props = props == null ? new DokanClientProperties.Guard() : props;
    }

    /** 不做任何防护 */
    public static RequestGuard disabled() {
        return new RequestGuard(new DokanClientProperties.Guard());
    }

    /**
     * 统一入口
     * 组合装饰 RateLimiter → CircuitBreaker
     */
    public <T> T execute(String resource, Callable<T> exchange) throws Exception {
        if (resource == null) {
            resource = RequestDescription.DEFAULT_RESOURCE;
        }
        Callable<T> decorated = exchange;

        // CircuitBreaker fail-fast 熔断器(内层, 只统计真正发出的请求)
        DokanClientProperties.CbConfig cbCfg = pick(props.getCircuitBreaker(), props.getCbPerResource(), resource);
        if (cbCfg != null && cbCfg.isEnabled()) {
            CircuitBreaker cb = cbCache.computeIfAbsent(resource, k -> buildCb(k, cbCfg));
            decorated = CircuitBreaker.decorateCallable(cb, decorated);
        }

        // RateLimit 最外层限流，抑制突发流量
        DokanClientProperties.RlConfig rlCfg = pick(props.getRateLimiter(), props.getRlPerResource(), resource);
        if (rlCfg != null && rlCfg.isEnabled()) {
            RateLimiter rl = rlCache.computeIfAbsent(resource, k -> buildRl(k, rlCfg));
            decorated = RateLimiter.decorateCallable(rl, decorated);
        }

        try {
            return decorated.call();
        } catch (CallNotPermittedException open) {
            // 熔断打开 → 按网络失败处理, 可重试
            log.debug("[Guard] circuit open for resource={}", resource);
            throw new NetworkException(open);
        } catch (RequestNotPermitted rnp) {
            // 限流未获许可 → 可重试但延后
            log.debug("[Guard] rate limiter rejected call for resource={}", resource);
            throw new RateLimitedException(retryAfterSeconds(rlCfg), rnp);
        }
    }

    public CircuitBreaker getCircuitBreakerIfEnabled(String resource) {
        DokanClientProperties.CbConfig cbCfg = pick(props.getCircuitBreaker(), props.getCbPerResource(), resource);
        if (cbCfg == null || !cbCfg.isEnabled()) {
            return null;
        }
        return cbCache.computeIfAbsent(resource, k -> buildCb(k, cbCfg));
    }

    private static long retryAfterSeconds(DokanClientProperties.RlConfig cfg) {
        long millis = cfg.getLimitRefreshPeriod().toMillis();
        // 向上取整到秒
        return Math.max(1, (millis + 999) / 1000);
    }

    private static RateLimiter buildRl(String resource, DokanClientProperties.RlConfig r) {
        RateLimiterConfig cfg = RateLimiterConfig.custom()
                .limitForPeriod(r.getLimitForPeriod())
                .limitRefreshPeriod(r.getLimitRefreshPeriod())
                .timeoutDuration(r.getTimeoutDuration())
                .build();
        return RateLimiter.of("rl:" + resource, cfg);
    }

    private static CircuitBreaker buildCb(String resource, DokanClientProperties.CbConfig c) {
        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .failureRateThreshold(c.getFailureRateThreshold())
                .slowCallRateThreshold(c.getSlowCallRateThreshold())
                .slowCallDurationThreshold(c.getSlowCallDurationThreshold())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(c.getSlidingWindowSize())
                .minimumNumberOfCalls(c.getMinimumNumberOfCalls())
                .waitDurationInOpenState(c.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(c.getPermittedNumberOfCallsInHalfOpenState())
                .recordExceptions(Exception.class)
                // 调用方取消不算下游故障
                .ignoreExceptions(CancelledException.class)
                .build();
        return CircuitBreaker.of("cb:" + resource, cfg);
    }

    private static <C> C pick(C defaultCfg, Map<String, C> perResource, String resource) {
        if (perResource != null) {
            C cfg = perResource.get(resource);
            if (cfg != null) {
                return cfg;
            }
        }
        return defaultCfg;
    }
}
