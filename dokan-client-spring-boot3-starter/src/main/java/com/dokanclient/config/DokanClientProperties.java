package com.dokanclient.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Dokan 客户端配置（绑定前缀：dokan.client）
 *
 * YAML 示例：
 * dokan:
 *   client:
 *     base-address: https://shop.example.com/wp-json/dokan/v1
 *     timeout: 30s
 *     connect-timeout: 10s
 *     user-agent: dokan-java-client/1.0.0
 *     auth:
 *       type: basic
 *       username: admin
 *       password: secret
 *     retry:
 *       max-attempts: 3
 *       base-delay: 1s
 *       max-delay: 30s
 *       multiplier: 2.0
 *     errors:
 *       default-retry-after: 60
 *       distinguish-forbidden: false
 *     guard:
 *       rate-limiter:
 *         enabled: true
 *         limit-for-period: 20
 *         limit-refresh-period: 1s
 *         timeout-duration: 100ms
 *       circuit-breaker:
 *         enabled: true
 *         failure-rate-threshold: 50
 *       cb-per-resource:
 *         orders: { failure-rate-threshold: 30, wait-duration-in-open-state: 5s }
 */
@Data
@ConfigurationProperties(prefix = "dokan.client")
public class DokanClientProperties {

    /** API 根地址, 必填 */
    private String baseAddress;

    /** 单次 HTTP 交换超时 */
    private Duration timeout = Duration.ofSeconds(30);

    private Duration connectTimeout = Duration.ofSeconds(10);

    private String userAgent = "dokan-java-client/1.0.0";

    private Auth auth = new Auth();

    private Retry retry = new Retry();

    private Errors errors = new Errors();

    private Guard guard = new Guard();

    @Data
    public static class Auth {
        /** basic | bearer, 未配置时不附加凭证 */
        private String type;
        private String username;
        private String password;
        private String token;
        /** 令牌过期时间(ISO-8601), 可空 */
        private Instant expiresAt;
        private String refreshToken;
    }

    @Data
    public static class Retry {
        /** 总尝试次数(含首次) */
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;
    }

    @Data
    public static class Errors {
        /** 429 无 Retry-After 头时的默认秒数 */
        private long defaultRetryAfter = 60;
        /** 403 是否归为 FORBIDDEN(默认归为 UNAUTHORIZED) */
        private boolean distinguishForbidden = false;
    }

    /**
     * 可选的 Resilience4j 防护, 默认全部关闭
     */
    @Data
    public static class Guard {
        private CbConfig circuitBreaker = new CbConfig();
        private RlConfig rateLimiter = new RlConfig();

        /** 按资源名(products/orders/stores)覆盖 */
        private Map<String, CbConfig> cbPerResource;
        private Map<String, RlConfig> rlPerResource;
    }

    @Data
    public static class CbConfig {
        private boolean enabled = false;
        private float failureRateThreshold = 50f;
        private float slowCallRateThreshold = 100f;
        private Duration slowCallDurationThreshold = Duration.ofSeconds(10);
        private int slidingWindowSize = 100;
        private int minimumNumberOfCalls = 20;
        private Duration waitDurationInOpenState = Duration.ofSeconds(10);
        private int permittedNumberOfCallsInHalfOpenState = 10;
    }

    @Data
    public static class RlConfig {
        private boolean enabled = false;
        // 每个窗口许可数
        private int limitForPeriod = 50;
        private Duration limitRefreshPeriod = Duration.ofSeconds(1);
        // 获取许可最大等待
        private Duration timeoutDuration = Duration.ofMillis(100);
    }
}
