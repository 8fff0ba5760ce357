package com.dokanclient.core.auth;

import com.dokanclient.core.spi.Authenticator;
import com.dokanclient.core.spi.TokenRefresher;
import com.dokanclient.exception.AuthenticationException;
import com.dokanclient.model.OutgoingRequest;
import com.dokanclient.model.enums.AuthType;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bearer 令牌, 支持过期判断与外部刷新
 * 读取-校验-刷新-写入 整体在锁内完成, 并发调用最多刷新一次
 */
@Slf4j
public class BearerTokenAuthenticator implements Authenticator {

    /** 距过期不足该时长即视为失效 */
    public static final Duration EXPIRY_MARGIN = Duration.ofMinutes(5);

    private final ReentrantLock lock = new ReentrantLock();

    private final TokenRefresher refresher;

    private final Clock clock;

    private String token;

    private String refreshToken;

    /** null 表示不过期 */
    private Instant expiresAt;

    public BearerTokenAuthenticator(String token) {
        this(token, null, null, null, Clock.systemUTC());
    }

    public BearerTokenAuthenticator(String token, Instant expiresAt) {
        this(token, expiresAt, null, null, Clock.systemUTC());
    }

    public BearerTokenAuthenticator(String token, Instant expiresAt, String refreshToken,
                                    TokenRefresher refresher, Clock clock) {
        this.token = token;
        this.expiresAt = expiresAt;
        this.refreshToken = refreshToken;
        this.refresher = refresher;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public void authenticate(OutgoingRequest.Builder request) {
        String current;
        lock.lock();
        try {
            if (token == null || token.isEmpty()) {
                throw new AuthenticationException("token is required for bearer auth");
            }
            if (!validLocked()) {
                // 进入安全余量即视为失效, 无法刷新时不发送
                if (refresher == null) {
                    throw new AuthenticationException("token is expired and no refresh function provided");
                }
                refreshLocked();
                if (!validLocked()) {
                    throw new AuthenticationException("token is still invalid after refresh");
                }
            }
            current = token;
        } finally {
            lock.unlock();
        }
        request.header("Authorization", "Bearer " + current);
    }

    @Override
    public boolean isValid() {
        lock.lock();
        try {
            return validLocked();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void refresh() {
        lock.lock();
        try {
            refreshLocked();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public AuthType type() {
        return AuthType.BEARER;
    }

    /** 当前令牌的过期时间, 可能为 null */
    public Instant getExpiresAt() {
        lock.lock();
        try {
            return expiresAt;
        } finally {
            lock.unlock();
        }
    }

    public void setRefreshToken(String refreshToken) {
        lock.lock();
        try {
            this.refreshToken = refreshToken;
        } finally {
            lock.unlock();
        }
    }

    private boolean validLocked() {
        if (token == null || token.isEmpty()) {
            return false;
        }
        return expiresAt == null || clock.instant().plus(EXPIRY_MARGIN).isBefore(expiresAt);
    }

    private void refreshLocked() {
        if (refresher == null) {
            throw new AuthenticationException("no refresh function provided");
        }
        if (refreshToken == null || refreshToken.isEmpty()) {
            throw new AuthenticationException("no refresh token available");
        }
        TokenRefresher.RefreshedToken fresh;
        try {
            fresh = refresher.refresh(refreshToken);
        } catch (Exception e) {
            log.warn("[Auth] bearer token refresh failed: {}", e.getMessage());
            throw new AuthenticationException("failed to refresh token: " + e.getMessage(), e);
        }
        if (fresh == null) {
            throw new AuthenticationException("token refresher returned no token");
        }
        this.token = fresh.token();
        this.expiresAt = fresh.expiresAt();
        log.info("[Auth] bearer token refreshed, expiresAt={}", expiresAt);
    }

    @Override
    public String toString() {
        return "BearerTokenAuthenticator{expiresAt=" + expiresAt + "}";
    }
}
