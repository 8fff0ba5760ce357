package com.dokanclient.core.spi;

import java.time.Instant;

/**
 * 外部令牌刷新函数
 */
@FunctionalInterface
public interface TokenRefresher {

    /**
     * @param refreshToken 当前刷新令牌
     * @return 新令牌及过期时间(可为 null 表示不过期)
     */
    RefreshedToken refresh(String refreshToken) throws Exception;

    record RefreshedToken(String token, Instant expiresAt) {
    }
}
