package com.dokanclient.model.enums;

import java.util.Locale;

/**
 * 认证方式（配置中大小写均可）
 */
public enum AuthType {
    BASIC, BEARER;

    public static AuthType from(String v) {
        String s = v.trim().toUpperCase(Locale.ROOT);
        // 兼容旧配置 jwt
        if ("JWT".equals(s)) {
            return BEARER;
        }
        return AuthType.valueOf(s);
    }
}
