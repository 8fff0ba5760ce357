package com.dokanclient.exception;

import com.dokanclient.model.enums.ErrorKind;

/**
 * 认证失败: 本地凭证问题(AUTH_FAILURE) 或服务端 401/403
 */
public class AuthenticationException extends DokanException {

    public AuthenticationException(String message) {
        super(ErrorKind.AUTH_FAILURE, 0, "authentication error: " + message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(ErrorKind.AUTH_FAILURE, 0, "authentication error: " + message, cause);
    }

    public AuthenticationException(ErrorKind kind, int statusCode, String message) {
        super(kind, statusCode, "authentication error: " + message);
    }
}
