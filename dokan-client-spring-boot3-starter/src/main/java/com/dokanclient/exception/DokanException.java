package com.dokanclient.exception;

import com.dokanclient.model.enums.ErrorKind;
import lombok.Getter;

/**
 * 所有客户端失败的基类, 调用方按 {@link #getKind()} 分支处理
 */
@Getter
public abstract class DokanException extends RuntimeException {

    private final ErrorKind kind;

    /** HTTP 状态码, 非服务端返回的失败为 0 */
    private final int statusCode;

    protected DokanException(ErrorKind kind, int statusCode, String message) {
        super(message);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    protected DokanException(ErrorKind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    /** 状态码是否落在 4xx 区间 */
    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }
}
