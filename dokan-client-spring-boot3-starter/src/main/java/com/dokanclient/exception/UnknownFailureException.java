package com.dokanclient.exception;

import com.dokanclient.model.enums.ErrorKind;

/**
 * 未归类的异常, 按可重试处理
 */
public class UnknownFailureException extends DokanException {

    public UnknownFailureException(int statusCode, Throwable cause) {
        super(ErrorKind.UNKNOWN, statusCode, "unknown failure: " + cause, cause);
    }
}
