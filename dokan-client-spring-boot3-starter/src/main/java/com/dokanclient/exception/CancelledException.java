package com.dokanclient.exception;

import com.dokanclient.model.enums.ErrorKind;
import lombok.Getter;

/**
 * 调用被取消或超过截止时间
 */
@Getter
public class CancelledException extends DokanException {

    private final boolean deadlineExceeded;

    public CancelledException(String message, boolean deadlineExceeded) {
        super(ErrorKind.CANCELLED, 0, message);
        this.deadlineExceeded = deadlineExceeded;
    }

    public CancelledException(String message, Throwable cause) {
        super(ErrorKind.CANCELLED, 0, message, cause);
        this.deadlineExceeded = false;
    }

    public static CancelledException deadlineExceeded() {
        return new CancelledException("context deadline exceeded", true);
    }

    public static CancelledException cancelled() {
        return new CancelledException("context canceled", false);
    }
}
