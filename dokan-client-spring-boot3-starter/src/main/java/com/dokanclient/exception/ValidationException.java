package com.dokanclient.exception;

import com.dokanclient.model.enums.ErrorKind;
import lombok.Getter;

/**
 * 提交前的本地校验失败, 不会发起网络请求
 */
@Getter
public class ValidationException extends DokanException {

    private final String field;

    private final String code;

    private final String errorMessage;

    public ValidationException(String field, String code, String errorMessage) {
        super(ErrorKind.VALIDATION, 0, "validation error on field '" + field + "': " + errorMessage);
        this.field = field;
        this.code = code;
        this.errorMessage = errorMessage;
    }
}
