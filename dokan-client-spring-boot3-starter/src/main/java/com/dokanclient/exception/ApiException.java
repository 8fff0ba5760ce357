package com.dokanclient.exception;

import com.dokanclient.model.enums.ErrorKind;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

/**
 * 服务端返回的结构化错误 {"code","message","data"}
 */
@Getter
public class ApiException extends DokanException {

    private final String code;

    private final String errorMessage;

    /** 可为 null */
    private final JsonNode data;

    public ApiException(String code, String errorMessage, int statusCode) {
        this(code, errorMessage, statusCode, null);
    }

    public ApiException(String code, String errorMessage, int statusCode, JsonNode data) {
        super(ErrorKind.API_ERROR, statusCode, "dokan api error: " + code + " - " + errorMessage);
        this.code = code;
        this.errorMessage = errorMessage;
        this.data = data;
    }
}
