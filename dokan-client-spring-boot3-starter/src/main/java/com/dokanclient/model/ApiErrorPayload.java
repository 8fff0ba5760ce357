package com.dokanclient.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * 服务端错误体 {"code","message","data"}
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiErrorPayload {
    private String code;
    private String message;
    private JsonNode data;
}
