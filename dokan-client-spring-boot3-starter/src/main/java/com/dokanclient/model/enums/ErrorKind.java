package com.dokanclient.model.enums;

/**
 * 失败种类, 每次失败调用恰好对应一种
 */
public enum ErrorKind {
    /** 传输层失败, 总是携带 cause */
    NETWORK_FAILURE,
    UNAUTHORIZED,
    FORBIDDEN,
    NOT_FOUND,
    RATE_LIMITED,
    /** 调用方提交前校验 */
    VALIDATION,
    API_ERROR,
    UNKNOWN,
    /** 凭证缺失/无效/无法刷新 */
    AUTH_FAILURE,
    /** 本地序列化/反序列化失败 */
    SERIALIZATION,
    CANCELLED
}
