package com.dokanclient.model.ctx;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * 单次尝试失败时交给 FailureDecider 的上下文
 */
@Data
@Builder
public class RetryAttemptContext {

    private String resource;
    /** 从 1 开始 */
    private int attempt;
    private int maxAttempts;
    private Instant deadline;
    private String err;
}
