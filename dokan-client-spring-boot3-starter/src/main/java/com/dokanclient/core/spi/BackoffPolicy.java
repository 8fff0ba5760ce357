package com.dokanclient.core.spi;

import com.dokanclient.core.retry.RetryPolicy;

import java.time.Duration;

/**
 * 回退策略(计算下一次重试前的等待时长)
 */
public interface BackoffPolicy {

    /** 策略唯一名称 */
    String name();

    /**
     * @param retry  第几次重试, 从 1 开始(即第二次尝试前为 1)
     * @param policy 重试参数(base/max/multiplier)
     * @return 等待时长, 不超过 policy 的 maxDelay
     */
    Duration delay(int retry, RetryPolicy policy);
}
