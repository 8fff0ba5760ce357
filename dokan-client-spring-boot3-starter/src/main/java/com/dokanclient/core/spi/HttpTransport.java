package com.dokanclient.core.spi;

import com.dokanclient.model.OutgoingRequest;
import com.dokanclient.model.ResponseEnvelope;

import java.util.concurrent.CompletableFuture;

/**
 * 传输层 SPI, 默认实现基于 java.net.http
 * 返回的 future 被取消时应中断在途请求; I/O 失败以异常完成
 */
public interface HttpTransport {

    CompletableFuture<ResponseEnvelope> send(OutgoingRequest request);
}
