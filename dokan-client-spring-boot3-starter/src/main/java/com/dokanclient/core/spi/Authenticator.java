package com.dokanclient.core.spi;

import com.dokanclient.model.OutgoingRequest;
import com.dokanclient.model.enums.AuthType;

/**
 * 请求凭证 SPI, 内置 Basic 与 Bearer 两种实现
 */
public interface Authenticator {

    /**
     * 向请求写入凭证, 失败抛出 AUTH_FAILURE
     */
    void authenticate(OutgoingRequest.Builder request);

    /** 当前凭证是否可用 */
    boolean isValid();

    /** 刷新凭证, 不支持刷新的实现为空操作 */
    void refresh();

    AuthType type();
}
