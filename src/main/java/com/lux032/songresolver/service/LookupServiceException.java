package com.lux032.songresolver.service;

import java.io.IOException;

/**
 * AcoustID 服务调用失败（网络错误、超时、非 200 状态码或响应 status 不为 ok）
 */
public class LookupServiceException extends IOException {

    private final boolean retryable;

    public LookupServiceException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public LookupServiceException(String message, Throwable cause) {
        super(message, cause);
        this.retryable = true;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
