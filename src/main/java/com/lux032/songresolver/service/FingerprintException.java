package com.lux032.songresolver.service;

import java.io.IOException;

/**
 * fpcalc 不可用、执行失败或输出无法解析
 */
public class FingerprintException extends IOException {

    public FingerprintException(String message) {
        super(message);
    }

    public FingerprintException(String message, Throwable cause) {
        super(message, cause);
    }
}
