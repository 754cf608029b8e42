package com.retrykit.exception;

import lombok.Getter;

/**
 * 重试次数耗尽, 携带最后一次的原始异常
 */
@Getter
public class MaxAttemptsExceededException extends RuntimeException {

    public static final String CODE = "429";

    private final Throwable originalError;

    /** 最后一次调用的序号, 等于 maxAttempts */
    private final int retryCount;

    public MaxAttemptsExceededException(Throwable originalError, int retryCount) {
        super("Max retry reached: " + retryCount + ", original error: " + originalError.getMessage(), originalError);
        this.originalError = originalError;
        this.retryCount = retryCount;
    }

    public String getCode() {
        return CODE;
    }
}
