package com.retrykit.exception;

/**
 * 取消信号在调用前或退避等待中被观察到
 */
public class RetryAbortedException extends RuntimeException {

    public static final String CODE = "ABORT_ERR";

    public static final String RETRY_ABORTED = "Retry operation aborted";

    public RetryAbortedException() {
        this("The operation was aborted");
    }

    public RetryAbortedException(String message) {
        super(message);
    }

    public String getCode() {
        return CODE;
    }
}
