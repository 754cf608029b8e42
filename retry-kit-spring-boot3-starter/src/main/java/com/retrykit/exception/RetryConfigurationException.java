package com.retrykit.exception;

public class RetryConfigurationException extends IllegalArgumentException {

    public RetryConfigurationException(String message) {
        super(message);
    }

    public RetryConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
