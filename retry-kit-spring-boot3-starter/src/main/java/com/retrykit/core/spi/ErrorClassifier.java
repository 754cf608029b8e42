package com.retrykit.core.spi;

import com.retrykit.core.policy.RetryPolicy;

/**
 * 失败判定器, 只在非最后一次调用失败时被询问
 */
public interface ErrorClassifier {

    /**
     * @param error  本次调用抛出的异常
     * @param policy 当前策略
     * @return true=允许再次调用; false=原样抛出
     */
    boolean canRetry(Throwable error, RetryPolicy policy);
}
