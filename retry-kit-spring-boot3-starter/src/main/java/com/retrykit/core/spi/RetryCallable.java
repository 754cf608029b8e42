package com.retrykit.core.spi;

/**
 * 同步操作
 */
@FunctionalInterface
public interface RetryCallable<C, T> {

    T call(C context, Object[] args) throws Exception;
}
