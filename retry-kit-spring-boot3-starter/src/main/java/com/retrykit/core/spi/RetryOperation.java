package com.retrykit.core.spi;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 被重试的操作
 * context 作为接收者, args 按位置传入; 可以同步抛异常, 也可以返回异常完成的 stage
 */
@FunctionalInterface
public interface RetryOperation<C, T> {

    CompletionStage<T> invoke(C context, Object[] args) throws Exception;

    /** 包装同步实现 */
    static <C, T> RetryOperation<C, T> of(RetryCallable<C, T> callable) {
        return (context, args) -> CompletableFuture.completedFuture(callable.call(context, args));
    }
}
