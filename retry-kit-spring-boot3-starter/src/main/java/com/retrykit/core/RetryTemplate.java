package com.retrykit.core;

import com.retrykit.core.engine.RetryEngine;
import com.retrykit.core.policy.RetryPolicy;
import com.retrykit.core.spi.RetryCallable;
import com.retrykit.core.spi.RetryOperation;
import com.retrykit.model.RetryOptions;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * 绑定一个策略的调用入口, 策略只构建一次, 所有调用共用同一个 RetryEngine
 *
 * <pre>{@code
 * RetryTemplate template = RetryTemplate.of(engine, RetryOptions.builder().maxAttempts(3).build());
 * RetryOperation<Client, String> fetch = template.wrap((client, args) -> client.fetchAsync((String) args[0]));
 * String body = fetch.invoke(client, new Object[]{"/orders"}).toCompletableFuture().join();
 * }</pre>
 */
public class RetryTemplate {

    private final RetryEngine engine;

    private final RetryPolicy policy;

    public RetryTemplate(RetryEngine engine, RetryPolicy policy) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public static RetryTemplate of(RetryEngine engine, RetryOptions options) {
        return new RetryTemplate(engine, RetryPolicy.from(options));
    }

    /**
     * 一次性包装, 策略在此构建后供返回的操作反复使用
     */
    public static <C, T> RetryOperation<C, T> withRetry(RetryEngine engine, RetryOptions options,
                                                        RetryOperation<C, T> operation) {
        return of(engine, options).wrap(operation);
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    /**
     * 包装为带重试的操作, 接收者与参数原样转发
     */
    public <C, T> RetryOperation<C, T> wrap(RetryOperation<C, T> operation) {
        Objects.requireNonNull(operation, "operation");
        return (context, args) -> engine.executeAsync(operation, context, args, policy);
    }

    /**
     * 包装同步实现
     */
    public <C, T> RetryOperation<C, T> wrapSync(RetryCallable<C, T> callable) {
        return wrap(RetryOperation.of(callable));
    }

    public <C, T> CompletableFuture<T> executeAsync(RetryOperation<C, T> operation, C context, Object... args) {
        return engine.executeAsync(operation, context, args, policy);
    }

    public <C, T> T execute(RetryOperation<C, T> operation, C context, Object... args) throws Exception {
        return engine.execute(operation, context, args, policy);
    }

    public <T> T call(Callable<T> task) throws Exception {
        return engine.call(task, policy);
    }
}
