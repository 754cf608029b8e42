package com.retrykit.model;

import com.retrykit.core.cancel.CancellationToken;
import com.retrykit.model.enums.BackOffPolicyType;
import com.retrykit.model.enums.JitterType;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.util.Collection;
import java.util.function.Predicate;

/**
 * 调用方传入的原始重试配置, 只读取不修改, 由 RetryPolicy.from 归一化
 */
@Data
@Builder
public class RetryOptions {

    /** 初次调用之后的最大重试次数（必填, >= 0） */
    private Integer maxAttempts;

    /** fixed | exponential, 默认 fixed */
    private BackOffPolicyType backOffPolicy;

    /** 基础间隔, 指数退避下未设置时为 1000ms */
    private Duration backOff;

    private ExponentialOption exponentialOption;

    /** 返回 false 时禁止重试 */
    private Predicate<Throwable> doRetry;

    /** 可重试的异常类型（按具体类型精确匹配） */
    private Collection<Class<? extends Throwable>> value;

    /** 耗尽时抛出原始异常而不是 MaxAttemptsExceededException */
    private Boolean reraise;

    /** 外部取消信号 */
    private CancellationToken signal;

    private Boolean useJitter;

    /** useJitter 开启且未指定时为 full */
    private JitterType jitterType;
}
