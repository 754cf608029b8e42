package com.retrykit.core.policy;

import com.retrykit.core.cancel.CancellationToken;
import com.retrykit.exception.RetryConfigurationException;
import com.retrykit.model.ExponentialOption;
import com.retrykit.model.RetryOptions;
import com.retrykit.model.enums.BackOffPolicyType;
import com.retrykit.model.enums.JitterType;
import lombok.Getter;

import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 归一化后的只读重试策略
 * 每个调用点构建一次, 在所有调用之间复用, 并发执行不会修改它
 */
@Getter
public final class RetryPolicy {

    public static final Duration DEFAULT_EXPONENTIAL_BACK_OFF = Duration.ofMillis(1000);
    public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofMillis(2000);
    public static final double DEFAULT_MULTIPLIER = 2.0;

    /** 初次调用之后的重试次数, 总调用次数上限为 maxAttempts + 1 */
    private final int maxAttempts;

    private final BackOffPolicyType backOffPolicy;

    private final Duration baseDelay;

    private final Duration maxInterval;

    private final double multiplier;

    private final boolean jitterEnabled;

    private final JitterType jitterType;

    /** 为 null 表示未配置 */
    private final Predicate<Throwable> retryPredicate;

    /** 为空表示不按类型过滤 */
    private final Set<Class<? extends Throwable>> retryableKinds;

    private final boolean reraiseOriginal;

    private final CancellationToken cancellationToken;

    private RetryPolicy(RetryOptions o) {
        if (o.getMaxAttempts() == null) {
            throw new RetryConfigurationException("maxAttempts is required");
        }
        if (o.getMaxAttempts() < 0) {
            throw new RetryConfigurationException("maxAttempts must be >= 0, got " + o.getMaxAttempts());
        }
        this.maxAttempts = o.getMaxAttempts();
        this.backOffPolicy = o.getBackOffPolicy() == null ? BackOffPolicyType.FIXED : o.getBackOffPolicy();

        // 指数退避未指定基础间隔时默认 1000ms
        Duration base = o.getBackOff();
        if ((base == null || base.isZero()) && backOffPolicy == BackOffPolicyType.EXPONENTIAL) {
            base = DEFAULT_EXPONENTIAL_BACK_OFF;
        }
        this.baseDelay = base == null ? Duration.ZERO : base;

        // 调用方参数覆盖默认值
        ExponentialOption eo = o.getExponentialOption();
        this.maxInterval = eo == null || eo.getMaxInterval() == null ? DEFAULT_MAX_INTERVAL : eo.getMaxInterval();
        this.multiplier = eo == null || eo.getMultiplier() == null ? DEFAULT_MULTIPLIER : eo.getMultiplier();

        this.jitterEnabled = Boolean.TRUE.equals(o.getUseJitter());
        if (!jitterEnabled) {
            this.jitterType = JitterType.NONE;
        } else {
            this.jitterType = o.getJitterType() == null ? JitterType.FULL : o.getJitterType();
        }

        this.retryPredicate = o.getDoRetry();
        Collection<Class<? extends Throwable>> kinds = o.getValue();
        if (kinds != null) {
            for (Class<? extends Throwable> k : kinds) {
                if (k == null) {
                    throw new RetryConfigurationException("value must not contain null error kinds");
                }
            }
        }
        this.retryableKinds = kinds == null ? Set.of() : Set.copyOf(kinds);
        this.reraiseOriginal = Boolean.TRUE.equals(o.getReraise());
        this.cancellationToken = o.getSignal();
    }

    public static RetryPolicy from(RetryOptions options) {
        return new RetryPolicy(Objects.requireNonNull(options, "options"));
    }

    /** 仅指定最大重试次数, 其余取默认 */
    public static RetryPolicy maxAttempts(int maxAttempts) {
        return from(RetryOptions.builder().maxAttempts(maxAttempts).build());
    }

    public long baseDelayMillis() { return Math.max(0, baseDelay.toMillis()); }

    public long maxIntervalMillis() { return Math.max(0, maxInterval.toMillis()); }

    public boolean isCancelled() {
        return cancellationToken != null && cancellationToken.isCancelled();
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts
                + ", backOffPolicy=" + backOffPolicy
                + ", baseDelay=" + baseDelay.toMillis() + "ms"
                + ", maxInterval=" + maxInterval.toMillis() + "ms"
                + ", multiplier=" + multiplier
                + ", jitter=" + jitterType
                + ", retryableKinds=" + retryableKinds.size()
                + ", reraise=" + reraiseOriginal + '}';
    }
}
