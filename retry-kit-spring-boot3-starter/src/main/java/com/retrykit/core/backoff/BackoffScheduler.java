package com.retrykit.core.backoff;

import com.retrykit.core.policy.RetryPolicy;
import com.retrykit.core.spi.BackoffPolicy;
import com.retrykit.model.enums.BackOffPolicyType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 策略注册中心：
 * - 内置 fixed / exponential
 * - 外部注册的 BackoffPolicy 按 type() 覆盖内置实现
 */
public class BackoffScheduler {

    private final Map<BackOffPolicyType, BackoffPolicy> policies = new EnumMap<>(BackOffPolicyType.class);

    public BackoffScheduler() {
        this(List.of());
    }

    public BackoffScheduler(List<BackoffPolicy> discovered) {
        policies.put(BackOffPolicyType.FIXED, new FixedBackoffPolicy());
        policies.put(BackOffPolicyType.EXPONENTIAL, new ExponentialBackoffPolicy());
        if (discovered != null) {
            discovered.forEach(p -> policies.put(p.type(), p));
        }
    }

    /**
     * 按类型解析策略
     */
    public BackoffPolicy resolve(BackOffPolicyType type) {
        return policies.get(Objects.requireNonNull(type, "type"));
    }

    /**
     * 计算第 retryIndex 次重试前的名义延迟
     */
    public long nominalDelay(int retryIndex, RetryPolicy policy) {
        return Math.max(0, resolve(policy.getBackOffPolicy()).nominalDelay(retryIndex, policy));
    }
}
