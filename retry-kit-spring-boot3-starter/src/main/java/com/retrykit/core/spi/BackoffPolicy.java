package com.retrykit.core.spi;

import com.retrykit.core.policy.RetryPolicy;
import com.retrykit.model.enums.BackOffPolicyType;

/**
 * 回退策略（计算下一次重试前的名义延迟）
 */
public interface BackoffPolicy {

    /** 对应的策略类型 */
    BackOffPolicyType type();

    /**
     * @param retryIndex 已发生的重试次数, 第一次重试前为 0
     * @param policy     当前策略（读取 base/maxInterval/multiplier）
     * @return 名义延迟毫秒, >= 0
     */
    long nominalDelay(int retryIndex, RetryPolicy policy);
}
