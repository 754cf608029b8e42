package com.retrykit.core.backoff;

import com.retrykit.core.policy.RetryPolicy;
import com.retrykit.core.spi.BackoffPolicy;
import com.retrykit.model.enums.BackOffPolicyType;

/**
 * 固定间隔策略
 */
public class FixedBackoffPolicy implements BackoffPolicy {

    @Override
    public BackOffPolicyType type() {
        return BackOffPolicyType.FIXED;
    }

    @Override
    public long nominalDelay(int retryIndex, RetryPolicy policy) {
        return policy.baseDelayMillis();
    }
}
