package com.retrykit.core.backoff;

import com.retrykit.core.policy.RetryPolicy;
import com.retrykit.core.spi.BackoffPolicy;
import com.retrykit.model.enums.BackOffPolicyType;

/**
 * 指数退避 min(base * multiplier^retryIndex, maxInterval)
 */
public class ExponentialBackoffPolicy implements BackoffPolicy {

    @Override
    public BackOffPolicyType type() {
        return BackOffPolicyType.EXPONENTIAL;
    }

    @Override
    public long nominalDelay(int retryIndex, RetryPolicy policy) {
        long base = policy.baseDelayMillis(), max = policy.maxIntervalMillis();

        // retryIndex 从 0 开始：0 -> base, 1 -> base * m, 2 -> base * m^2 ...
        double pow = Math.pow(policy.getMultiplier(), Math.max(0, retryIndex));
        double ideal = base * pow;
        if (Double.isNaN(ideal)) {
            return 0;
        }
        return (long) Math.max(0, Math.min(ideal, (double) max));
    }
}
