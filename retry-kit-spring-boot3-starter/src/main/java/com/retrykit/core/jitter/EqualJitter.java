package com.retrykit.core.jitter;

import com.retrykit.core.policy.RetryPolicy;
import com.retrykit.core.spi.JitterStrategy;
import com.retrykit.model.ctx.RetryContext;
import com.retrykit.model.enums.JitterType;

import java.util.concurrent.ThreadLocalRandom;

/**
 * d/2 + [0, d/2)
 */
public class EqualJitter implements JitterStrategy {

    @Override
    public JitterType type() {
        return JitterType.EQUAL;
    }

    @Override
    public long apply(long nominalMillis, RetryContext ctx, RetryPolicy policy) {
        if (nominalMillis <= 0) {
            return 0;
        }
        long half = nominalMillis / 2;
        // 奇数时随机区间取 d - half, 结果仍落在 [d/2, d)
        return half + ThreadLocalRandom.current().nextLong(nominalMillis - half);
    }
}
