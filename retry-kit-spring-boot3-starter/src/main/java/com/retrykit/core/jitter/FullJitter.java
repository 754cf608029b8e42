package com.retrykit.core.jitter;

import com.retrykit.core.policy.RetryPolicy;
import com.retrykit.core.spi.JitterStrategy;
import com.retrykit.model.ctx.RetryContext;
import com.retrykit.model.enums.JitterType;

import java.util.concurrent.ThreadLocalRandom;

/**
 * [0, d)
 */
public class FullJitter implements JitterStrategy {

    @Override
    public JitterType type() {
        return JitterType.FULL;
    }

    @Override
    public long apply(long nominalMillis, RetryContext ctx, RetryPolicy policy) {
        if (nominalMillis <= 0) {
            return 0;
        }
        return ThreadLocalRandom.current().nextLong(nominalMillis);
    }
}
