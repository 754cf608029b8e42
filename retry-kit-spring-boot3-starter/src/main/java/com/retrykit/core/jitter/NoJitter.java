package com.retrykit.core.jitter;

import com.retrykit.core.policy.RetryPolicy;
import com.retrykit.core.spi.JitterStrategy;
import com.retrykit.model.ctx.RetryContext;
import com.retrykit.model.enums.JitterType;

public class NoJitter implements JitterStrategy {

    @Override
    public JitterType type() {
        return JitterType.NONE;
    }

    @Override
    public long apply(long nominalMillis, RetryContext ctx, RetryPolicy policy) {
        return nominalMillis;
    }
}
