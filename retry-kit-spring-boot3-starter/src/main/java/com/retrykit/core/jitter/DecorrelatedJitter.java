package com.retrykit.core.jitter;

import com.retrykit.core.policy.RetryPolicy;
import com.retrykit.core.spi.JitterStrategy;
import com.retrykit.model.ctx.RetryContext;
import com.retrykit.model.enums.JitterType;

import java.util.concurrent.ThreadLocalRandom;

/**
 * min(maxInterval, [base, p * 3)), p 为本次执行上一次的实际延迟, 初始为 base
 * 与调度器给出的名义延迟无关
 */
public class DecorrelatedJitter implements JitterStrategy {

    @Override
    public JitterType type() {
        return JitterType.DECORRELATED;
    }

    @Override
    public long apply(long nominalMillis, RetryContext ctx, RetryPolicy policy) {
        long base = policy.baseDelayMillis(), max = policy.maxIntervalMillis();
        long upper = saturatedTriple(ctx.getPreviousDelayMillis());

        long drawn = upper > base ? ThreadLocalRandom.current().nextLong(base, upper) : base;
        long delay = Math.min(max, drawn);
        ctx.setPreviousDelayMillis(delay);
        return delay;
    }

    private static long saturatedTriple(long p) {
        return p > Long.MAX_VALUE / 3 ? Long.MAX_VALUE : p * 3;
    }
}
