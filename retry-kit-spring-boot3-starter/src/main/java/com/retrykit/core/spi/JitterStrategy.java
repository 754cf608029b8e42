package com.retrykit.core.spi;

import com.retrykit.core.policy.RetryPolicy;
import com.retrykit.model.ctx.RetryContext;
import com.retrykit.model.enums.JitterType;

/**
 * 把名义延迟换算为实际等待时长
 */
public interface JitterStrategy {

    JitterType type();

    /**
     * @param nominalMillis 调度器给出的名义延迟
     * @param ctx           本次执行的私有状态（decorrelated 读取并更新上一次实际延迟）
     * @param policy        当前策略
     * @return 实际等待毫秒
     */
    long apply(long nominalMillis, RetryContext ctx, RetryPolicy policy);
}
