package com.retrykit.core.failure;

import com.retrykit.core.policy.RetryPolicy;
import com.retrykit.core.spi.ErrorClassifier;

import java.util.Set;
import java.util.function.Predicate;

/**
 * 按策略判定是否可重试
 * 1. doRetry 返回 false 直接禁止, 不再看类型过滤
 * 2. 配置了非空类型集合且异常的具体类型不在其中, 禁止
 * 3. 其余允许
 */
public class PolicyErrorClassifier implements ErrorClassifier {

    @Override
    public boolean canRetry(Throwable error, RetryPolicy policy) {
        Predicate<Throwable> predicate = policy.getRetryPredicate();
        if (predicate != null && !predicate.test(error)) {
            return false;
        }
        Set<Class<? extends Throwable>> kinds = policy.getRetryableKinds();
        // 按类型身份比较, 子类不隐式匹配
        return kinds.isEmpty() || kinds.contains(error.getClass());
    }
}
