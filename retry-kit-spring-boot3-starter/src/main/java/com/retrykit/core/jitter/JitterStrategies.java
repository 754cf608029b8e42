package com.retrykit.core.jitter;

import com.retrykit.core.spi.JitterStrategy;
import com.retrykit.model.enums.JitterType;

import java.util.EnumMap;
import java.util.Map;

/**
 * 内置抖动实现, 均为无状态单例（decorrelated 的状态放在 RetryContext 中）
 */
public final class JitterStrategies {

    private static final Map<JitterType, JitterStrategy> BUILT_IN = new EnumMap<>(JitterType.class);

    static {
        BUILT_IN.put(JitterType.NONE, new NoJitter());
        BUILT_IN.put(JitterType.FULL, new FullJitter());
        BUILT_IN.put(JitterType.EQUAL, new EqualJitter());
        BUILT_IN.put(JitterType.DECORRELATED, new DecorrelatedJitter());
    }

    private JitterStrategies() {
    }

    public static JitterStrategy of(JitterType type) {
        return type == null ? BUILT_IN.get(JitterType.NONE) : BUILT_IN.get(type);
    }
}
