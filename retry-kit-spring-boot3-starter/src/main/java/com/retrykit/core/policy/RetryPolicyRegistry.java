package com.retrykit.core.policy;

import com.retrykit.config.RetryKitProperties;
import com.retrykit.exception.RetryConfigurationException;
import com.retrykit.model.ExponentialOption;
import com.retrykit.model.RetryOptions;
import com.retrykit.model.enums.BackOffPolicyType;
import com.retrykit.model.enums.JitterType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 命名策略注册中心：
 * - 启动时从 retry.policies.* 构建, 每个名字只构建一次
 * - 支持编程式注册/覆盖
 * - 线程安全
 */
public class RetryPolicyRegistry {

    private final Map<String, RetryPolicy> policies = new ConcurrentHashMap<>(16);

    private final ClassLoader classLoader;

    public RetryPolicyRegistry() {
        this.classLoader = RetryPolicyRegistry.class.getClassLoader();
    }

    public RetryPolicyRegistry(RetryKitProperties props, ClassLoader classLoader) {
        this.classLoader = classLoader == null ? RetryPolicyRegistry.class.getClassLoader() : classLoader;
        props.getPolicies().forEach((name, spec) -> register(name, toPolicy(name, spec)));
    }

    /**
     * 注册或覆盖策略
     */
    public RetryPolicyRegistry register(String name, RetryPolicy policy) {
        policies.put(normalize(name), policy);
        return this;
    }

    /**
     * 按名称解析策略, 不存在时抛出配置异常
     */
    public RetryPolicy resolve(String name) {
        RetryPolicy p = name == null ? null : policies.get(normalize(name));
        if (p == null) {
            throw new RetryConfigurationException("Unknown retry policy: " + name + ", registered=" + names());
        }
        return p;
    }

    /** 列出已注册策略 */
    public Set<String> names() { return Collections.unmodifiableSet(policies.keySet()); }

    private static String normalize(String n) { return n.toLowerCase(Locale.ROOT).trim(); }

    private RetryPolicy toPolicy(String name, RetryKitProperties.PolicySpec spec) {
        try {
            RetryOptions.RetryOptionsBuilder b = RetryOptions.builder()
                    .maxAttempts(spec.getMaxAttempts())
                    .backOffPolicy(BackOffPolicyType.from(spec.getBackOffPolicy()))
                    .backOff(spec.getBackOff())
                    .reraise(spec.isReraise())
                    .useJitter(spec.isUseJitter());
            if (spec.getExponentialOption() != null) {
                b.exponentialOption(new ExponentialOption(
                        spec.getExponentialOption().getMaxInterval(),
                        spec.getExponentialOption().getMultiplier()));
            }
            if (spec.getJitterType() != null && !spec.getJitterType().isBlank()) {
                b.jitterType(JitterType.from(spec.getJitterType()));
            }
            if (spec.getRetryOn() != null && !spec.getRetryOn().isEmpty()) {
                b.value(loadKinds(spec.getRetryOn()));
            }
            return RetryPolicy.from(b.build());
        } catch (IllegalArgumentException e) {
            // 包含枚举名非法与 RetryConfigurationException
            throw new RetryConfigurationException("retry.policies." + name + ": " + e.getMessage(), e);
        }
    }

    private List<Class<? extends Throwable>> loadKinds(List<String> classNames) {
        List<Class<? extends Throwable>> kinds = new ArrayList<>(classNames.size());
        for (String cn : classNames) {
            Class<?> c;
            try {
                c = Class.forName(cn.trim(), false, classLoader);
            } catch (ClassNotFoundException e) {
                throw new RetryConfigurationException("retry-on class not found: " + cn, e);
            }
            if (!Throwable.class.isAssignableFrom(c)) {
                throw new RetryConfigurationException("retry-on class is not a Throwable: " + cn);
            }
            kinds.add(c.asSubclass(Throwable.class));
        }
        return kinds;
    }
}
