package com.retrykit.model.enums;

import java.util.Locale;

/**
 * 退避策略类型
 */
public enum BackOffPolicyType {
    /** 固定间隔 */
    FIXED,

    /** 指数退避, 受 maxInterval 封顶 */
    EXPONENTIAL;

    /**
     * 大小写均可, 同时兼容 FixedBackOffPolicy / ExponentialBackOffPolicy 写法
     */
    public static BackOffPolicyType from(String v) {
        if (v == null || v.isBlank()) {
            return FIXED;
        }
        String s = v.trim().toUpperCase(Locale.ROOT);
        if (s.endsWith("BACKOFFPOLICY")) {
            s = s.substring(0, s.length() - "BACKOFFPOLICY".length());
        }
        return BackOffPolicyType.valueOf(s);
    }
}
