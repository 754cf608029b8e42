package com.retrykit.model.enums;

import java.util.Locale;

/**
 * 抖动类型
 */
public enum JitterType {
    /** 原样使用名义延迟 */
    NONE,

    /** [0, d) */
    FULL,

    /** [d/2, d) */
    EQUAL,

    /** [base, p * 3) 封顶 maxInterval, p 为上一次实际延迟 */
    DECORRELATED;

    /** 大小写均可：full | equal | decorrelated | none */
    public static JitterType from(String v) {
        return JitterType.valueOf(v.trim().toUpperCase(Locale.ROOT));
    }
}
