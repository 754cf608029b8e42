package com.retrykit.core.spi;

import com.retrykit.model.ctx.RetryEvent;

/**
 * 重试事件监听器
 */
public interface RetryListener {

    /**
     * 监听器名称, 用于日志
     */
    String name();

    /**
     * 能否处理此事件, 粗粒度过滤
     */
    default boolean supports(RetryEvent event) {
        return true;
    }

    /**
     * 同步回调, 抛出的异常只记录日志, 不影响执行结果
     */
    void onEvent(RetryEvent event);
}
