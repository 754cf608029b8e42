package com.retrykit.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 单次 execute 的状态
 */
@AllArgsConstructor
@Getter
public enum RetryState {
    IDLE(false, "尚未开始"),
    ATTEMPTING(false, "调用中"),
    BACKOFF(false, "退避等待中"),
    SUCCEEDED(true, "调用成功，终态"),
    NOT_RETRYABLE(true, "异常不可重试，原样抛出，终态"),
    EXHAUSTED(true, "重试次数耗尽，终态"),
    ABORTED(true, "被取消信号中止，终态")
    ;

    public final boolean terminal;
    public final String desc;
}
