package com.retrykit.model.enums;

/**
 * 重试事件
 */
public enum RetryEventType {
    /** 单次调用失败 */
    ATTEMPT_FAILED,

    /** 已安排下一次重试 */
    RETRY_SCHEDULED,

    /** 调用成功 */
    SUCCEEDED,

    /** 不可重试的失败 */
    NON_RETRYABLE_FAILED,

    /** 达到最大重试 */
    MAX_ATTEMPTS_REACHED,

    /** 被取消 */
    ABORTED
}
