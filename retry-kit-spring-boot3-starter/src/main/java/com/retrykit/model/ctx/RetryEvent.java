package com.retrykit.model.ctx;

import com.retrykit.model.enums.RetryEventType;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * 事件上下文
 */
@Data
@Builder
public class RetryEvent {

    private RetryEventType type;
    private String executionId;
    /** 触发事件的调用序号 */
    private int attempt;
    private int maxAttempts;
    // 仅 RETRY_SCHEDULED 有值
    private Long delayMillis;
    private Throwable error;
    private Instant when;

    public static RetryEvent of(RetryEventType type, RetryContext ctx, Throwable error) {
        return RetryEvent.builder()
                .type(type)
                .executionId(ctx.getExecutionId())
                .attempt(ctx.getAttempt())
                .maxAttempts(ctx.getMaxAttempts())
                .error(error)
                .when(Instant.now())
                .build();
    }

    public static RetryEvent scheduled(RetryContext ctx, long delayMillis) {
        RetryEvent event = of(RetryEventType.RETRY_SCHEDULED, ctx, ctx.getLastError());
        event.setDelayMillis(delayMillis);
        return event;
    }
}
