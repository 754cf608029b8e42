package com.retrykit.model.ctx;

import com.retrykit.model.Attempt;
import com.retrykit.model.enums.RetryState;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * 单次 execute 的私有状态, 不在并发调用之间共享
 */
@Getter
public class RetryContext {

    private final String executionId;

    private final int maxAttempts;

    private final Instant startedAt;

    /** 当前调用序号, [0, maxAttempts] */
    @Setter
    private volatile int attempt;

    @Setter
    private volatile RetryState state = RetryState.IDLE;

    /** 上一次实际等待时长（decorrelated 抖动的 p） */
    @Setter
    private volatile long previousDelayMillis;

    private volatile Throwable lastError;

    private final List<Attempt> attempts = Collections.synchronizedList(new ArrayList<>());

    public RetryContext(int maxAttempts, long initialDelayMillis) {
        this.executionId = UUID.randomUUID().toString();
        this.maxAttempts = maxAttempts;
        this.previousDelayMillis = initialDelayMillis;
        this.startedAt = Instant.now();
    }

    public void recordSuccess() {
        attempts.add(Attempt.success(attempt));
    }

    public void recordFailure(Throwable error) {
        this.lastError = error;
        attempts.add(Attempt.failure(attempt, error));
    }

    public boolean isFinalAttempt() {
        return attempt >= maxAttempts;
    }

    /** 已发生的调用次数 */
    public int getInvocations() {
        return attempts.size();
    }

    public List<Attempt> getAttempts() {
        synchronized (attempts) {
            return List.copyOf(attempts);
        }
    }

    public Duration getElapsed() {
        return Duration.between(startedAt, Instant.now());
    }
}
