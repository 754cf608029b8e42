package com.retrykit.model;

import com.retrykit.model.enums.AttemptOutcome;
import lombok.Value;

import java.time.Instant;

/**
 * 单次调用记录, 仅在一次 execute 期间存在
 */
@Value
public class Attempt {
    int index;
    AttemptOutcome outcome;
    Throwable error;
    Instant timestamp;

    public static Attempt success(int index) {
        return new Attempt(index, AttemptOutcome.SUCCESS, null, Instant.now());
    }

    public static Attempt failure(int index, Throwable error) {
        return new Attempt(index, AttemptOutcome.FAILURE, error, Instant.now());
    }
}
