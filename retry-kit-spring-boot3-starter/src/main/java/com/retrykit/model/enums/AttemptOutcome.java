package com.retrykit.model.enums;

public enum AttemptOutcome {
    SUCCESS,
    FAILURE
}
