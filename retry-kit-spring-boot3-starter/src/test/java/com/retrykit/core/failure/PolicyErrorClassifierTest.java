package com.retrykit.core.failure;

import static org.junit.jupiter.api.Assertions.*;

import com.retrykit.core.policy.RetryPolicy;
import com.retrykit.model.RetryOptions;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PolicyErrorClassifier")
class PolicyErrorClassifierTest {

    private final PolicyErrorClassifier classifier = new PolicyErrorClassifier();

    @Test
    @DisplayName("everything is retryable without predicate or kinds")
    void noFilters() {
        RetryPolicy policy = RetryPolicy.maxAttempts(1);

        assertTrue(classifier.canRetry(new IOException(), policy));
        assertTrue(classifier.canRetry(new OutOfMemoryError(), policy));
    }

    @Test
    @DisplayName("a false predicate wins over a matching kind")
    void predicateShortCircuits() {
        RetryPolicy policy = RetryPolicy.from(RetryOptions.builder().maxAttempts(1)
                .doRetry(e -> false).value(List.of(IOException.class)).build());

        assertFalse(classifier.canRetry(new IOException(), policy));
    }

    @Test
    @DisplayName("a true predicate still has to pass the kind filter")
    void predicateThenKinds() {
        RetryPolicy policy = RetryPolicy.from(RetryOptions.builder().maxAttempts(1)
                .doRetry(e -> true).value(List.of(IOException.class)).build());

        assertTrue(classifier.canRetry(new IOException(), policy));
        assertFalse(classifier.canRetry(new IllegalStateException(), policy));
    }

    @Test
    @DisplayName("kinds match by exact class, not by subtype")
    void exactKindMatch() {
        RetryPolicy policy = RetryPolicy.from(RetryOptions.builder().maxAttempts(1)
                .value(List.of(IOException.class)).build());

        assertFalse(classifier.canRetry(new FileNotFoundException(), policy));
    }

    @Test
    @DisplayName("an empty kind collection disables type filtering")
    void emptyKinds() {
        RetryPolicy policy = RetryPolicy.from(RetryOptions.builder().maxAttempts(1).value(List.of()).build());

        assertTrue(classifier.canRetry(new IllegalStateException(), policy));
    }
}
