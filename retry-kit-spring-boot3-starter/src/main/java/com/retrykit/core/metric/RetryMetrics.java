package com.retrykit.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

public final class RetryMetrics {
    private final Counter attempts;
    private final Counter success;
    private final Counter exhausted;
    private final Counter nonRetryable;
    private final Counter aborted;
    private final DistributionSummary invocations;
    private final Timer backoffTimer;

    private RetryMetrics(MeterRegistry reg) {
        this.attempts     = Counter.builder("retry.attempts").description("operation invocations").register(reg);
        this.success      = Counter.builder("retry.success").description("executions succeeded").register(reg);
        this.exhausted    = Counter.builder("retry.exhausted").description("executions out of attempts").register(reg);
        this.nonRetryable = Counter.builder("retry.non_retryable").description("executions failed with non-retryable error").register(reg);
        this.aborted      = Counter.builder("retry.aborted").description("executions aborted by cancellation").register(reg);
        this.invocations  = DistributionSummary.builder("retry.invocations")
                .description("invocations per execution").baseUnit("times").register(reg);
        this.backoffTimer = Timer.builder("retry.backoff.wait").description("scheduled backoff delay").register(reg);
    }

    public static RetryMetrics create(MeterRegistry reg) { return new RetryMetrics(reg); }

    /** 未接入外部注册表时使用, 指标只保留在进程内 */
    public static RetryMetrics standalone() { return new RetryMetrics(new SimpleMeterRegistry()); }

    public void incAttempts(){      attempts.increment(); }
    public void incSuccess(){       success.increment(); }
    public void incExhausted(){     exhausted.increment(); }
    public void incNonRetryable(){  nonRetryable.increment(); }
    public void incAborted(){       aborted.increment(); }
    public void recordInvocations(int n){ invocations.record(n); }
    public void recordBackoffMillis(long millis){ backoffTimer.record(millis, TimeUnit.MILLISECONDS); }
}
