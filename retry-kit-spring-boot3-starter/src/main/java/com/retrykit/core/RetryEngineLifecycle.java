package com.retrykit.core;

import com.retrykit.config.RetryKitProperties;
import com.retrykit.core.policy.RetryPolicyRegistry;
import com.retrykit.core.sleep.CancellableSleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public class RetryEngineLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RetryEngineLifecycle.class);

    private final CancellableSleeper sleeper;

    private final ExecutorService resumeExecutor;

    private final RetryPolicyRegistry registry;

    private final RetryKitProperties props;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public RetryEngineLifecycle(CancellableSleeper sleeper, ExecutorService resumeExecutor,
                                RetryPolicyRegistry registry, RetryKitProperties props) {
        this.sleeper = sleeper;
        this.resumeExecutor = resumeExecutor;
        this.registry = registry;
        this.props = props;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        log.info("[Retry-Engine] started: wheel.tick={} ms, wheel.size={}, exec.core={}, exec.max={}, exec.queue={}, policies={}",
                props.getWheel().getTickDuration().toMillis(),
                props.getWheel().getTicksPerWheel(),
                props.getExecutor().getCorePoolSize(),
                props.getExecutor().getMaxPoolSize(),
                props.getExecutor().getQueueCapacity(),
                registry.names());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[Retry-Engine] stop skipped: already stopped");
            return;
        }
        log.info("[Retry-Engine] stopping...");
        try {
            // 先停时间轮, 挂起的等待以拒绝结束后再关闭线程池
            sleeper.shutdown();
            resumeExecutor.shutdown();
            long await = props.getShutdown().getAwait().toMillis();
            if (!resumeExecutor.awaitTermination(await, TimeUnit.MILLISECONDS)) {
                log.warn("[Retry-Engine] executor not terminated within {} ms, forcing shutdown", await);
                resumeExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            resumeExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            log.info("[Retry-Engine] stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override public boolean isAutoStartup() { return true; }
}
