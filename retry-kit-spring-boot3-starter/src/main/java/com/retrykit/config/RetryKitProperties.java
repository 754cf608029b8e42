package com.retrykit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 重试引擎配置（绑定前缀：retry）
 *
 * YAML 示例：
 * retry:
 *   wheel:
 *     tick-duration: 10ms
 *     ticks-per-wheel: 512
 *     max-pending-timeouts: 100000
 *   executor:
 *     core-pool-size: 4
 *     max-pool-size: 16
 *     queue-capacity: 1000
 *     keep-alive: 60s
 *     rejected-handler: ABORT
 *   shutdown:
 *     await: 10s
 *   logging:
 *     enabled: true
 *   policies:
 *     payment:
 *       max-attempts: 3
 *       back-off-policy: exponential
 *       back-off: 200ms
 *       exponential-option:
 *         max-interval: 5s
 *         multiplier: 3
 *       use-jitter: true
 *       jitter-type: equal
 *       retry-on:
 *         - java.io.IOException
 */
@ConfigurationProperties(prefix = "retry")
public class RetryKitProperties {

    private Wheel wheel = new Wheel();

    private Exec executor = new Exec();

    private Shutdown shutdown = new Shutdown();

    private Logging logging = new Logging();

    /** 命名策略, key 为策略名 */
    private Map<String, PolicySpec> policies = new LinkedHashMap<>();

    // ----------------- 嵌套配置对象 -----------------

    public static class Wheel {
        /** 时间轮刻度, 决定退避等待与取消响应的精度 */
        private Duration tickDuration = Duration.ofMillis(10);

        /** 槽位数量（2^n 较佳） */
        private int ticksPerWheel = 512;

        /** 允许挂起的最大 timeout 数量（Netty 参数, <=0 不限制） */
        private long maxPendingTimeouts = 100_000;

        public Duration getTickDuration() { return tickDuration; }
        public void setTickDuration(Duration tickDuration) { this.tickDuration = tickDuration; }
        public int getTicksPerWheel() { return ticksPerWheel; }
        public void setTicksPerWheel(int ticksPerWheel) { this.ticksPerWheel = ticksPerWheel; }
        public long getMaxPendingTimeouts() { return maxPendingTimeouts; }
        public void setMaxPendingTimeouts(long maxPendingTimeouts) { this.maxPendingTimeouts = maxPendingTimeouts; }
    }

    public static class Exec {
        private int corePoolSize = 4;

        private int maxPoolSize = 16;

        /** 任务队列容量 */
        private int queueCapacity = 1000;

        /** 线程空闲存活时间 */
        private Duration keepAlive = Duration.ofSeconds(60);

        /**
         * 拒绝策略：ABORT | CALLER_RUNS, 被拒绝的执行以 RejectedExecutionException 结束
         * CALLER_RUNS 在队列满时会在时间轮线程上执行业务调用, 阻塞其他到期的退避
         */
        private RejectedHandlerPolicy rejectedHandler = RejectedHandlerPolicy.ABORT;

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
        public RejectedHandlerPolicy getRejectedHandler() { return rejectedHandler; }
        public void setRejectedHandler(RejectedHandlerPolicy rejectedHandler) { this.rejectedHandler = rejectedHandler; }
    }

    public static class Shutdown {
        /** 优雅停机等待时长 */
        private Duration await = Duration.ofSeconds(10);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    public static class Logging {
        /** 是否注册 LoggingRetryListener */
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    /**
     * 单个命名策略, 字段含义同 RetryOptions
     */
    @Data
    public static class PolicySpec {
        private Integer maxAttempts;
        /** fixed | exponential */
        private String backOffPolicy;
        private Duration backOff;
        private ExponentialSpec exponentialOption = new ExponentialSpec();
        private boolean reraise = false;
        private boolean useJitter = false;
        /** full | equal | decorrelated | none */
        private String jitterType;
        /** 可重试异常的全限定类名 */
        private List<String> retryOn;
    }

    @Data
    public static class ExponentialSpec {
        private Duration maxInterval;
        private Double multiplier;
    }

    // ----------------- 公共枚举 -----------------

    /** 线程池拒绝策略枚举（YAML 中大小写均可）, 不提供静默丢弃的策略 */
    public enum RejectedHandlerPolicy {
        ABORT, CALLER_RUNS;

        public static RejectedHandlerPolicy from(String v) {
            return RejectedHandlerPolicy.valueOf(v.trim().toUpperCase(Locale.ROOT));
        }
        public RejectedExecutionHandler toHandler() {
            return switch (this) {
                case ABORT -> new ThreadPoolExecutor.AbortPolicy();
                case CALLER_RUNS -> new ThreadPoolExecutor.CallerRunsPolicy();
            };
        }
    }

    // ----------------- getters/setters 顶层 -----------------

    public Wheel getWheel() { return wheel; }
    public void setWheel(Wheel wheel) { this.wheel = wheel; }

    public Exec getExecutor() { return executor; }
    public void setExecutor(Exec executor) { this.executor = executor; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }

    public Logging getLogging() { return logging; }
    public void setLogging(Logging logging) { this.logging = logging; }

    public Map<String, PolicySpec> getPolicies() { return policies; }
    public void setPolicies(Map<String, PolicySpec> policies) { this.policies = policies; }
}
