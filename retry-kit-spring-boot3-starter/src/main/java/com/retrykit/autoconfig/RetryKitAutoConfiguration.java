package com.retrykit.autoconfig;

import com.retrykit.config.RetryKitProperties;
import com.retrykit.core.RetryEngineLifecycle;
import com.retrykit.core.backoff.BackoffScheduler;
import com.retrykit.core.engine.RetryEngine;
import com.retrykit.core.failure.PolicyErrorClassifier;
import com.retrykit.core.metric.RetryMetrics;
import com.retrykit.core.notify.LoggingRetryListener;
import com.retrykit.core.notify.RetryEventPublisher;
import com.retrykit.core.policy.RetryPolicyRegistry;
import com.retrykit.core.sleep.CancellableSleeper;
import com.retrykit.core.spi.BackoffPolicy;
import com.retrykit.core.spi.ErrorClassifier;
import com.retrykit.core.spi.RetryListener;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 时间轮、续跑线程池与重试引擎装配
 */
@AutoConfiguration(after = RetryKitMetricsAutoConfiguration.class)
@EnableConfigurationProperties(RetryKitProperties.class)
public class RetryKitAutoConfiguration {

    /**
     * 时间轮, 退避等待都挂在这里
     */
    @Bean
    @ConditionalOnMissingBean(name = "retryWheelTimer")
    public HashedWheelTimer retryWheelTimer(RetryKitProperties props) {
        return new HashedWheelTimer(
                new NamedThreadFactory("retry-kit-wheel"),
                props.getWheel().getTickDuration().toMillis(),
                TimeUnit.MILLISECONDS,
                props.getWheel().getTicksPerWheel(),
                false,
                props.getWheel().getMaxPendingTimeouts()
        );
    }

    /**
     * 退避结束后继续调用的线程池
     */
    @Bean("retryResumeExecutor")
    @ConditionalOnMissingBean(name = "retryResumeExecutor")
    public ExecutorService retryResumeExecutor(RetryKitProperties props) {
        RetryKitProperties.Exec exec = props.getExecutor();
        return new ThreadPoolExecutor(
                exec.getCorePoolSize(),
                exec.getMaxPoolSize(),
                exec.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(exec.getQueueCapacity()),
                new NamedThreadFactory("retry-kit-resume"),
                exec.getRejectedHandler().toHandler()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public CancellableSleeper cancellableSleeper(@Qualifier("retryWheelTimer") HashedWheelTimer timer) {
        return new CancellableSleeper(timer);
    }

    /**
     * 退避策略注册中心, 业务方注册的 BackoffPolicy 覆盖内置实现
     */
    @Bean
    @ConditionalOnMissingBean
    public BackoffScheduler backoffScheduler(ObjectProvider<BackoffPolicy> discovered) {
        return new BackoffScheduler(discovered.orderedStream().toList());
    }

    /**
     * 默认失败判定
     */
    @Bean
    @ConditionalOnMissingBean(ErrorClassifier.class)
    public ErrorClassifier retryErrorClassifier() {
        return new PolicyErrorClassifier();
    }

    @Bean
    @ConditionalOnProperty(prefix = "retry.logging", name = "enabled", havingValue = "true", matchIfMissing = true)
    public LoggingRetryListener loggingRetryListener() {
        return new LoggingRetryListener();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryEventPublisher retryEventPublisher(ObjectProvider<RetryListener> listeners) {
        return new RetryEventPublisher(listeners.orderedStream().toList());
    }

    /**
     * 重试引擎
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryEngine retryEngine(CancellableSleeper sleeper,
                                   BackoffScheduler scheduler,
                                   ErrorClassifier classifier,
                                   @Qualifier("retryResumeExecutor") ExecutorService resumeExecutor,
                                   ObjectProvider<RetryMetrics> meter,
                                   RetryEventPublisher publisher) {
        return new RetryEngine(sleeper, scheduler, classifier, resumeExecutor,
                meter.getIfAvailable(RetryMetrics::standalone), publisher);
    }

    /**
     * 命名策略
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryPolicyRegistry retryPolicyRegistry(RetryKitProperties props, ApplicationContext applicationContext) {
        return new RetryPolicyRegistry(props, applicationContext.getClassLoader());
    }

    /**
     * 停机时先停时间轮再关闭线程池
     */
    @Bean
    public RetryEngineLifecycle retryEngineLifecycle(CancellableSleeper sleeper,
                                                     @Qualifier("retryResumeExecutor") ExecutorService resumeExecutor,
                                                     RetryPolicyRegistry registry,
                                                     RetryKitProperties props) {
        return new RetryEngineLifecycle(sleeper, resumeExecutor, registry, props);
    }
}
