package com.retrykit.autoconfig;

import com.retrykit.core.metric.RetryMeterRegistryProvider;
import com.retrykit.core.metric.RetryMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
public class RetryKitMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RetryMeterRegistryProvider retryMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered) {
        return new RetryMeterRegistryProvider(discovered.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryMetrics retryMetrics(RetryMeterRegistryProvider provider) {
        return RetryMetrics.create(provider.getRegistry());
    }
}
