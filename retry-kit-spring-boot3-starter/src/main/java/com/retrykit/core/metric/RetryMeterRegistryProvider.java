package com.retrykit.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;

/**
 * 合并业务方注册表, 始终保留一个进程内 Simple 注册表供本地读取
 */
public class RetryMeterRegistryProvider {

    private final CompositeMeterRegistry composite = new CompositeMeterRegistry();

    private final SimpleMeterRegistry local = new SimpleMeterRegistry();

    public RetryMeterRegistryProvider(List<MeterRegistry> discovered) {
        composite.add(local);
        if (discovered == null) {
            return;
        }
        for (MeterRegistry mr : discovered) {
            // 展开嵌套的组合注册表, 避免重复计数
            if (mr instanceof CompositeMeterRegistry) {
                ((CompositeMeterRegistry) mr).getRegistries().forEach(composite::add);
            } else if (mr != null) {
                composite.add(mr);
            }
        }
    }

    public MeterRegistry getRegistry() { return composite; }

    /** 进程内注册表 */
    public SimpleMeterRegistry getLocalRegistry() { return local; }
}
