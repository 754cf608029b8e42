package com.retrykit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * 指数退避参数, 未设置的字段在构建 RetryPolicy 时用默认值补齐
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExponentialOption {

    /** 单次延迟上限, 默认 2000ms */
    private Duration maxInterval;

    /** 倍数, 默认 2 */
    private Double multiplier;
}
