package com.telemon.api.model;

import lombok.Builder;
import lombok.Value;

/**
 * 已注册的指标定义
 * 未注册的指标在首次记录时自动以 GAUGE 注册。
 */
@Value
@Builder
public class MetricDefinition {
    String name;
    String description;
    String unit;
    MetricType type;
}
