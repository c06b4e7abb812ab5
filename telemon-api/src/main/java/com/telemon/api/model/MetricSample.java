package com.telemon.api.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 指标样本
 */
@Value
public class MetricSample implements TelemetryItem {

    String name;
    double value;
    String unit;
    Map<String, String> tags;
    Instant timestamp;

    @Builder(toBuilder = true)
    private MetricSample(String name, double value, String unit, Map<String, String> tags, Instant timestamp) {
        this.name = name;
        this.value = value;
        this.unit = unit;
        this.tags = tags == null || tags.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        this.timestamp = timestamp;
    }

    @Override
    public Kind getKind() {
        return Kind.METRIC;
    }
}
