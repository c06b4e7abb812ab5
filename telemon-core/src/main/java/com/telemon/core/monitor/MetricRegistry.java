package com.telemon.core.monitor;

import com.telemon.api.exception.InvalidArgumentException;
import com.telemon.api.model.MetricDefinition;
import com.telemon.api.model.MetricType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 指标定义注册表
 * 未注册的指标在首次记录时以 GAUGE 自动注册。
 */
public class MetricRegistry {

    static final String AUTO_UNIT = "unspecified";

    private final Map<String, MetricDefinition> definitions = new ConcurrentHashMap<>();

    public MetricDefinition register(String name, String description, String unit, MetricType type) {
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("name", "Metric name must not be blank");
        }
        MetricDefinition definition = MetricDefinition.builder()
                .name(name)
                .description(description)
                .unit(unit != null ? unit : AUTO_UNIT)
                .type(type != null ? type : MetricType.GAUGE)
                .build();
        definitions.put(name, definition);
        return definition;
    }

    public MetricDefinition ensureRegistered(String name, String unit) {
        return definitions.computeIfAbsent(name, n -> MetricDefinition.builder()
                .name(n)
                .description("Auto-registered metric: " + n)
                .unit(unit != null ? unit : AUTO_UNIT)
                .type(MetricType.GAUGE)
                .build());
    }

    public List<MetricDefinition> list() {
        return Collections.unmodifiableList(new ArrayList<>(definitions.values()));
    }
}
