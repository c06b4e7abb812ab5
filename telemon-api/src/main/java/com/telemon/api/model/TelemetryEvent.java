package com.telemon.api.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 结构化日志事件
 * <p>
 * 在门面调用点创建，创建后不可变；入队后归批处理引擎所有，直到投递完成或被丢弃。
 * data 与 tags 在构造时拷贝为只读视图。
 */
@Value
public class TelemetryEvent implements TelemetryItem {

    String eventId;
    Instant timestamp;
    LogLevel level;
    String component;
    EventType eventType;
    String message;
    Map<String, Object> data;
    Set<String> tags;
    String traceId;
    String spanId;

    @Builder(toBuilder = true)
    private TelemetryEvent(String eventId,
                           Instant timestamp,
                           LogLevel level,
                           String component,
                           EventType eventType,
                           String message,
                           Map<String, Object> data,
                           Set<String> tags,
                           String traceId,
                           String spanId) {
        this.eventId = eventId;
        this.timestamp = timestamp;
        this.level = level != null ? level : LogLevel.INFO;
        this.component = component;
        this.eventType = eventType != null ? eventType : EventType.SYSTEM;
        this.message = message != null ? message : "";
        this.data = data == null || data.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.tags = tags == null || tags.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        this.traceId = traceId;
        this.spanId = spanId;
    }

    @Override
    public Kind getKind() {
        return Kind.EVENT;
    }
}
