package com.telemon.api.trace;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 追踪片段
 * <p>
 * 打开期间可变，由调用方的执行上下文独占；结束后 endTime 与 status 固定，
 * 之后作为终态事件移交批处理引擎。endTime 至多设置一次。
 */
public class Span {

    private final String spanId;
    private final String traceId;
    private final String parentSpanId;
    private final String name;
    private final String component;
    private final Instant startTime;
    private final long startNanos;

    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final AtomicBoolean ended = new AtomicBoolean(false);

    private volatile SpanStatus status = SpanStatus.OPEN;
    private volatile Instant endTime;
    private volatile long durationNanos = -1;
    private volatile String errorMessage;

    public Span(String spanId,
                String traceId,
                String parentSpanId,
                String name,
                String component,
                Instant startTime,
                long startNanos) {
        this.spanId = spanId;
        this.traceId = traceId;
        this.parentSpanId = parentSpanId;
        this.name = name;
        this.component = component;
        this.startTime = startTime;
        this.startNanos = startNanos;
    }

    /**
     * 结束 Span（由追踪上下文管理器调用）
     *
     * @return 首次结束返回 true；重复调用返回 false 且不做任何修改
     */
    public boolean finish(Instant endTime, long endNanos, SpanStatus status,
                          Map<String, ?> finalAttributes, String errorMessage) {
        if (!ended.compareAndSet(false, true)) {
            return false;
        }
        if (finalAttributes != null && !finalAttributes.isEmpty()) {
            synchronized (attributes) {
                attributes.putAll(finalAttributes);
            }
        }
        this.errorMessage = errorMessage;
        this.durationNanos = Math.max(0L, endNanos - startNanos);
        this.endTime = endTime;
        this.status = status == null || status == SpanStatus.OPEN ? SpanStatus.OK : status;
        return true;
    }

    public Span setAttribute(String key, Object value) {
        if (key != null && !ended.get()) {
            synchronized (attributes) {
                attributes.put(key, value);
            }
        }
        return this;
    }

    public Map<String, Object> getAttributes() {
        synchronized (attributes) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }
    }

    public boolean isEnded() {
        return ended.get();
    }

    public SpanContext context() {
        return new SpanContext(traceId, spanId);
    }

    /**
     * 持续时间（毫秒），未结束时返回 -1
     */
    public double getDurationMillis() {
        long nanos = durationNanos;
        return nanos < 0 ? -1 : nanos / 1_000_000.0;
    }

    public Duration getDuration() {
        long nanos = durationNanos;
        return nanos < 0 ? null : Duration.ofNanos(nanos);
    }

    public String getSpanId() {
        return spanId;
    }

    public String getTraceId() {
        return traceId;
    }

    public String getParentSpanId() {
        return parentSpanId;
    }

    public String getName() {
        return name;
    }

    public String getComponent() {
        return component;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public SpanStatus getStatus() {
        return status;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return "Span{name=" + name + ", traceId=" + traceId + ", spanId=" + spanId
                + ", parent=" + parentSpanId + ", status=" + status + "}";
    }
}
