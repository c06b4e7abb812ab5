package com.telemon.core.trace;

import com.telemon.api.monitor.Monitor;
import com.telemon.api.trace.Span;
import com.telemon.api.trace.SpanScope;
import com.telemon.api.trace.SpanStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link Monitor#span} 返回的作用域：关闭时结束 Span，并以 Span 耗时记录一次性能数据。
 * 失败时性能详情带 error 与 error_type。
 */
public class DefaultSpanScope implements SpanScope {

    private final TraceContextManager manager;
    private final Monitor monitor;
    private final Span span;
    private volatile Throwable failure;

    public DefaultSpanScope(TraceContextManager manager, Monitor monitor, Span span) {
        this.manager = manager;
        this.monitor = monitor;
        this.span = span;
    }

    @Override
    public Span getSpan() {
        return span;
    }

    @Override
    public SpanScope setAttribute(String key, Object value) {
        span.setAttribute(key, value);
        return this;
    }

    @Override
    public void fail(Throwable error) {
        this.failure = error;
    }

    @Override
    public void close() {
        Throwable error = failure;
        if (error == null) {
            manager.endSpan(span, SpanStatus.OK, null, null);
            monitor.recordPerformance(span.getName(), span.getDurationMillis(), span.getComponent(), true, null);
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error_type", error.getClass().getSimpleName());
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
        manager.endSpan(span, SpanStatus.ERROR, data, message);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error", message);
        details.put("error_type", error.getClass().getSimpleName());
        monitor.recordPerformance(span.getName(), span.getDurationMillis(), span.getComponent(), false, details);
    }
}
