package com.telemon.core.trace;

import com.telemon.api.trace.SpanContext;

import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * 跨进程追踪传播
 * <p>
 * 出站：将 {traceId, spanId} 写入请求头；入站：两个头都存在才还原为 parent，
 * 任一缺失即视为新的根 trace。
 */
public final class TracePropagator {

    public static final String TRACE_ID_HEADER = "X-Telemon-Trace-Id";
    public static final String PARENT_SPAN_ID_HEADER = "X-Telemon-Parent-Span-Id";

    private TracePropagator() {
    }

    public static void inject(SpanContext context, BiConsumer<String, String> headerSetter) {
        if (context == null || !context.isValid()) {
            return;
        }
        headerSetter.accept(TRACE_ID_HEADER, context.traceId());
        headerSetter.accept(PARENT_SPAN_ID_HEADER, context.spanId());
    }

    public static Optional<SpanContext> extract(Function<String, String> headerGetter) {
        String traceId = trimToNull(headerGetter.apply(TRACE_ID_HEADER));
        String parentSpanId = trimToNull(headerGetter.apply(PARENT_SPAN_ID_HEADER));
        if (traceId == null || parentSpanId == null) {
            return Optional.empty();
        }
        return Optional.of(new SpanContext(traceId, parentSpanId));
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
