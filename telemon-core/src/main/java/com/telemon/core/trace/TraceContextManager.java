package com.telemon.core.trace;

import com.telemon.api.model.EventType;
import com.telemon.api.model.LogLevel;
import com.telemon.api.model.TelemetryEvent;
import com.telemon.api.trace.Span;
import com.telemon.api.trace.SpanContext;
import com.telemon.api.trace.SpanStatus;
import com.telemon.core.clock.IdGenerator;
import com.telemon.core.clock.TelemetryClock;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 追踪上下文管理器
 * <p>
 * 每个线程持有独立的活动 Span 栈（ThreadLocal），并发任务互不可见。
 * 栈为空时可继承一个外部 parent（跨线程快照重放或入站请求头），新 Span 以其为父。
 * <p>
 * endSpan 只生效一次：设置结束时间、合并属性、产出终态事件、出栈。
 * 乱序结束与子 Span 未结束即结束父 Span 均记录为异常日志，不抛出。
 */
@Slf4j
public class TraceContextManager {

    private final ThreadLocal<Deque<Span>> activeSpans = new ThreadLocal<>();
    private final ThreadLocal<SpanContext> inheritedParent = new ThreadLocal<>();

    private final TelemetryClock clock;
    private final Consumer<TelemetryEvent> terminalEventSink;

    public TraceContextManager(TelemetryClock clock, Consumer<TelemetryEvent> terminalEventSink) {
        this.clock = clock != null ? clock : TelemetryClock.system();
        this.terminalEventSink = terminalEventSink;
    }

    // ==================== Span 生命周期 ====================

    /**
     * 开启 Span，parent 取当前活动上下文
     */
    public Span startSpan(String name, String component, Map<String, ?> attributes) {
        return startSpan(name, component, currentContext().orElse(null), attributes);
    }

    /**
     * 以显式 parent 开启 Span；parent 为 null 或无效时开启新 trace
     */
    public Span startSpan(String name, String component, SpanContext parent, Map<String, ?> attributes) {
        boolean hasParent = parent != null && parent.isValid();
        String traceId = hasParent ? parent.traceId() : IdGenerator.traceId();
        String parentSpanId = hasParent ? parent.spanId() : null;

        Span span = new Span(IdGenerator.spanId(), traceId, parentSpanId, name, component,
                clock.now(), clock.monotonicNanos());
        if (attributes != null) {
            attributes.forEach(span::setAttribute);
        }

        stack(true).push(span);
        log.trace("[Trace] Started span {} (trace={}, parent={})", name, traceId, parentSpanId);
        return span;
    }

    /**
     * 结束 Span
     *
     * @return 本次调用实际结束了 Span 返回 true；重复结束返回 false
     */
    public boolean endSpan(Span span, SpanStatus status, Map<String, ?> data, String errorMessage) {
        if (span == null) {
            return false;
        }
        if (!span.finish(clock.now(), clock.monotonicNanos(), status, data, errorMessage)) {
            log.debug("[Trace] Span {} already ended, ignoring", span.getSpanId());
            return false;
        }

        detach(span);

        if (terminalEventSink != null) {
            try {
                terminalEventSink.accept(toTerminalEvent(span));
            } catch (RuntimeException e) {
                log.debug("[Trace] Failed to emit terminal event for span {}: {}", span.getSpanId(), e.getMessage());
            }
        }
        return true;
    }

    private void detach(Span span) {
        Deque<Span> stack = stack(false);
        if (stack == null || stack.isEmpty()) {
            // 在其他线程结束，或已被清理
            log.debug("[Trace] Span {} ended outside of its owning context", span.getSpanId());
            return;
        }

        if (stack.peek() == span) {
            stack.pop();
        } else {
            int openAbove = 0;
            boolean found = false;
            for (Iterator<Span> it = stack.iterator(); it.hasNext(); ) {
                Span candidate = it.next();
                if (candidate == span) {
                    it.remove();
                    found = true;
                    break;
                }
                openAbove++;
            }
            if (found) {
                log.warn("[Trace] Span '{}' ({}) ended out of order while {} child span(s) still open",
                        span.getName(), span.getSpanId(), openAbove);
            } else {
                log.debug("[Trace] Span {} not found in current context stack", span.getSpanId());
            }
        }

        if (stack.isEmpty()) {
            activeSpans.remove();
        }
    }

    /**
     * 将结束的 Span 转换为终态事件
     */
    TelemetryEvent toTerminalEvent(Span span) {
        Map<String, Object> data = new LinkedHashMap<>(span.getAttributes());
        data.put("span_name", span.getName());
        data.put("parent_span_id", span.getParentSpanId());
        data.put("duration_ms", span.getDurationMillis());
        data.put("status", span.getStatus().value());
        if (span.getErrorMessage() != null) {
            data.put("error_message", span.getErrorMessage());
        }

        return TelemetryEvent.builder()
                .eventId(IdGenerator.eventId())
                .timestamp(span.getEndTime())
                .level(span.getStatus() == SpanStatus.ERROR ? LogLevel.ERROR : LogLevel.DEBUG)
                .component(span.getComponent())
                .eventType(EventType.SPAN)
                .message("End span: " + span.getName())
                .data(data)
                .traceId(span.getTraceId())
                .spanId(span.getSpanId())
                .build();
    }

    // ==================== 查询 ====================

    public Optional<Span> currentSpan() {
        Deque<Span> stack = stack(false);
        return stack == null ? Optional.empty() : Optional.ofNullable(stack.peek());
    }

    /**
     * 当前上下文：栈顶 Span，否则继承的外部 parent
     */
    public Optional<SpanContext> currentContext() {
        Optional<Span> current = currentSpan();
        if (current.isPresent()) {
            return Optional.of(current.get().context());
        }
        return Optional.ofNullable(inheritedParent.get());
    }

    public int depth() {
        Deque<Span> stack = stack(false);
        return stack == null ? 0 : stack.size();
    }

    // ==================== 上下文继承 ====================

    /**
     * 在当前线程挂载外部 parent，返回的 Scope 关闭时恢复原值
     */
    public Scope attach(SpanContext parent) {
        SpanContext previous = inheritedParent.get();
        if (parent != null && parent.isValid()) {
            inheritedParent.set(parent);
        } else {
            inheritedParent.remove();
        }
        return () -> {
            if (previous != null) {
                inheritedParent.set(previous);
            } else {
                inheritedParent.remove();
            }
        };
    }

    /**
     * 清空当前线程的追踪状态（线程池复用前调用）
     */
    public void clear() {
        Deque<Span> stack = stack(false);
        if (stack != null && !stack.isEmpty()) {
            log.warn("[Trace] Clearing context with {} open span(s)", stack.size());
        }
        activeSpans.remove();
        inheritedParent.remove();
    }

    public TraceContextSnapshot capture() {
        return new TraceContextSnapshot(this, currentContext().orElse(null));
    }

    private Deque<Span> stack(boolean create) {
        Deque<Span> stack = activeSpans.get();
        if (stack == null && create) {
            stack = new ArrayDeque<>();
            activeSpans.set(stack);
        }
        return stack;
    }

    /**
     * 上下文作用域
     */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
