package com.telemon.core.trace;

import com.telemon.api.trace.SpanContext;

import java.util.concurrent.Callable;

/**
 * 追踪上下文快照
 * <p>
 * 在提交异步任务的线程上捕获当前 Span 上下文，在执行线程上重放，
 * 使子线程新开的 Span 挂在原 trace 下。
 */
public class TraceContextSnapshot {

    private final TraceContextManager manager;
    private final SpanContext context;

    TraceContextSnapshot(TraceContextManager manager, SpanContext context) {
        this.manager = manager;
        this.context = context;
    }

    /**
     * 在当前线程重放
     */
    public TraceContextManager.Scope replay() {
        return manager.attach(context);
    }

    public Runnable wrap(Runnable task) {
        return () -> {
            try (TraceContextManager.Scope ignored = replay()) {
                task.run();
            }
        };
    }

    public <T> Callable<T> wrap(Callable<T> task) {
        return () -> {
            try (TraceContextManager.Scope ignored = replay()) {
                return task.call();
            }
        };
    }

    public SpanContext getContext() {
        return context;
    }
}
