package com.telemon.core.trace;

import com.telemon.api.monitor.Monitor;
import com.telemon.api.trace.SpanScope;

import java.util.concurrent.Callable;

/**
 * 显式的追踪包装
 * <p>
 * 进入时开启 Span，任意退出路径上关闭；异常时 Span 以 ERROR 结束
 * （附 error_type / error_message），异常原样抛出。每次退出都以 Span 耗时记录 operation_duration_ms。
 * <pre>
 * String result = Traced.call(monitor, "fetch_profile", "user_service", () -&gt; repo.load(id));
 * </pre>
 */
public final class Traced {

    private Traced() {
    }

    public static <T> T call(Monitor monitor, String name, String component, Callable<T> body) throws Exception {
        try (SpanScope scope = monitor.span(name, component)) {
            try {
                return body.call();
            } catch (Exception | Error e) {
                scope.fail(e);
                throw e;
            }
        }
    }

    public static void run(Monitor monitor, String name, String component, Runnable body) {
        try (SpanScope scope = monitor.span(name, component)) {
            try {
                body.run();
            } catch (RuntimeException | Error e) {
                scope.fail(e);
                throw e;
            }
        }
    }
}
