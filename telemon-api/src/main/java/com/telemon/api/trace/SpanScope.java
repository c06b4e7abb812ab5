package com.telemon.api.trace;

/**
 * 作用域式 Span 句柄
 * <p>
 * 配合 try-with-resources 使用：进入时开启 Span，所有退出路径上保证关闭。
 * <pre>
 * try (SpanScope scope = monitor.span("process_request", "api_gateway")) {
 *     scope.setAttribute("request_id", id);
 *     ...
 * } // 自动以 OK 结束；调用 fail(...) 后以 ERROR 结束
 * </pre>
 */
public interface SpanScope extends AutoCloseable {

    Span getSpan();

    SpanScope setAttribute(String key, Object value);

    /**
     * 标记失败，关闭时以 ERROR 状态结束
     */
    void fail(Throwable error);

    @Override
    void close();
}
