package com.telemon.starter.filter;

import com.telemon.api.monitor.Monitor;
import com.telemon.api.trace.Span;
import com.telemon.api.trace.SpanContext;
import com.telemon.api.trace.SpanStatus;
import com.telemon.core.monitor.DefaultMonitor;
import com.telemon.core.trace.TraceContextManager;
import com.telemon.core.trace.TracePropagator;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 入站追踪头过滤器
 * <p>
 * 读取 X-Telemon-Trace-Id / X-Telemon-Parent-Span-Id 作为 parent。
 * 开启请求 Span 时为每个请求创建 Span 并在响应头回写 traceId；
 * 否则只把 parent 挂载到当前线程，请求内新建的 Span 继承它。
 */
@Slf4j
@RequiredArgsConstructor
public class TraceHeaderFilter extends OncePerRequestFilter {

    static final String COMPONENT = "http";

    private final Monitor monitor;
    private final boolean requestSpans;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain)
            throws ServletException, IOException {

        SpanContext parent = TracePropagator.extract(request::getHeader).orElse(null);

        if (!requestSpans) {
            if (parent == null || !(monitor instanceof DefaultMonitor)) {
                filterChain.doFilter(request, response);
                return;
            }
            TraceContextManager manager = ((DefaultMonitor) monitor).getTraceContextManager();
            try (TraceContextManager.Scope ignored = manager.attach(parent)) {
                filterChain.doFilter(request, response);
            }
            return;
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("http_method", request.getMethod());
        attributes.put("http_path", request.getRequestURI());
        Span span = monitor.startSpan(request.getMethod() + " " + request.getRequestURI(), COMPONENT,
                parent, attributes);
        response.setHeader(TracePropagator.TRACE_ID_HEADER, span.getTraceId());

        Throwable failure = null;
        try {
            filterChain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            int status = response.getStatus();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("http_status", status);
            if (failure != null) {
                data.put("error_type", failure.getClass().getSimpleName());
                monitor.endSpan(span, SpanStatus.ERROR, data, String.valueOf(failure.getMessage()));
            } else if (status >= 500) {
                monitor.endSpan(span, SpanStatus.ERROR, data, "HTTP " + status);
            } else {
                monitor.endSpan(span, SpanStatus.OK, data, null);
            }
        }
    }
}
