package com.telemon.starter.filter;

import com.telemon.api.model.EventType;
import com.telemon.api.model.TelemetryEvent;
import com.telemon.api.trace.Span;
import com.telemon.core.config.TelemonConfig;
import com.telemon.core.monitor.DefaultMonitor;
import com.telemon.core.sink.InMemoryTelemetrySink;
import com.telemon.core.trace.TracePropagator;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TraceHeaderFilter 单元测试")
class TraceHeaderFilterTest {

    private static final String TRACE_ID = "4bf92f3577b34da6a3ce929d0e0e4736";
    private static final String PARENT_SPAN_ID = "00f067aa0ba902b7";

    private InMemoryTelemetrySink memory;
    private DefaultMonitor monitor;

    @BeforeEach
    void setUp() {
        memory = new InMemoryTelemetrySink(100);
        monitor = DefaultMonitor.builder()
                .config(TelemonConfig.builder()
                        .serviceName("web-svc")
                        .enableMetadata(false)
                        .drainTimeoutSeconds(2)
                        .build())
                .fallbackSink(memory)
                .build();
    }

    @AfterEach
    void tearDown() {
        monitor.shutdown();
    }

    private List<TelemetryEvent> spanEvents() {
        assertTrue(monitor.flush());
        return memory.getEvents(e -> e.getEventType() == EventType.SPAN);
    }

    @Nested
    @DisplayName("请求 Span")
    class RequestSpanTests {

        @Test
        @DisplayName("入站头存在时 Span 继承 trace 并回写响应头")
        void shouldContinueInboundTrace() throws Exception {
            MockHttpServletRequest request = new MockHttpServletRequest("GET", "/orders/42");
            request.addHeader(TracePropagator.TRACE_ID_HEADER, TRACE_ID);
            request.addHeader(TracePropagator.PARENT_SPAN_ID_HEADER, PARENT_SPAN_ID);
            MockHttpServletResponse response = new MockHttpServletResponse();

            new TraceHeaderFilter(monitor, true).doFilter(request, response, new MockFilterChain());

            assertEquals(TRACE_ID, response.getHeader(TracePropagator.TRACE_ID_HEADER));
            List<TelemetryEvent> spans = spanEvents();
            assertEquals(1, spans.size());
            TelemetryEvent span = spans.get(0);
            assertEquals(TRACE_ID, span.getTraceId());
            assertEquals(PARENT_SPAN_ID, span.getData().get("parent_span_id"));
            assertEquals("GET /orders/42", span.getData().get("span_name"));
            assertEquals(200, span.getData().get("http_status"));
            assertEquals("ok", span.getData().get("status"));
        }

        @Test
        @DisplayName("缺少任一头时开启新 trace")
        void shouldStartNewTraceWithoutHeaders() throws Exception {
            MockHttpServletRequest request = new MockHttpServletRequest("POST", "/orders");
            request.addHeader(TracePropagator.TRACE_ID_HEADER, TRACE_ID);
            MockHttpServletResponse response = new MockHttpServletResponse();

            new TraceHeaderFilter(monitor, true).doFilter(request, response, new MockFilterChain());

            String traceId = response.getHeader(TracePropagator.TRACE_ID_HEADER);
            assertNotNull(traceId);
            assertNotEquals(TRACE_ID, traceId);
            assertNull(spanEvents().get(0).getData().get("parent_span_id"));
        }

        @Test
        @DisplayName("下游异常时 Span 以 ERROR 结束并重新抛出")
        void shouldMarkSpanFailedOnException() {
            MockHttpServletRequest request = new MockHttpServletRequest("GET", "/boom");
            MockHttpServletResponse response = new MockHttpServletResponse();
            FilterChain chain = (req, res) -> {
                throw new ServletException("handler failed");
            };

            assertThrows(ServletException.class,
                    () -> new TraceHeaderFilter(monitor, true).doFilter(request, response, chain));

            TelemetryEvent span = spanEvents().get(0);
            assertEquals("error", span.getData().get("status"));
            assertEquals("handler failed", span.getData().get("error_message"));
            assertEquals("ServletException", span.getData().get("error_type"));
        }

        @Test
        @DisplayName("5xx 响应视为失败")
        void shouldMarkServerErrorAsFailure() throws Exception {
            MockHttpServletRequest request = new MockHttpServletRequest("GET", "/unavailable");
            MockHttpServletResponse response = new MockHttpServletResponse();
            FilterChain chain = (req, res) -> response.setStatus(503);

            new TraceHeaderFilter(monitor, true).doFilter(request, response, chain);

            assertEquals("error", spanEvents().get(0).getData().get("status"));
        }

        @Test
        @DisplayName("请求结束后线程上没有残留 Span")
        void shouldLeaveNoActiveSpan() throws Exception {
            new TraceHeaderFilter(monitor, true).doFilter(
                    new MockHttpServletRequest("GET", "/"), new MockHttpServletResponse(), new MockFilterChain());

            assertTrue(monitor.currentSpan().isEmpty());
        }
    }

    @Nested
    @DisplayName("仅继承 parent")
    class AttachOnlyTests {

        @Test
        @DisplayName("请求内新建的 Span 以入站 parent 为父")
        void shouldAttachInboundParent() throws Exception {
            MockHttpServletRequest request = new MockHttpServletRequest("GET", "/inner");
            request.addHeader(TracePropagator.TRACE_ID_HEADER, TRACE_ID);
            request.addHeader(TracePropagator.PARENT_SPAN_ID_HEADER, PARENT_SPAN_ID);
            AtomicReference<Span> inner = new AtomicReference<>();
            FilterChain chain = (req, res) -> {
                Span span = monitor.startSpan("handler", "web");
                inner.set(span);
                monitor.endSpan(span);
            };

            new TraceHeaderFilter(monitor, false).doFilter(request, new MockHttpServletResponse(), chain);

            assertEquals(TRACE_ID, inner.get().getTraceId());
            assertEquals(PARENT_SPAN_ID, inner.get().getParentSpanId());
            assertTrue(monitor.getTraceContextManager().currentContext().isEmpty());
        }

        @Test
        @DisplayName("不创建请求 Span")
        void shouldNotCreateRequestSpan() throws Exception {
            MockHttpServletResponse response = new MockHttpServletResponse();

            new TraceHeaderFilter(monitor, false).doFilter(
                    new MockHttpServletRequest("GET", "/"), response, new MockFilterChain());

            assertNull(response.getHeader(TracePropagator.TRACE_ID_HEADER));
            assertTrue(spanEvents().isEmpty());
        }
    }
}
