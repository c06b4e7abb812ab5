package com.telemon.core.sink;

import com.telemon.api.model.LogLevel;
import com.telemon.api.model.MetricSample;
import com.telemon.api.model.TelemetryEvent;
import com.telemon.api.model.TelemetryItem;
import com.telemon.api.sink.SendResult;
import com.telemon.api.sink.TelemetryBatch;
import com.telemon.api.sink.TelemetrySink;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("本地落点单元测试")
class InMemoryTelemetrySinkTest {

    private static TelemetryEvent event(String message, LogLevel level) {
        return TelemetryEvent.builder().eventId(message).level(level).component("c").message(message).build();
    }

    private static TelemetryBatch batch(List<? extends TelemetryItem> items) {
        return new TelemetryBatch("b", Instant.now(), items, Map.of());
    }

    private static TelemetryBatch events(int count) {
        return batch(IntStream.range(0, count)
                .mapToObj(i -> event("e" + i, LogLevel.INFO))
                .collect(Collectors.toList()));
    }

    @Nested
    @DisplayName("InMemoryTelemetrySink")
    class InMemoryTests {

        @Test
        @DisplayName("容量满时淘汰最旧条目")
        void shouldEvictOldest() {
            InMemoryTelemetrySink sink = new InMemoryTelemetrySink(3);

            sink.send(events(5));

            assertEquals(3, sink.size());
            assertEquals(2, sink.getEvictedItems());
            assertEquals(5, sink.getReceivedItems());
            assertEquals(List.of("e2", "e3", "e4"),
                    sink.getEvents().stream().map(TelemetryEvent::getMessage).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("按条件过滤事件，忽略非事件条目")
        void shouldFilterEvents() {
            InMemoryTelemetrySink sink = new InMemoryTelemetrySink(10);
            MetricSample metric = MetricSample.builder().name("m").value(1).build();

            sink.send(batch(List.of(event("a", LogLevel.INFO), event("b", LogLevel.ERROR), metric)));

            assertEquals(3, sink.getItems().size());
            assertEquals(2, sink.getEvents().size());
            assertEquals(1, sink.getEvents(e -> e.getLevel() == LogLevel.ERROR).size());
        }

        @Test
        @DisplayName("容量必须为正")
        void shouldRejectInvalidCapacity() {
            assertThrows(IllegalArgumentException.class, () -> new InMemoryTelemetrySink(0));
        }

        @Test
        @DisplayName("clear 清空缓冲")
        void clearShouldEmpty() {
            InMemoryTelemetrySink sink = new InMemoryTelemetrySink(10);
            sink.send(events(2));

            sink.clear();

            assertEquals(0, sink.size());
            assertTrue(sink.isLocal());
        }
    }

    @Nested
    @DisplayName("CompositeTelemetrySink")
    class CompositeTests {

        @Test
        @DisplayName("任一成员成功即成功，失败成员不影响其他成员")
        void anySuccessShouldWin() {
            TelemetrySink broken = mock(TelemetrySink.class);
            when(broken.send(any())).thenThrow(new IllegalStateException("disk full"));
            when(broken.getName()).thenReturn("broken");
            InMemoryTelemetrySink memory = new InMemoryTelemetrySink(10);

            SendResult result = new CompositeTelemetrySink(List.of(broken, memory)).send(events(2));

            assertTrue(result.isSuccess());
            assertEquals(2, memory.size());
        }

        @Test
        @DisplayName("全部失败时返回永久失败")
        void allFailedShouldFail() {
            TelemetrySink refusing = mock(TelemetrySink.class);
            when(refusing.send(any())).thenReturn(SendResult.permanentFailure("refused"));

            SendResult result = new CompositeTelemetrySink(List.of(refusing)).send(events(1));

            assertTrue(result.isFailure());
            assertFalse(result.isRetryable());
            assertEquals("refused", result.getMessage());
        }

        @Test
        @DisplayName("关闭所有成员，单个失败不中断")
        void closeShouldReachAllDelegates() {
            TelemetrySink first = mock(TelemetrySink.class);
            TelemetrySink second = mock(TelemetrySink.class);
            doThrow(new IllegalStateException("close failed")).when(first).close();

            new CompositeTelemetrySink(List.of(first, second)).close();

            verify(second).close();
        }
    }

    @Nested
    @DisplayName("ConsoleTelemetrySink")
    class ConsoleTests {

        @Test
        @DisplayName("事件级别映射到日志级别")
        void shouldMapLevels() {
            Logger logger = mock(Logger.class);
            ConsoleTelemetrySink sink = new ConsoleTelemetrySink(logger);

            SendResult result = sink.send(batch(List.of(
                    event("d", LogLevel.DEBUG),
                    event("w", LogLevel.WARNING),
                    event("c", LogLevel.CRITICAL))));

            assertTrue(result.isSuccess());
            verify(logger).debug(anyString(), any(Object[].class));
            verify(logger).warn(anyString(), any(Object[].class));
            verify(logger).error(anyString(), any(Object[].class));
        }

        @Test
        @DisplayName("指标以 INFO 输出")
        void shouldWriteMetrics() {
            Logger logger = mock(Logger.class);

            new ConsoleTelemetrySink(logger).send(batch(List.of(
                    MetricSample.builder().name("latency").value(3).unit("ms").build())));

            verify(logger).info(anyString(), any(Object[].class));
        }
    }
}
