package com.telemon.core.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemon.api.exception.TelemonException;
import com.telemon.api.model.EventType;
import com.telemon.api.model.HealthState;
import com.telemon.api.model.HealthStatus;
import com.telemon.api.model.LogLevel;
import com.telemon.api.model.MetricSample;
import com.telemon.api.model.ResourceUsage;
import com.telemon.api.model.TelemetryEvent;
import com.telemon.api.model.TelemetryItem;
import com.telemon.api.sink.TelemetryBatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TelemetryWireCodec 单元测试")
class TelemetryWireCodecTest {

    private static final Instant TS = Instant.parse("2024-03-01T12:30:45.123Z");

    private final TelemetryWireCodec codec = new TelemetryWireCodec();
    private final ObjectMapper mapper = new ObjectMapper();

    private static TelemetryEvent sampleEvent() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("region", "eu");
        nested.put("replicas", 3);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user_id", "u-42");
        data.put("attempt", 2);
        data.put("ratio", 0.75);
        data.put("ok", true);
        data.put("nested", nested);
        data.put("list", List.of("a", "b"));
        return TelemetryEvent.builder()
                .eventId("evt-1")
                .timestamp(TS)
                .level(LogLevel.WARNING)
                .component("checkout")
                .eventType(EventType.REQUEST)
                .message("payment slow")
                .data(data)
                .tags(new LinkedHashSet<>(List.of("env:prod", "team:pay")))
                .traceId("4bf92f3577b34da6a3ce929d0e0e4736")
                .spanId("00f067aa0ba902b7")
                .build();
    }

    @Nested
    @DisplayName("事件")
    class EventTests {

        @Test
        @DisplayName("编码后解码得到字段相等的事件")
        void eventShouldRoundTrip() {
            TelemetryEvent original = sampleEvent();

            TelemetryEvent decoded = codec.decodeEvent(codec.encode(original));

            assertEquals(original, decoded);
        }

        @Test
        @DisplayName("线格式字段名与取值")
        void eventWireFields() throws Exception {
            JsonNode node = mapper.readTree(codec.encode(sampleEvent()));

            assertEquals("evt-1", node.get("event_id").asText());
            assertEquals("2024-03-01T12:30:45.123Z", node.get("timestamp").asText());
            assertEquals("warning", node.get("level").asText());
            assertEquals("request", node.get("event_type").asText());
            assertEquals("u-42", node.get("data").get("user_id").asText());
            assertEquals(2, node.get("tags").size());
            assertFalse(node.has("kind"));
        }

        @Test
        @DisplayName("无 trace 时省略 trace_id 与 span_id")
        void shouldOmitMissingTraceIds() throws Exception {
            TelemetryEvent event = sampleEvent().toBuilder().traceId(null).spanId(null).build();

            JsonNode node = mapper.readTree(codec.encode(event));

            assertFalse(node.has("trace_id"));
            assertFalse(node.has("span_id"));
            assertNull(codec.decodeEvent(codec.encode(event)).getTraceId());
        }
    }

    @Nested
    @DisplayName("指标与健康快照")
    class OtherItemTests {

        @Test
        @DisplayName("指标样本往返")
        void metricShouldRoundTrip() {
            MetricSample sample = MetricSample.builder()
                    .name("api_call_duration_ms")
                    .value(12.5)
                    .unit("ms")
                    .tags(Map.of("api_name", "charge"))
                    .timestamp(TS)
                    .build();

            TelemetryItem decoded = codec.decode(codec.encode(sample));

            assertEquals(sample, decoded);
        }

        @Test
        @DisplayName("健康快照往返")
        void healthShouldRoundTrip() {
            HealthStatus status = HealthStatus.builder()
                    .serviceId("svc-1")
                    .serviceName("orders")
                    .status(HealthState.DEGRADED)
                    .message("db slow")
                    .version("1.2.0")
                    .uptimeSeconds(3600)
                    .resourceUsage(ResourceUsage.builder()
                            .cpuPercent(42.0)
                            .memoryPercent(61.5)
                            .memoryRss(123_456_789L)
                            .openFileDescriptors(77)
                            .timestamp(TS)
                            .build())
                    .checks(Map.of("database", false))
                    .timestamp(TS)
                    .build();

            TelemetryItem decoded = codec.decode(codec.encode(status));

            assertEquals(status, decoded);
        }
    }

    @Nested
    @DisplayName("批次")
    class BatchTests {

        @Test
        @DisplayName("批次编码为数组，每个条目附带 resource 元数据")
        void batchShouldEncodeAsArray() throws Exception {
            MetricSample metric = MetricSample.builder().name("m").value(1).timestamp(TS).build();
            TelemetryBatch batch = new TelemetryBatch("b-1", TS, List.of(sampleEvent(), metric),
                    Map.of("service", Map.of("name", "orders")));

            byte[] payload = codec.encodeBatch(batch);

            JsonNode root = mapper.readTree(new String(payload, StandardCharsets.UTF_8));
            assertTrue(root.isArray());
            assertEquals(2, root.size());
            assertEquals("orders", root.get(0).get("metadata").get("service").get("name").asText());

            List<TelemetryItem> decoded = codec.decodeBatch(payload);
            assertEquals(sampleEvent(), decoded.get(0));
            assertEquals(TelemetryItem.Kind.METRIC, decoded.get(1).getKind());
        }

        @Test
        @DisplayName("非法负载抛出 TelemonException")
        void malformedPayloadShouldFail() {
            assertThrows(TelemonException.class, () -> codec.decode("{not json"));
            assertThrows(TelemonException.class, () -> codec.decodeBatch("{}".getBytes(StandardCharsets.UTF_8)));
        }

        @Test
        @DisplayName("指标负载不能解码为事件")
        void decodeEventShouldRejectMetric() {
            String json = codec.encode(MetricSample.builder().name("m").value(1).timestamp(TS).build());

            assertThrows(TelemonException.class, () -> codec.decodeEvent(json));
        }
    }

    @Test
    @DisplayName("标签保持顺序")
    void tagsShouldKeepOrder() {
        TelemetryEvent decoded = codec.decodeEvent(codec.encode(sampleEvent()));

        Set<String> tags = decoded.getTags();
        assertEquals(List.of("env:prod", "team:pay"), List.copyOf(tags));
    }
}
