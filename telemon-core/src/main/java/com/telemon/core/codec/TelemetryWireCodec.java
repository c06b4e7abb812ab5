package com.telemon.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
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

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON 线格式编解码
 * <p>
 * 批次编码为条目数组。事件字段：
 * {@code event_id, timestamp, level, component, event_type, message, data, tags, trace_id?, span_id?}；
 * 指标与健康快照额外带 {@code kind} 字段（metric / health）。时间戳为 ISO-8601 UTC。
 * 批次级 resource 以 {@code metadata} 字段附在每个条目上，解码时忽略。
 */
public class TelemetryWireCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private static final String KIND_METRIC = "metric";
    private static final String KIND_HEALTH = "health";

    private final ObjectMapper mapper;

    public TelemetryWireCodec() {
        this(new ObjectMapper().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS));
    }

    public TelemetryWireCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    // ==================== 编码 ====================

    public byte[] encodeBatch(TelemetryBatch batch) {
        ArrayNode array = mapper.createArrayNode();
        for (TelemetryItem item : batch.getItems()) {
            ObjectNode node = toNode(item);
            if (!batch.getResource().isEmpty()) {
                node.set("metadata", mapper.valueToTree(batch.getResource()));
            }
            array.add(node);
        }
        try {
            return mapper.writeValueAsBytes(array);
        } catch (JsonProcessingException e) {
            throw new TelemonException("Failed to encode batch " + batch.getBatchId(), e);
        }
    }

    public String encode(TelemetryItem item) {
        try {
            return mapper.writeValueAsString(toNode(item));
        } catch (JsonProcessingException e) {
            throw new TelemonException("Failed to encode telemetry item", e);
        }
    }

    public ObjectNode toNode(TelemetryItem item) {
        if (item instanceof TelemetryEvent) {
            return eventNode((TelemetryEvent) item);
        }
        if (item instanceof MetricSample) {
            return metricNode((MetricSample) item);
        }
        if (item instanceof HealthStatus) {
            return healthNode((HealthStatus) item);
        }
        throw new TelemonException("Unsupported telemetry item: " + item.getClass().getName());
    }

    private ObjectNode eventNode(TelemetryEvent event) {
        ObjectNode node = mapper.createObjectNode();
        node.put("event_id", event.getEventId());
        node.put("timestamp", formatInstant(event.getTimestamp()));
        node.put("level", event.getLevel().value());
        node.put("component", event.getComponent());
        node.put("event_type", event.getEventType().value());
        node.put("message", event.getMessage());
        node.set("data", mapper.valueToTree(event.getData()));
        ArrayNode tags = node.putArray("tags");
        event.getTags().forEach(tags::add);
        if (event.getTraceId() != null) {
            node.put("trace_id", event.getTraceId());
        }
        if (event.getSpanId() != null) {
            node.put("span_id", event.getSpanId());
        }
        return node;
    }

    private ObjectNode metricNode(MetricSample sample) {
        ObjectNode node = mapper.createObjectNode();
        node.put("kind", KIND_METRIC);
        node.put("name", sample.getName());
        node.put("value", sample.getValue());
        if (sample.getUnit() != null) {
            node.put("unit", sample.getUnit());
        }
        node.set("tags", mapper.valueToTree(sample.getTags()));
        node.put("timestamp", formatInstant(sample.getTimestamp()));
        return node;
    }

    private ObjectNode healthNode(HealthStatus status) {
        ObjectNode node = mapper.createObjectNode();
        node.put("kind", KIND_HEALTH);
        node.put("service_id", status.getServiceId());
        node.put("service_name", status.getServiceName());
        node.put("status", status.getStatus().value());
        node.put("message", status.getMessage());
        node.put("version", status.getVersion());
        node.put("uptime_seconds", status.getUptimeSeconds());
        ResourceUsage usage = status.getResourceUsage();
        if (usage != null) {
            ObjectNode usageNode = node.putObject("resource_usage");
            usageNode.put("cpu_percent", usage.getCpuPercent());
            usageNode.put("memory_percent", usage.getMemoryPercent());
            usageNode.put("memory_rss", usage.getMemoryRss());
            usageNode.put("disk_io_read", usage.getDiskIoRead());
            usageNode.put("disk_io_write", usage.getDiskIoWrite());
            usageNode.put("network_recv", usage.getNetworkRecv());
            usageNode.put("network_sent", usage.getNetworkSent());
            usageNode.put("open_file_descriptors", usage.getOpenFileDescriptors());
            usageNode.put("timestamp", formatInstant(usage.getTimestamp()));
        }
        node.set("checks", mapper.valueToTree(status.getChecks()));
        node.put("timestamp", formatInstant(status.getTimestamp()));
        return node;
    }

    // ==================== 解码 ====================

    public List<TelemetryItem> decodeBatch(byte[] payload) {
        JsonNode root = readTree(new String(payload, StandardCharsets.UTF_8));
        if (!root.isArray()) {
            throw new TelemonException("Batch payload must be a JSON array");
        }
        List<TelemetryItem> items = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            items.add(fromNode(node));
        }
        return items;
    }

    public TelemetryItem decode(String json) {
        return fromNode(readTree(json));
    }

    public TelemetryEvent decodeEvent(String json) {
        TelemetryItem item = decode(json);
        if (!(item instanceof TelemetryEvent)) {
            throw new TelemonException("Payload is not an event: " + item.getKind());
        }
        return (TelemetryEvent) item;
    }

    public TelemetryItem fromNode(JsonNode node) {
        String kind = text(node, "kind");
        if (KIND_METRIC.equals(kind)) {
            return metricFrom(node);
        }
        if (KIND_HEALTH.equals(kind)) {
            return healthFrom(node);
        }
        return eventFrom(node);
    }

    private TelemetryEvent eventFrom(JsonNode node) {
        Set<String> tags = new LinkedHashSet<>();
        JsonNode tagsNode = node.get("tags");
        if (tagsNode != null && tagsNode.isArray()) {
            tagsNode.forEach(t -> tags.add(t.asText()));
        }
        return TelemetryEvent.builder()
                .eventId(text(node, "event_id"))
                .timestamp(parseInstant(text(node, "timestamp")))
                .level(node.hasNonNull("level") ? LogLevel.fromValue(text(node, "level")) : null)
                .component(text(node, "component"))
                .eventType(node.hasNonNull("event_type") ? EventType.fromValue(text(node, "event_type")) : null)
                .message(text(node, "message"))
                .data(mapOf(node.get("data")))
                .tags(tags)
                .traceId(text(node, "trace_id"))
                .spanId(text(node, "span_id"))
                .build();
    }

    private MetricSample metricFrom(JsonNode node) {
        Map<String, String> tags = new LinkedHashMap<>();
        JsonNode tagsNode = node.get("tags");
        if (tagsNode != null && tagsNode.isObject()) {
            tagsNode.fields().forEachRemaining(e -> tags.put(e.getKey(), e.getValue().asText()));
        }
        return MetricSample.builder()
                .name(text(node, "name"))
                .value(node.path("value").asDouble())
                .unit(text(node, "unit"))
                .tags(tags)
                .timestamp(parseInstant(text(node, "timestamp")))
                .build();
    }

    private HealthStatus healthFrom(JsonNode node) {
        Map<String, Boolean> checks = new LinkedHashMap<>();
        JsonNode checksNode = node.get("checks");
        if (checksNode != null && checksNode.isObject()) {
            checksNode.fields().forEachRemaining(e -> checks.put(e.getKey(), e.getValue().asBoolean()));
        }
        ResourceUsage usage = null;
        JsonNode usageNode = node.get("resource_usage");
        if (usageNode != null && usageNode.isObject()) {
            usage = ResourceUsage.builder()
                    .cpuPercent(usageNode.path("cpu_percent").asDouble())
                    .memoryPercent(usageNode.path("memory_percent").asDouble())
                    .memoryRss(usageNode.path("memory_rss").asLong())
                    .diskIoRead(usageNode.path("disk_io_read").asLong())
                    .diskIoWrite(usageNode.path("disk_io_write").asLong())
                    .networkRecv(usageNode.path("network_recv").asLong())
                    .networkSent(usageNode.path("network_sent").asLong())
                    .openFileDescriptors(usageNode.path("open_file_descriptors").asInt())
                    .timestamp(parseInstant(text(usageNode, "timestamp")))
                    .build();
        }
        return HealthStatus.builder()
                .serviceId(text(node, "service_id"))
                .serviceName(text(node, "service_name"))
                .status(node.hasNonNull("status") ? HealthState.fromValue(text(node, "status")) : null)
                .message(text(node, "message"))
                .version(text(node, "version"))
                .uptimeSeconds(node.path("uptime_seconds").asLong())
                .resourceUsage(usage)
                .checks(checks)
                .timestamp(parseInstant(text(node, "timestamp")))
                .build();
    }

    // ==================== 工具方法 ====================

    private JsonNode readTree(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TelemonException("Malformed telemetry payload: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> mapOf(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Collections.emptyMap();
        }
        return mapper.convertValue(node, MAP_TYPE);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String formatInstant(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    private static Instant parseInstant(String value) {
        return value == null ? null : Instant.parse(value);
    }
}
