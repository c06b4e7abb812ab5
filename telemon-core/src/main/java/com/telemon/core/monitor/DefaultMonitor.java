package com.telemon.core.monitor;

import com.telemon.api.alert.AlertConfig;
import com.telemon.api.alert.AlertInstance;
import com.telemon.api.model.EventType;
import com.telemon.api.model.HealthState;
import com.telemon.api.model.HealthStatus;
import com.telemon.api.model.LogConfig;
import com.telemon.api.model.LogLevel;
import com.telemon.api.model.MetricDefinition;
import com.telemon.api.model.MetricSample;
import com.telemon.api.model.MetricType;
import com.telemon.api.model.ResourceUsage;
import com.telemon.api.model.TelemetryEvent;
import com.telemon.api.model.TelemetryHealth;
import com.telemon.api.monitor.Monitor;
import com.telemon.api.sink.TelemetrySink;
import com.telemon.api.trace.Span;
import com.telemon.api.trace.SpanContext;
import com.telemon.api.trace.SpanScope;
import com.telemon.api.trace.SpanStatus;
import com.telemon.api.exception.InvalidArgumentException;
import com.telemon.core.batch.BatchingEngine;
import com.telemon.core.clock.IdGenerator;
import com.telemon.core.clock.TelemetryClock;
import com.telemon.core.config.TelemonConfig;
import com.telemon.core.delivery.DeliveryOutcome;
import com.telemon.core.delivery.DeliveryPipeline;
import com.telemon.core.event.EventBus;
import com.telemon.core.redact.DataSanitizer;
import com.telemon.core.resilience.CircuitBreaker;
import com.telemon.core.resilience.CircuitSnapshot;
import com.telemon.core.resilience.ConsecutiveFailureCircuitBreaker;
import com.telemon.core.sampling.LevelAwareSampler;
import com.telemon.core.sampling.Sampler;
import com.telemon.core.sink.CompositeTelemetrySink;
import com.telemon.core.sink.ConsoleTelemetrySink;
import com.telemon.core.sink.HttpTelemetrySink;
import com.telemon.core.sink.InMemoryTelemetrySink;
import com.telemon.core.trace.DefaultSpanScope;
import com.telemon.core.trace.TraceContextManager;
import com.telemon.core.util.DaemonThreadFactory;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 遥测门面的默认实现
 * <p>
 * 职责：
 * 1. 按 LogConfig 过滤、按级别采样、脱敏后将事件交给批处理引擎
 * 2. 维护 Span 栈并在 Span 结束时产出终态事件
 * 3. 指标、健康、告警的本地注册表
 * 4. 将投递管线的内部状态变化回报为 telemetry 组件的事件
 * <p>
 * 生产者方法不抛异常：内部错误记录日志后丢弃该条目。
 */
@Slf4j
public class DefaultMonitor implements Monitor {

    private static final String SELF_COMPONENT = TelemetrySelfReporter.COMPONENT;

    private final TelemonConfig config;
    private final TelemetryClock clock;
    private final String ownerId = "monitor-" + UUID.randomUUID();

    private final EventBus eventBus = new EventBus();
    private final CircuitBreaker breaker;
    private final TelemetrySink remoteSink;
    private final TelemetrySink fallbackSink;
    private final InMemoryTelemetrySink localSink;
    private final ScheduledExecutorService scheduler;
    private final DeliveryPipeline pipeline;
    private final BatchingEngine engine;

    private final Sampler sampler;
    private final DataSanitizer sanitizer;
    private final TraceContextManager traceContext;
    private final Set<String> globalTags;
    private final Map<String, String> globalMetricTags;

    private final MetricRegistry metricRegistry = new MetricRegistry();
    private final HealthRegistry healthRegistry = new HealthRegistry();
    private final AlertRegistry alertRegistry;

    private volatile LogConfig logConfig;

    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final AtomicLong sampledOut = new AtomicLong();
    private final AtomicLong filteredOut = new AtomicLong();
    private volatile boolean drainedOnShutdown;

    public DefaultMonitor(TelemonConfig config) {
        this(config, null, null, null, null);
    }

    /**
     * @param config       配置，构造时校验
     * @param remoteSink   远端 sink；为 null 时按配置决定是否创建 HTTP sink
     * @param fallbackSink 本地回退 sink；为 null 时使用内存缓冲（加控制台输出）
     * @param clock        时钟；为 null 时使用系统时钟
     * @param sampler      采样器；为 null 时按配置创建
     */
    @Builder
    private DefaultMonitor(TelemonConfig config,
                           TelemetrySink remoteSink,
                           TelemetrySink fallbackSink,
                           TelemetryClock clock,
                           Sampler sampler) {
        if (config == null) {
            throw new InvalidArgumentException("config", "Telemetry config must not be null");
        }
        this.config = config.validate();
        this.clock = clock != null ? clock : TelemetryClock.system();

        this.sanitizer = new DataSanitizer(config.getRedactedKeys());
        this.sampler = sampler != null
                ? sampler
                : new LevelAwareSampler(config.getSampleRate(), config.isDeterministicSampling());
        this.globalTags = toTagSet(config.getGlobalTags());
        this.globalMetricTags = config.getGlobalTags() != null
                ? new LinkedHashMap<>(config.getGlobalTags())
                : new LinkedHashMap<>();
        this.alertRegistry = new AlertRegistry(this.clock);
        this.logConfig = LogConfig.builder()
                .serviceName(config.getServiceName())
                .environment(config.getEnvironment())
                .minLevel(config.getMinLogLevel())
                .build();

        // 本地回退
        if (fallbackSink != null) {
            this.localSink = fallbackSink instanceof InMemoryTelemetrySink ? (InMemoryTelemetrySink) fallbackSink : null;
            this.fallbackSink = fallbackSink;
        } else {
            this.localSink = new InMemoryTelemetrySink(config.getLocalBufferCapacity());
            this.fallbackSink = config.isConsoleFallback()
                    ? new CompositeTelemetrySink(List.of(localSink, new ConsoleTelemetrySink()))
                    : localSink;
        }

        // 远端
        if (remoteSink != null) {
            this.remoteSink = remoteSink;
        } else if (config.hasRemoteSink()) {
            this.remoteSink = new HttpTelemetrySink(config.getEndpoint(), config.getApiKey(),
                    config.getProjectId(), config.getTimeout());
        } else {
            this.remoteSink = null;
        }

        this.breaker = new ConsecutiveFailureCircuitBreaker(SELF_COMPONENT, config.getFailureThreshold(),
                config.getRecoveryTimeout(), this.clock, eventBus);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(
                new DaemonThreadFactory("telemon-scheduler", false));
        this.pipeline = new DeliveryPipeline(config, this.remoteSink, this.fallbackSink, breaker, scheduler, eventBus);

        Map<String, Object> resource = ServiceMetadataCollector.collect(config.getServiceName(),
                config.getEnvironment(), config.isEnableMetadata(), config.getAdditionalMetadata());
        this.engine = new BatchingEngine(config, pipeline, scheduler, this.clock, resource);

        this.traceContext = new TraceContextManager(this.clock, this::enqueueInternal);
        new TelemetrySelfReporter(this.clock, this::enqueueInternal).register(eventBus, ownerId);

        engine.start();
        log.info("[Monitor] Telemetry initialized for service {} in {} environment (remote={})",
                config.getServiceName(), config.getEnvironment(), this.remoteSink != null);
    }

    // ==================== 日志 ====================

    @Override
    public void log(LogLevel level, String message, String component, EventType eventType,
                    Map<String, ?> data, Collection<String> tags, String traceId) {
        try {
            LogLevel effectiveLevel = level != null ? level : LogLevel.INFO;
            EventType effectiveType = eventType != null ? eventType : EventType.SYSTEM;
            LogConfig filter = logConfig;
            if (!filter.accepts(effectiveLevel, component, effectiveType)) {
                filteredOut.incrementAndGet();
                return;
            }
            if (!sampler.admit(effectiveLevel)) {
                sampledOut.incrementAndGet();
                return;
            }

            Map<String, Object> payload = new LinkedHashMap<>(sanitizer.sanitize(data));
            if (filter.getAdditionalFields() != null && !filter.getAdditionalFields().isEmpty()) {
                for (Map.Entry<String, Object> field : sanitizer.sanitize(filter.getAdditionalFields()).entrySet()) {
                    payload.putIfAbsent(field.getKey(), field.getValue());
                }
            }

            String resolvedTraceId = traceId;
            String spanId = null;
            Optional<SpanContext> active = traceContext.currentContext();
            if (active.isPresent() && (traceId == null || traceId.equals(active.get().traceId()))) {
                resolvedTraceId = active.get().traceId();
                spanId = active.get().spanId();
            }

            engine.enqueue(TelemetryEvent.builder()
                    .eventId(IdGenerator.eventId())
                    .timestamp(clock.now())
                    .level(effectiveLevel)
                    .component(component)
                    .eventType(effectiveType)
                    .message(message)
                    .data(payload)
                    .tags(mergeTags(tags))
                    .traceId(resolvedTraceId)
                    .spanId(spanId)
                    .build());
        } catch (RuntimeException e) {
            log.warn("[Monitor] Failed to record event from {}: {}", component, e.getMessage());
        }
    }

    /**
     * 内部事件（Span 终态、自上报）不经过过滤与采样，只做脱敏与全局标签
     */
    private void enqueueInternal(TelemetryEvent event) {
        try {
            engine.enqueue(event.toBuilder()
                    .data(sanitizer.sanitize(event.getData()))
                    .tags(mergeTags(event.getTags()))
                    .build());
        } catch (RuntimeException e) {
            log.warn("[Monitor] Failed to record internal event: {}", e.getMessage());
        }
    }

    // ==================== 追踪 ====================

    @Override
    public Span startSpan(String name, String component, Map<String, ?> attributes) {
        return traceContext.startSpan(name, component, sanitizer.sanitize(attributes));
    }

    @Override
    public Span startSpan(String name, String component, SpanContext parent, Map<String, ?> attributes) {
        return traceContext.startSpan(name, component, parent, sanitizer.sanitize(attributes));
    }

    @Override
    public void endSpan(Span span, SpanStatus status, Map<String, ?> data, String errorMessage) {
        try {
            traceContext.endSpan(span, status, data, errorMessage);
        } catch (RuntimeException e) {
            log.warn("[Monitor] Failed to end span: {}", e.getMessage());
        }
    }

    @Override
    public SpanScope span(String name, String component) {
        return new DefaultSpanScope(traceContext, this, startSpan(name, component, null));
    }

    @Override
    public Optional<Span> currentSpan() {
        return traceContext.currentSpan();
    }

    // ==================== 指标 ====================

    @Override
    public void recordMetric(String name, double value, String unit, Map<String, String> tags) {
        try {
            if (name == null || name.isBlank()) {
                log.warn("[Monitor] Metric without name ignored");
                return;
            }
            if (!Double.isFinite(value)) {
                log.debug("[Monitor] Non-finite value for metric {} ignored", name);
                return;
            }
            metricRegistry.ensureRegistered(name, unit);
            Map<String, String> merged = new LinkedHashMap<>(globalMetricTags);
            if (tags != null) {
                merged.putAll(tags);
            }
            engine.enqueue(MetricSample.builder()
                    .name(name)
                    .value(value)
                    .unit(unit)
                    .tags(merged)
                    .timestamp(clock.now())
                    .build());
        } catch (RuntimeException e) {
            log.warn("[Monitor] Failed to record metric {}: {}", name, e.getMessage());
        }
    }

    @Override
    public MetricDefinition registerMetric(String name, String description, String unit, MetricType type) {
        return metricRegistry.register(name, description, unit, type);
    }

    @Override
    public List<MetricDefinition> getMetrics() {
        return metricRegistry.list();
    }

    @Override
    public void recordApiCall(String apiName, int statusCode, double durationMs, String component,
                              Map<String, ?> requestData, Map<String, ?> responseData, String error) {
        boolean success = statusCode >= 200 && statusCode < 300;
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("api_name", apiName);
        data.put("status_code", statusCode);
        data.put("duration_ms", durationMs);
        data.put("success", success);
        if (requestData != null && !requestData.isEmpty()) {
            data.put("request", requestData);
        }
        if (responseData != null && !responseData.isEmpty()
                && (success || logConfig.getMinLevel() == LogLevel.DEBUG)) {
            data.put("response", responseData);
        }
        if (error != null) {
            data.put("error", error);
        }
        String message = String.format("API call to %s %s with status %d",
                apiName, success ? "succeeded" : "failed", statusCode);
        log(success ? LogLevel.INFO : LogLevel.ERROR, message, component, EventType.REQUEST, data, null, null);

        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("api_name", String.valueOf(apiName));
        tags.put("status_code", String.valueOf(statusCode));
        tags.put("success", String.valueOf(success));
        tags.put("component", String.valueOf(component));
        recordMetric("api_call_duration_ms", durationMs, "ms", tags);
    }

    @Override
    public void recordPerformance(String operation, double durationMs, String component, boolean success,
                                  Map<String, ?> details) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("operation", operation);
        data.put("duration_ms", durationMs);
        data.put("success", success);
        if (details != null && !details.isEmpty()) {
            data.put("details", details);
        }
        log(LogLevel.INFO, String.format(Locale.ROOT, "Performance: %s took %.2fms", operation, durationMs),
                component, EventType.METRIC, data, null, null);

        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("operation", String.valueOf(operation));
        tags.put("component", String.valueOf(component));
        tags.put("success", String.valueOf(success));
        recordMetric("operation_duration_ms", durationMs, "ms", tags);
    }

    @Override
    public void recordModelValidation(String modelName, boolean success, Map<String, ?> data, String error,
                                      String component) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model_name", modelName);
        payload.put("success", success);
        if (data != null && !data.isEmpty()) {
            payload.put("validation_data", data);
        }
        if (error != null) {
            payload.put("error", error);
        }
        String message = String.format("Model validation %s: %s", success ? "succeeded" : "failed", modelName);
        log(success ? LogLevel.INFO : LogLevel.ERROR, message, component, EventType.VALIDATION, payload, null, null);
    }

    // ==================== 健康 ====================

    @Override
    public void recordHealthStatus(HealthStatus status) {
        if (status == null || status.getServiceId() == null) {
            log.warn("[Monitor] Health status without service id ignored");
            return;
        }
        HealthStatus stamped = status.getTimestamp() != null
                ? status
                : status.toBuilder().timestamp(clock.now()).build();
        healthRegistry.record(stamped);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("service_id", stamped.getServiceId());
        data.put("service_name", stamped.getServiceName());
        data.put("status", stamped.getStatus().value());
        data.put("version", stamped.getVersion());
        data.put("uptime_seconds", stamped.getUptimeSeconds());
        if (!stamped.getChecks().isEmpty()) {
            data.put("checks", stamped.getChecks());
        }
        ResourceUsage usage = stamped.getResourceUsage();
        if (usage != null) {
            Map<String, Object> resource = new LinkedHashMap<>();
            resource.put("cpu_percent", usage.getCpuPercent());
            resource.put("memory_percent", usage.getMemoryPercent());
            resource.put("memory_rss", usage.getMemoryRss());
            resource.put("open_file_descriptors", usage.getOpenFileDescriptors());
            data.put("resource_usage", resource);
        }
        log(levelOf(stamped.getStatus()),
                String.format("Health status: %s - %s", stamped.getStatus().value(), stamped.getMessage()),
                SELF_COMPONENT, EventType.HEALTH, data, null, null);

        try {
            engine.enqueue(stamped);
        } catch (RuntimeException e) {
            log.warn("[Monitor] Failed to record health status {}: {}", stamped.getServiceId(), e.getMessage());
        }

        if (usage != null) {
            Map<String, String> tags = Map.of("service_id", stamped.getServiceId());
            recordMetric("cpu_usage_percent", usage.getCpuPercent(), "percent", tags);
            recordMetric("memory_usage_percent", usage.getMemoryPercent(), "percent", tags);
            recordMetric("memory_rss_bytes", usage.getMemoryRss(), "bytes", tags);
        }
    }

    private static LogLevel levelOf(HealthState state) {
        switch (state) {
            case DEGRADED:
                return LogLevel.WARNING;
            case UNHEALTHY:
                return LogLevel.ERROR;
            default:
                return LogLevel.INFO;
        }
    }

    @Override
    public Optional<HealthStatus> getHealthStatus(String serviceId) {
        return healthRegistry.get(serviceId);
    }

    @Override
    public List<HealthStatus> getHealthStatuses() {
        return healthRegistry.list();
    }

    @Override
    public TelemetryHealth getTelemetryHealth() {
        CircuitSnapshot snapshot = breaker.snapshot();
        return TelemetryHealth.builder()
                .circuitState(snapshot.getState().name())
                .consecutiveFailures(snapshot.getConsecutiveFailures())
                .remoteSinkConfigured(remoteSink != null)
                .shutdown(shutdown.get())
                .enqueuedItems(engine.getEnqueuedItems())
                .droppedItems(engine.getDroppedItems())
                .pendingItems(engine.getPendingItems())
                .deliveredBatches(pipeline.getDeliveredBatches())
                .partialBatches(pipeline.getPartialBatches())
                .failedBatches(pipeline.getFailedBatches())
                .shortCircuitedBatches(pipeline.getShortCircuitedBatches())
                .fallbackBatches(pipeline.getFallbackBatches())
                .retryBufferSize(pipeline.getRetryBufferSize())
                .build();
    }

    // ==================== 告警 ====================

    @Override
    public AlertConfig createAlert(AlertConfig alertConfig) {
        AlertConfig created = alertRegistry.create(alertConfig);
        log(LogLevel.INFO, "Alert created: " + created.getName(), SELF_COMPONENT, EventType.SYSTEM,
                Map.of("alert_id", created.getAlertId()), null, null);
        return created;
    }

    @Override
    public AlertConfig updateAlert(String alertId, Consumer<AlertConfig.AlertConfigBuilder> changes) {
        AlertConfig updated = alertRegistry.update(alertId, changes);
        log(LogLevel.INFO, "Alert updated: " + updated.getName(), SELF_COMPONENT, EventType.SYSTEM,
                Map.of("alert_id", alertId), null, null);
        return updated;
    }

    @Override
    public boolean deleteAlert(String alertId) {
        boolean removed = alertRegistry.delete(alertId);
        if (removed) {
            log(LogLevel.INFO, "Alert deleted: " + alertId, SELF_COMPONENT, EventType.SYSTEM,
                    Map.of("alert_id", alertId), null, null);
        }
        return removed;
    }

    @Override
    public List<AlertConfig> getAlerts() {
        return alertRegistry.list();
    }

    @Override
    public Optional<AlertInstance> triggerAlert(String alertId, double value, String message) {
        Optional<AlertInstance> triggered = alertRegistry.trigger(alertId, value, message);
        triggered.ifPresent(instance -> {
            Map<String, Object> data = new LinkedHashMap<>(instance.getMetadata());
            data.put("alert_id", instance.getAlertId());
            data.put("instance_id", instance.getInstanceId());
            data.put("value", instance.getValue());
            String component = instance.getComponent() != null ? instance.getComponent() : SELF_COMPONENT;
            log(instance.getSeverity(), "Alert triggered: " + instance.getMetadata().get("alert_name")
                    + " - " + message, component, EventType.ALERT, data, null, null);
        });
        return triggered;
    }

    @Override
    public List<AlertInstance> getAlertInstances() {
        return alertRegistry.listInstances();
    }

    @Override
    public AlertInstance acknowledgeAlert(String instanceId, String acknowledgedBy) {
        AlertInstance instance = alertRegistry.acknowledge(instanceId, acknowledgedBy);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("instance_id", instanceId);
        data.put("acknowledged_by", acknowledgedBy);
        log(LogLevel.INFO, "Alert acknowledged: " + instanceId, SELF_COMPONENT, EventType.ALERT, data, null, null);
        return instance;
    }

    @Override
    public AlertInstance resolveAlert(String instanceId, String resolutionMessage) {
        AlertInstance instance = alertRegistry.resolve(instanceId, resolutionMessage);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("instance_id", instanceId);
        data.put("resolution_message", resolutionMessage);
        log(LogLevel.INFO, "Alert resolved: " + instanceId, SELF_COMPONENT, EventType.ALERT, data, null, null);
        return instance;
    }

    // ==================== 配置与生命周期 ====================

    @Override
    public LogConfig updateLogConfig(LogConfig newConfig) {
        if (newConfig == null) {
            throw new InvalidArgumentException("logConfig", "Log config must not be null");
        }
        if (newConfig.getMinLevel() == null) {
            throw new InvalidArgumentException("minLevel", "Minimum level must not be null");
        }
        LogConfig previous = this.logConfig;
        this.logConfig = newConfig;
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("previous_min_level", previous.getMinLevel().value());
        data.put("min_level", newConfig.getMinLevel().value());
        log(LogLevel.INFO, "Log configuration updated", SELF_COMPONENT, EventType.SYSTEM, data, null, null);
        return newConfig;
    }

    @Override
    public LogConfig getLogConfig() {
        return logConfig;
    }

    /**
     * 立即交付当前批次并等待结果，最长等待 drainTimeout
     *
     * @return 批次已被远端或本地回退接收
     */
    @Override
    public boolean flush() {
        try {
            DeliveryOutcome outcome = engine.flush()
                    .get(config.getDrainTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return outcome.isPersisted();
        } catch (TimeoutException e) {
            log.warn("[Monitor] Flush did not complete within {}", config.getDrainTimeout());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | RuntimeException e) {
            log.warn("[Monitor] Flush failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * 幂等关闭：排空批次、关闭 sink 与调度线程
     *
     * @return 排空是否在 drainTimeout 内完成
     */
    @Override
    public boolean shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return drainedOnShutdown;
        }
        log.info("[Monitor] Shutting down telemetry for service {}", config.getServiceName());
        boolean drained = false;
        try {
            drained = engine.shutdown();
        } catch (RuntimeException e) {
            log.error("[Monitor] Error while draining telemetry", e);
        }
        eventBus.unsubscribeAll(ownerId);
        closeQuietly(remoteSink);
        closeQuietly(fallbackSink);
        scheduler.shutdownNow();
        traceContext.clear();
        drainedOnShutdown = drained;
        log.info("[Monitor] Telemetry shut down (drained={}, dropped={})", drained, engine.getDroppedItems());
        return drained;
    }

    private static void closeQuietly(TelemetrySink sink) {
        if (sink == null) {
            return;
        }
        try {
            sink.close();
        } catch (Exception e) {
            log.warn("[Monitor] Failed to close sink {}: {}", sink.getName(), e.getMessage());
        }
    }

    // ==================== 辅助 ====================

    private Set<String> mergeTags(Collection<String> tags) {
        if ((tags == null || tags.isEmpty()) && globalTags.isEmpty()) {
            return null;
        }
        Set<String> merged = new LinkedHashSet<>(globalTags);
        if (tags != null) {
            for (String tag : tags) {
                if (tag != null) {
                    merged.add(tag);
                }
            }
        }
        return merged;
    }

    private static Set<String> toTagSet(Map<String, String> tags) {
        Set<String> result = new LinkedHashSet<>();
        if (tags != null) {
            tags.forEach((k, v) -> result.add(k + ":" + v));
        }
        return result;
    }

    public TelemonConfig getConfig() {
        return config;
    }

    public TraceContextManager getTraceContextManager() {
        return traceContext;
    }

    public CircuitBreaker getBreaker() {
        return breaker;
    }

    /**
     * 默认回退缓冲；注入了非内存回退 sink 时为 empty
     */
    public Optional<InMemoryTelemetrySink> getLocalSink() {
        return Optional.ofNullable(localSink);
    }

    public long getSampledOutCount() {
        return sampledOut.get();
    }

    public long getFilteredOutCount() {
        return filteredOut.get();
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    BatchingEngine getEngine() {
        return engine;
    }

    List<String> getGlobalTags() {
        return new ArrayList<>(globalTags);
    }
}
