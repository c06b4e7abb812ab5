package com.telemon.api.monitor;

import com.telemon.api.alert.AlertConfig;
import com.telemon.api.alert.AlertInstance;
import com.telemon.api.model.EventType;
import com.telemon.api.model.HealthStatus;
import com.telemon.api.model.LogConfig;
import com.telemon.api.model.LogLevel;
import com.telemon.api.model.MetricDefinition;
import com.telemon.api.model.MetricType;
import com.telemon.api.model.TelemetryHealth;
import com.telemon.api.trace.Span;
import com.telemon.api.trace.SpanContext;
import com.telemon.api.trace.SpanScope;
import com.telemon.api.trace.SpanStatus;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 监控门面
 * <p>
 * 应用代码唯一需要依赖的入口。所有日志 / 指标 / Span 调用在入队后立即返回，
 * 不等待网络 I/O，也不会因后端不可用而抛出异常。
 * <p>
 * 实例通过显式生命周期获得（init 返回句柄，shutdown 释放），不存在隐式全局单例。
 */
public interface Monitor extends AutoCloseable {

    // ==================== 日志 ====================

    /**
     * 记录事件
     *
     * @param level     日志级别
     * @param message   消息
     * @param component 服务组件
     * @param eventType 事件类型
     * @param data      结构化数据，入队前脱敏
     * @param tags      标签
     * @param traceId   显式 traceId；为 null 时取当前活动 Span
     */
    void log(LogLevel level, String message, String component, EventType eventType,
             Map<String, ?> data, Collection<String> tags, String traceId);

    default void log(LogLevel level, String message, String component, EventType eventType) {
        log(level, message, component, eventType, null, null, null);
    }

    default void log(LogLevel level, String message, String component, EventType eventType, Map<String, ?> data) {
        log(level, message, component, eventType, data, null, null);
    }

    default void debug(String message, String component, EventType eventType) {
        log(LogLevel.DEBUG, message, component, eventType, null, null, null);
    }

    default void debug(String message, String component, EventType eventType, Map<String, ?> data) {
        log(LogLevel.DEBUG, message, component, eventType, data, null, null);
    }

    default void info(String message, String component, EventType eventType) {
        log(LogLevel.INFO, message, component, eventType, null, null, null);
    }

    default void info(String message, String component, EventType eventType, Map<String, ?> data) {
        log(LogLevel.INFO, message, component, eventType, data, null, null);
    }

    default void info(String message, String component, EventType eventType, Map<String, ?> data,
                      Collection<String> tags) {
        log(LogLevel.INFO, message, component, eventType, data, tags, null);
    }

    default void warning(String message, String component, EventType eventType) {
        log(LogLevel.WARNING, message, component, eventType, null, null, null);
    }

    default void warning(String message, String component, EventType eventType, Map<String, ?> data) {
        log(LogLevel.WARNING, message, component, eventType, data, null, null);
    }

    default void error(String message, String component, EventType eventType) {
        log(LogLevel.ERROR, message, component, eventType, null, null, null);
    }

    default void error(String message, String component, EventType eventType, Map<String, ?> data) {
        log(LogLevel.ERROR, message, component, eventType, data, null, null);
    }

    /**
     * 记录异常，附带 error_type / error_message
     */
    default void error(String message, String component, EventType eventType, Throwable error) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (error != null) {
            data.put("error_type", error.getClass().getSimpleName());
            data.put("error_message", String.valueOf(error.getMessage()));
        }
        log(LogLevel.ERROR, message, component, eventType, data, null, null);
    }

    default void critical(String message, String component, EventType eventType) {
        log(LogLevel.CRITICAL, message, component, eventType, null, null, null);
    }

    default void critical(String message, String component, EventType eventType, Map<String, ?> data) {
        log(LogLevel.CRITICAL, message, component, eventType, data, null, null);
    }

    // ==================== 追踪 ====================

    /**
     * 开启 Span，parent 取当前执行上下文中的活动 Span；没有则成为新 trace 的根
     */
    Span startSpan(String name, String component, Map<String, ?> attributes);

    default Span startSpan(String name, String component) {
        return startSpan(name, component, null);
    }

    /**
     * 以显式 parent 开启 Span（通常来自跨进程传播）；parent 为 null 时等同于新根
     */
    Span startSpan(String name, String component, SpanContext parent, Map<String, ?> attributes);

    /**
     * 结束 Span；对已结束的 Span 重复调用为空操作
     */
    void endSpan(Span span, SpanStatus status, Map<String, ?> data, String errorMessage);

    default void endSpan(Span span) {
        endSpan(span, SpanStatus.OK, null, null);
    }

    default void endSpan(Span span, SpanStatus status) {
        endSpan(span, status, null, null);
    }

    default void endSpan(Span span, SpanStatus status, Map<String, ?> data) {
        endSpan(span, status, data, null);
    }

    /**
     * 作用域式 Span，配合 try-with-resources
     */
    SpanScope span(String name, String component);

    Optional<Span> currentSpan();

    // ==================== 指标 ====================

    void recordMetric(String name, double value, String unit, Map<String, String> tags);

    default void recordMetric(String name, double value) {
        recordMetric(name, value, null, null);
    }

    default void recordMetric(String name, double value, Map<String, String> tags) {
        recordMetric(name, value, null, tags);
    }

    MetricDefinition registerMetric(String name, String description, String unit, MetricType type);

    List<MetricDefinition> getMetrics();

    /**
     * 记录一次 API 调用：REQUEST 事件 + api_call_duration_ms 指标
     */
    void recordApiCall(String apiName, int statusCode, double durationMs, String component,
                       Map<String, ?> requestData, Map<String, ?> responseData, String error);

    /**
     * 记录一次操作耗时：METRIC 事件 + operation_duration_ms 指标
     */
    void recordPerformance(String operation, double durationMs, String component, boolean success,
                           Map<String, ?> details);

    /**
     * 记录模型校验结果：VALIDATION 事件
     */
    void recordModelValidation(String modelName, boolean success, Map<String, ?> data, String error,
                               String component);

    // ==================== 健康 ====================

    void recordHealthStatus(HealthStatus status);

    Optional<HealthStatus> getHealthStatus(String serviceId);

    List<HealthStatus> getHealthStatuses();

    /**
     * 遥测子系统自身状态（熔断、积压、丢弃计数）
     */
    TelemetryHealth getTelemetryHealth();

    // ==================== 告警 ====================

    AlertConfig createAlert(AlertConfig alertConfig);

    /**
     * 更新告警；alertId 不可变更
     *
     * @throws com.telemon.api.exception.AlertNotFoundException 告警不存在
     */
    AlertConfig updateAlert(String alertId, Consumer<AlertConfig.AlertConfigBuilder> changes);

    boolean deleteAlert(String alertId);

    List<AlertConfig> getAlerts();

    default List<AlertConfig> getAlerts(Predicate<AlertConfig> filter) {
        return getAlerts().stream().filter(filter).collect(Collectors.toList());
    }

    /**
     * 触发告警；告警被禁用或处于冷却期时返回 empty
     */
    Optional<AlertInstance> triggerAlert(String alertId, double value, String message);

    List<AlertInstance> getAlertInstances();

    default List<AlertInstance> getAlertInstances(Predicate<AlertInstance> filter) {
        return getAlertInstances().stream().filter(filter).collect(Collectors.toList());
    }

    AlertInstance acknowledgeAlert(String instanceId, String acknowledgedBy);

    AlertInstance resolveAlert(String instanceId, String resolutionMessage);

    // ==================== 配置与生命周期 ====================

    LogConfig updateLogConfig(LogConfig logConfig);

    LogConfig getLogConfig();

    /**
     * 立即投递积压数据，在 drain 超时内等待结果
     *
     * @return 批次已送达（远端或本地兜底）返回 true
     */
    boolean flush();

    /**
     * 最终 flush 并释放后台线程；幂等
     */
    boolean shutdown();

    @Override
    default void close() {
        shutdown();
    }
}
