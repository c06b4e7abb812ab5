package com.telemon.core.config;

import com.telemon.api.exception.ConfigurationException;
import com.telemon.api.model.LogLevel;
import com.telemon.core.redact.DataSanitizer;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 遥测客户端配置
 * <p>
 * apiKey 为空时不创建远端落点，所有批次走本地兜底。
 * 构造后调用 {@link #validate()}，非法值以 {@link ConfigurationException} 同步报告。
 */
@Getter
@Builder(toBuilder = true)
public class TelemonConfig {

    // ==================== 服务标识 ====================

    private String serviceName;

    /**
     * 后端写入令牌；为空表示仅本地落点
     */
    private String apiKey;

    private String projectId;

    @Builder.Default
    private String environment = "development";

    @Builder.Default
    private String endpoint = "https://api.logfire.sh/v1";

    @Builder.Default
    private boolean enableMetadata = true;

    // ==================== 过滤与采样 ====================

    @Builder.Default
    private LogLevel minLogLevel = LogLevel.INFO;

    /**
     * 采样率 [0, 1]
     */
    @Builder.Default
    private double sampleRate = 1.0;

    /**
     * WARNING 及以上级别不参与采样
     */
    @Builder.Default
    private boolean deterministicSampling = true;

    @Builder.Default
    private List<String> redactedKeys = DataSanitizer.DEFAULT_REDACTED_KEYS;

    /**
     * 附加到每条事件（key:value）与指标上的标签
     */
    @Builder.Default
    private Map<String, String> globalTags = Collections.emptyMap();

    /**
     * 附加到批次 resource 的自定义元数据
     */
    @Builder.Default
    private Map<String, Object> additionalMetadata = Collections.emptyMap();

    // ==================== 批处理 ====================

    @Builder.Default
    private int batchSize = 50;

    @Builder.Default
    private double flushIntervalSeconds = 5.0;

    /**
     * 缓冲条目上限，超出时丢弃最旧条目
     */
    @Builder.Default
    private int maxQueueSize = 10_000;

    /**
     * 等待投递的批次上限，超出时丢弃最旧批次
     */
    @Builder.Default
    private int maxPendingBatches = 100;

    @Builder.Default
    private double drainTimeoutSeconds = 10.0;

    // ==================== 投递与熔断 ====================

    @Builder.Default
    private int maxRetries = 3;

    @Builder.Default
    private long initialBackoffMillis = 200;

    @Builder.Default
    private long maxBackoffMillis = 10_000;

    @Builder.Default
    private double timeoutSeconds = 10.0;

    @Builder.Default
    private int maxInFlightDeliveries = 1;

    @Builder.Default
    private int failureThreshold = 5;

    @Builder.Default
    private double recoveryTimeoutSeconds = 30.0;

    /**
     * 熔断持续打开超过该时长后改走本地兜底
     */
    @Builder.Default
    private double fallbackAfterOpenSeconds = 300.0;

    /**
     * 熔断期间暂存的批次上限
     */
    @Builder.Default
    private int retryBufferCapacity = 10;

    // ==================== 本地兜底 ====================

    @Builder.Default
    private int localBufferCapacity = 1000;

    @Builder.Default
    private boolean consoleFallback = true;

    // ==================== 工厂方法 ====================

    /**
     * 默认配置
     */
    public static TelemonConfig defaults(String serviceName) {
        return TelemonConfig.builder().serviceName(serviceName).build();
    }

    /**
     * 开发模式配置（小批次、快速刷新、DEBUG 级别）
     */
    public static TelemonConfig development(String serviceName) {
        return TelemonConfig.builder()
                .serviceName(serviceName)
                .environment("development")
                .minLogLevel(LogLevel.DEBUG)
                .batchSize(10)
                .flushIntervalSeconds(1.0)
                .build();
    }

    /**
     * 高吞吐场景配置
     */
    public static TelemonConfig highThroughput(String serviceName) {
        return TelemonConfig.builder()
                .serviceName(serviceName)
                .environment("production")
                .batchSize(500)
                .flushIntervalSeconds(2.0)
                .maxQueueSize(100_000)
                .maxPendingBatches(200)
                .maxInFlightDeliveries(2)
                .build();
    }

    // ==================== 派生值 ====================

    public boolean hasRemoteSink() {
        return apiKey != null && !apiKey.isBlank();
    }

    public Duration getFlushInterval() {
        return seconds(flushIntervalSeconds);
    }

    public Duration getRecoveryTimeout() {
        return seconds(recoveryTimeoutSeconds);
    }

    public Duration getTimeout() {
        return seconds(timeoutSeconds);
    }

    public Duration getDrainTimeout() {
        return seconds(drainTimeoutSeconds);
    }

    public Duration getFallbackAfterOpen() {
        return seconds(fallbackAfterOpenSeconds);
    }

    private static Duration seconds(double value) {
        return Duration.ofMillis(Math.round(value * 1000));
    }

    // ==================== 校验 ====================

    /**
     * 校验所有字段
     *
     * @return this，便于链式调用
     * @throws ConfigurationException 首个非法字段
     */
    public TelemonConfig validate() {
        if (serviceName == null || serviceName.isBlank()) {
            throw new ConfigurationException("serviceName", serviceName, "must not be blank");
        }
        if (environment == null || environment.isBlank()) {
            throw new ConfigurationException("environment", environment, "must not be blank");
        }
        if (minLogLevel == null) {
            throw new ConfigurationException("minLogLevel", null, "must not be null");
        }
        if (hasRemoteSink() && (endpoint == null || endpoint.isBlank())) {
            throw new ConfigurationException("endpoint", endpoint, "required when apiKey is set");
        }
        requireRange("sampleRate", sampleRate, 0.0, 1.0);
        requireAtLeast("batchSize", batchSize, 1);
        requirePositive("flushIntervalSeconds", flushIntervalSeconds);
        requireAtLeast("maxQueueSize", maxQueueSize, batchSize);
        requireAtLeast("maxPendingBatches", maxPendingBatches, 1);
        requireAtLeast("maxRetries", maxRetries, 0);
        requireAtLeast("failureThreshold", failureThreshold, 1);
        requireNonNegative("recoveryTimeoutSeconds", recoveryTimeoutSeconds);
        requirePositive("timeoutSeconds", timeoutSeconds);
        requireAtLeast("maxInFlightDeliveries", maxInFlightDeliveries, 1);
        requireNonNegative("drainTimeoutSeconds", drainTimeoutSeconds);
        requireNonNegative("fallbackAfterOpenSeconds", fallbackAfterOpenSeconds);
        requireAtLeast("retryBufferCapacity", retryBufferCapacity, 0);
        requireAtLeast("localBufferCapacity", localBufferCapacity, 1);
        if (initialBackoffMillis < 0) {
            throw new ConfigurationException("initialBackoffMillis", initialBackoffMillis, "must be >= 0");
        }
        if (maxBackoffMillis < initialBackoffMillis) {
            throw new ConfigurationException("maxBackoffMillis", maxBackoffMillis, "must be >= initialBackoffMillis");
        }
        return this;
    }

    private static void requireAtLeast(String field, long value, long min) {
        if (value < min) {
            throw new ConfigurationException(field, value, "must be >= " + min);
        }
    }

    private static void requirePositive(String field, double value) {
        if (Double.isNaN(value) || value <= 0) {
            throw new ConfigurationException(field, value, "must be > 0");
        }
    }

    private static void requireNonNegative(String field, double value) {
        if (Double.isNaN(value) || value < 0) {
            throw new ConfigurationException(field, value, "must be >= 0");
        }
    }

    private static void requireRange(String field, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new ConfigurationException(field, value, "must be within [" + min + ", " + max + "]");
        }
    }

    @Override
    public String toString() {
        return String.format(
                "TelemonConfig{service=%s, env=%s, remote=%s, batch=%d, flush=%.1fs, sample=%.2f, retries=%d, threshold=%d}",
                serviceName, environment, hasRemoteSink() ? endpoint : "none",
                batchSize, flushIntervalSeconds, sampleRate, maxRetries, failureThreshold);
    }
}
