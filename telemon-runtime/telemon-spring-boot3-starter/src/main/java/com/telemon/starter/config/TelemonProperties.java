package com.telemon.starter.config;

import com.telemon.api.model.LogLevel;
import com.telemon.core.config.TelemonConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Telemon 配置属性
 * <p>
 * 绑定 {@code telemon.*}，转换为 {@link TelemonConfig}。
 * 未设置 service-name 时使用 spring.application.name。
 */
@Data
@ConfigurationProperties(prefix = "telemon")
public class TelemonProperties {

    /**
     * 是否启用遥测。
     */
    private boolean enabled = true;

    private String serviceName;

    /**
     * 写入令牌；为空时只使用本地回退 sink。
     */
    private String apiKey;

    private String projectId;

    private String environment = "development";

    private String endpoint = "https://api.logfire.sh/v1";

    private LogLevel minLogLevel = LogLevel.INFO;

    /**
     * 采样率 [0, 1]，WARNING 及以上级别在确定性模式下总是保留。
     */
    private double sampleRate = 1.0;

    private boolean deterministicSampling = true;

    private boolean enableMetadata = true;

    /**
     * 脱敏键片段；为空时使用内置列表。
     */
    private List<String> redactedKeys;

    private Map<String, String> globalTags = new LinkedHashMap<>();

    private Map<String, Object> additionalMetadata = new LinkedHashMap<>();

    // ==================== 批处理 ====================

    private int batchSize = 50;

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration flushInterval = Duration.ofSeconds(5);

    private int maxQueueSize = 10_000;

    private int maxPendingBatches = 100;

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration drainTimeout = Duration.ofSeconds(10);

    // ==================== 投递 ====================

    private int maxRetries = 3;

    @DurationUnit(ChronoUnit.MILLIS)
    private Duration initialBackoff = Duration.ofMillis(200);

    @DurationUnit(ChronoUnit.MILLIS)
    private Duration maxBackoff = Duration.ofSeconds(10);

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration timeout = Duration.ofSeconds(10);

    private int maxInFlightDeliveries = 1;

    // ==================== 熔断 ====================

    private int failureThreshold = 5;

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration recoveryTimeout = Duration.ofSeconds(30);

    /**
     * 熔断持续打开超过该时长后改写本地回退。
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration fallbackAfterOpen = Duration.ofMinutes(5);

    private int retryBufferCapacity = 10;

    // ==================== 本地回退 ====================

    private int localBufferCapacity = 1000;

    private boolean consoleFallback = true;

    private Web web = new Web();

    @Data
    public static class Web {

        /**
         * 是否注册入站追踪头过滤器。
         */
        private boolean tracePropagation = true;

        /**
         * 是否为每个请求开启 Span；关闭时只继承入站 parent。
         */
        private boolean requestSpans = true;
    }

    public TelemonConfig toConfig(String fallbackServiceName) {
        TelemonConfig.TelemonConfigBuilder builder = TelemonConfig.builder()
                .serviceName(serviceName != null && !serviceName.isBlank() ? serviceName : fallbackServiceName)
                .apiKey(apiKey)
                .projectId(projectId)
                .environment(environment)
                .endpoint(endpoint)
                .minLogLevel(minLogLevel)
                .sampleRate(sampleRate)
                .deterministicSampling(deterministicSampling)
                .enableMetadata(enableMetadata)
                .globalTags(globalTags)
                .additionalMetadata(additionalMetadata)
                .batchSize(batchSize)
                .flushIntervalSeconds(seconds(flushInterval))
                .maxQueueSize(maxQueueSize)
                .maxPendingBatches(maxPendingBatches)
                .drainTimeoutSeconds(seconds(drainTimeout))
                .maxRetries(maxRetries)
                .initialBackoffMillis(initialBackoff.toMillis())
                .maxBackoffMillis(maxBackoff.toMillis())
                .timeoutSeconds(seconds(timeout))
                .maxInFlightDeliveries(maxInFlightDeliveries)
                .failureThreshold(failureThreshold)
                .recoveryTimeoutSeconds(seconds(recoveryTimeout))
                .fallbackAfterOpenSeconds(seconds(fallbackAfterOpen))
                .retryBufferCapacity(retryBufferCapacity)
                .localBufferCapacity(localBufferCapacity)
                .consoleFallback(consoleFallback);
        if (redactedKeys != null && !redactedKeys.isEmpty()) {
            builder.redactedKeys(redactedKeys);
        }
        return builder.build().validate();
    }

    private static double seconds(Duration duration) {
        return duration.toMillis() / 1000.0;
    }
}
