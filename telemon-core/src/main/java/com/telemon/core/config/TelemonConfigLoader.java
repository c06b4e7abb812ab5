package com.telemon.core.config;

import com.telemon.api.exception.ConfigurationException;
import com.telemon.api.model.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML 配置加载器
 * <p>
 * 读取 snake_case 键的 telemon.yml，可选地包裹在顶层 {@code telemon:} 节点下。
 * 未知键记录警告后忽略；类型错误与校验失败抛出 {@link ConfigurationException}。
 * <pre>
 * telemon:
 *   service_name: order-service
 *   api_key: ${token}
 *   batch_size: 100
 *   global_tags:
 *     team: payments
 * </pre>
 */
@Slf4j
public class TelemonConfigLoader {

    public static final String DEFAULT_RESOURCE = "telemon.yml";
    private static final String ROOT_KEY = "telemon";

    private TelemonConfigLoader() {
    }

    public static TelemonConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read config file: " + path, e);
        }
    }

    public static TelemonConfig loadFromClasspath(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = TelemonConfigLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Config resource not found on classpath: " + resource);
            }
            return load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read config resource: " + resource, e);
        }
    }

    public static TelemonConfig load(InputStream in) {
        Object document;
        try {
            document = createSafeYaml().load(in);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed YAML configuration: " + e.getMessage(), e);
        }
        if (!(document instanceof Map)) {
            throw new ConfigurationException("Configuration root must be a mapping");
        }
        Map<?, ?> root = (Map<?, ?>) document;
        if (root.size() == 1 && root.get(ROOT_KEY) instanceof Map) {
            root = (Map<?, ?>) root.get(ROOT_KEY);
        }
        return fromMap(root).validate();
    }

    /**
     * 由 snake_case 键值表构造配置（未校验）
     */
    public static TelemonConfig fromMap(Map<?, ?> values) {
        TelemonConfig.TelemonConfigBuilder builder = TelemonConfig.builder();
        for (Map.Entry<?, ?> entry : values.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            apply(builder, key, value);
        }
        return builder.build();
    }

    private static void apply(TelemonConfig.TelemonConfigBuilder builder, String key, Object value) {
        switch (key) {
            case "service_name":
                builder.serviceName(asString(key, value));
                break;
            case "api_key":
                builder.apiKey(asString(key, value));
                break;
            case "project_id":
                builder.projectId(asString(key, value));
                break;
            case "environment":
                builder.environment(asString(key, value));
                break;
            case "endpoint":
                builder.endpoint(asString(key, value));
                break;
            case "enable_metadata":
                builder.enableMetadata(asBoolean(key, value));
                break;
            case "min_log_level":
                try {
                    builder.minLogLevel(LogLevel.fromValue(asString(key, value)));
                } catch (IllegalArgumentException e) {
                    throw new ConfigurationException(key, value, "unknown log level");
                }
                break;
            case "sample_rate":
                builder.sampleRate(asDouble(key, value));
                break;
            case "deterministic_sampling":
                builder.deterministicSampling(asBoolean(key, value));
                break;
            case "redacted_keys":
                builder.redactedKeys(asStringList(key, value));
                break;
            case "global_tags":
                builder.globalTags(asStringMap(key, value));
                break;
            case "additional_metadata":
                builder.additionalMetadata(asObjectMap(key, value));
                break;
            case "batch_size":
                builder.batchSize(asInt(key, value));
                break;
            case "flush_interval_seconds":
                builder.flushIntervalSeconds(asDouble(key, value));
                break;
            case "max_queue_size":
                builder.maxQueueSize(asInt(key, value));
                break;
            case "max_pending_batches":
                builder.maxPendingBatches(asInt(key, value));
                break;
            case "drain_timeout_seconds":
                builder.drainTimeoutSeconds(asDouble(key, value));
                break;
            case "max_retries":
                builder.maxRetries(asInt(key, value));
                break;
            case "initial_backoff_millis":
                builder.initialBackoffMillis(asInt(key, value));
                break;
            case "max_backoff_millis":
                builder.maxBackoffMillis(asInt(key, value));
                break;
            case "timeout_seconds":
                builder.timeoutSeconds(asDouble(key, value));
                break;
            case "max_in_flight_deliveries":
                builder.maxInFlightDeliveries(asInt(key, value));
                break;
            case "failure_threshold":
                builder.failureThreshold(asInt(key, value));
                break;
            case "recovery_timeout_seconds":
                builder.recoveryTimeoutSeconds(asDouble(key, value));
                break;
            case "fallback_after_open_seconds":
                builder.fallbackAfterOpenSeconds(asDouble(key, value));
                break;
            case "retry_buffer_capacity":
                builder.retryBufferCapacity(asInt(key, value));
                break;
            case "local_buffer_capacity":
                builder.localBufferCapacity(asInt(key, value));
                break;
            case "console_fallback":
                builder.consoleFallback(asBoolean(key, value));
                break;
            default:
                log.warn("[Config] Ignoring unknown configuration key: {}", key);
        }
    }

    // ==================== 类型转换 ====================

    private static String asString(String key, Object value) {
        if (value instanceof Map || value instanceof Collection) {
            throw new ConfigurationException(key, value, "expected a scalar value");
        }
        return String.valueOf(value);
    }

    private static int asInt(String key, Object value) {
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (d != Math.rint(d) || d > Integer.MAX_VALUE || d < Integer.MIN_VALUE) {
                throw new ConfigurationException(key, value, "expected an integer");
            }
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key, value, "expected an integer");
        }
    }

    private static double asDouble(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key, value, "expected a number");
        }
    }

    private static boolean asBoolean(String key, Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = String.valueOf(value).trim();
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        throw new ConfigurationException(key, value, "expected true or false");
    }

    private static List<String> asStringList(String key, Object value) {
        if (!(value instanceof Collection)) {
            throw new ConfigurationException(key, value, "expected a list");
        }
        List<String> result = new ArrayList<>();
        for (Object element : (Collection<?>) value) {
            result.add(String.valueOf(element));
        }
        return result;
    }

    private static Map<String, String> asStringMap(String key, Object value) {
        if (!(value instanceof Map)) {
            throw new ConfigurationException(key, value, "expected a mapping");
        }
        Map<String, String> result = new LinkedHashMap<>();
        ((Map<?, ?>) value).forEach((k, v) -> result.put(String.valueOf(k), String.valueOf(v)));
        return result;
    }

    private static Map<String, Object> asObjectMap(String key, Object value) {
        if (!(value instanceof Map)) {
            throw new ConfigurationException(key, value, "expected a mapping");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        ((Map<?, ?>) value).forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    /**
     * 仅构造基础类型（Map / List / 标量），禁止任意类型标签
     */
    private static Yaml createSafeYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setAllowDuplicateKeys(false);
        return new Yaml(new SafeConstructor(loaderOptions));
    }
}
