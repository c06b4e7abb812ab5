package com.telemon.api.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 服务健康快照
 * <p>
 * 时间点数据，除时间戳外无身份；同一 serviceId 的新报告覆盖旧报告。
 */
@Value
public class HealthStatus implements TelemetryItem {

    String serviceId;
    String serviceName;
    HealthState status;
    String message;
    String version;
    long uptimeSeconds;
    ResourceUsage resourceUsage;
    Map<String, Boolean> checks;
    Instant timestamp;

    @Builder(toBuilder = true)
    private HealthStatus(String serviceId,
                         String serviceName,
                         HealthState status,
                         String message,
                         String version,
                         long uptimeSeconds,
                         ResourceUsage resourceUsage,
                         Map<String, Boolean> checks,
                         Instant timestamp) {
        this.serviceId = serviceId;
        this.serviceName = serviceName;
        this.status = status != null ? status : HealthState.HEALTHY;
        this.message = message != null ? message : "";
        this.version = version;
        this.uptimeSeconds = uptimeSeconds;
        this.resourceUsage = resourceUsage;
        this.checks = checks == null || checks.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(checks));
        this.timestamp = timestamp;
    }

    @Override
    public Kind getKind() {
        return Kind.HEALTH;
    }
}
