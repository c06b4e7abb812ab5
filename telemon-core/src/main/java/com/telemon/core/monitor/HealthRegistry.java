package com.telemon.core.monitor;

import com.telemon.api.model.HealthStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 每个 serviceId 只保留最新一次健康报告
 */
public class HealthRegistry {

    private final Map<String, HealthStatus> latest = new ConcurrentHashMap<>();

    public void record(HealthStatus status) {
        if (status != null && status.getServiceId() != null) {
            latest.put(status.getServiceId(), status);
        }
    }

    public Optional<HealthStatus> get(String serviceId) {
        return serviceId == null ? Optional.empty() : Optional.ofNullable(latest.get(serviceId));
    }

    public List<HealthStatus> list() {
        return Collections.unmodifiableList(new ArrayList<>(latest.values()));
    }
}
