package com.telemon.core.monitor;

import com.telemon.api.alert.AlertConfig;
import com.telemon.api.alert.AlertInstance;
import com.telemon.api.alert.AlertStatus;
import com.telemon.api.exception.AlertNotFoundException;
import com.telemon.api.exception.InvalidArgumentException;
import com.telemon.core.clock.TelemetryClock;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.Consumer;

/**
 * 告警注册表
 * <p>
 * 按 alertId 保存告警定义，按 instanceId 保存触发实例。
 * 冷却期内对同一告警的重复触发被抑制。
 * 已解决的实例最多保留 resolvedRetention 个，超出时按解决顺序淘汰最早的；未解决的实例不淘汰。
 */
@Slf4j
public class AlertRegistry {

    private final Map<String, AlertConfig> alerts = new ConcurrentHashMap<>();
    private final Map<String, AlertInstance> instances = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastTriggered = new ConcurrentHashMap<>();
    // 按解决顺序记录的 instanceId
    private final Deque<String> resolvedOrder = new ConcurrentLinkedDeque<>();
    private final TelemetryClock clock;
    private final int resolvedRetention;

    public static final int DEFAULT_RESOLVED_RETENTION = 1000;

    public AlertRegistry(TelemetryClock clock) {
        this(clock, DEFAULT_RESOLVED_RETENTION);
    }

    public AlertRegistry(TelemetryClock clock, int resolvedRetention) {
        if (resolvedRetention < 0) {
            throw new InvalidArgumentException("resolvedRetention", "Retention must be >= 0");
        }
        this.clock = clock;
        this.resolvedRetention = resolvedRetention;
    }

    public AlertConfig create(AlertConfig config) {
        if (config == null) {
            throw new InvalidArgumentException("alertConfig", "Alert config must not be null");
        }
        if (config.getName() == null || config.getName().isBlank()) {
            throw new InvalidArgumentException("name", "Alert name must not be blank");
        }
        if (config.getCooldownSeconds() < 0) {
            throw new InvalidArgumentException("cooldownSeconds", "Cooldown must be >= 0");
        }
        AlertConfig existing = alerts.putIfAbsent(config.getAlertId(), config);
        if (existing != null) {
            throw new InvalidArgumentException("alertId", "Alert already exists: " + config.getAlertId());
        }
        log.debug("[Alert] Created {} ({})", config.getName(), config.getAlertId());
        return config;
    }

    /**
     * 更新告警，alertId 保持不变
     */
    public AlertConfig update(String alertId, Consumer<AlertConfig.AlertConfigBuilder> changes) {
        AlertConfig[] updated = new AlertConfig[1];
        alerts.computeIfPresent(alertId, (id, current) -> {
            AlertConfig.AlertConfigBuilder builder = current.toBuilder();
            if (changes != null) {
                changes.accept(builder);
            }
            AlertConfig candidate = builder.alertId(id).build();
            if (candidate.getName() == null || candidate.getName().isBlank()) {
                throw new InvalidArgumentException("name", "Alert name must not be blank");
            }
            updated[0] = candidate;
            return candidate;
        });
        if (updated[0] == null) {
            throw new AlertNotFoundException(alertId);
        }
        return updated[0];
    }

    public boolean delete(String alertId) {
        boolean removed = alertId != null && alerts.remove(alertId) != null;
        if (removed) {
            lastTriggered.remove(alertId);
        }
        return removed;
    }

    public Optional<AlertConfig> get(String alertId) {
        return alertId == null ? Optional.empty() : Optional.ofNullable(alerts.get(alertId));
    }

    public List<AlertConfig> list() {
        return Collections.unmodifiableList(new ArrayList<>(alerts.values()));
    }

    // ==================== 触发实例 ====================

    /**
     * 触发告警
     *
     * @return 禁用或冷却中返回 empty
     * @throws AlertNotFoundException 告警不存在
     */
    public Optional<AlertInstance> trigger(String alertId, double value, String message) {
        AlertConfig config = alerts.get(alertId);
        if (config == null) {
            throw new AlertNotFoundException(alertId);
        }
        if (!config.isEnabled()) {
            log.debug("[Alert] {} is disabled, trigger ignored", alertId);
            return Optional.empty();
        }

        Instant now = clock.now();
        Duration cooldown = Duration.ofSeconds(config.getCooldownSeconds());
        boolean[] allowed = new boolean[1];
        lastTriggered.compute(alertId, (id, last) -> {
            if (last == null || !now.isBefore(last.plus(cooldown))) {
                allowed[0] = true;
                return now;
            }
            return last;
        });
        if (!allowed[0]) {
            log.debug("[Alert] {} in cooldown, trigger suppressed", alertId);
            return Optional.empty();
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("alert_name", config.getName());
        if (config.getCondition() != null) {
            metadata.put("condition", config.getCondition());
        }
        if (!config.getNotificationChannels().isEmpty()) {
            metadata.put("notification_channels", config.getNotificationChannels());
        }

        AlertInstance instance = AlertInstance.builder()
                .instanceId(UUID.randomUUID().toString())
                .alertId(alertId)
                .triggeredAt(now)
                .value(value)
                .message(message)
                .component(config.getComponent())
                .severity(config.getSeverity())
                .metadata(Collections.unmodifiableMap(metadata))
                .build();
        instances.put(instance.getInstanceId(), instance);
        return Optional.of(instance);
    }

    public AlertInstance acknowledge(String instanceId, String acknowledgedBy) {
        AlertInstance[] updated = new AlertInstance[1];
        instances.computeIfPresent(instanceId, (id, current) -> {
            if (current.getStatus() == AlertStatus.RESOLVED) {
                throw new InvalidArgumentException("instanceId", "Alert instance already resolved: " + id);
            }
            updated[0] = current.toBuilder()
                    .status(AlertStatus.ACKNOWLEDGED)
                    .acknowledgedBy(acknowledgedBy)
                    .acknowledgedAt(clock.now())
                    .build();
            return updated[0];
        });
        if (updated[0] == null) {
            throw new AlertNotFoundException(instanceId);
        }
        return updated[0];
    }

    public AlertInstance resolve(String instanceId, String resolutionMessage) {
        AlertInstance[] updated = new AlertInstance[1];
        boolean[] newlyResolved = new boolean[1];
        instances.computeIfPresent(instanceId, (id, current) -> {
            if (current.getStatus() == AlertStatus.RESOLVED) {
                updated[0] = current;
                return current;
            }
            updated[0] = current.toBuilder()
                    .status(AlertStatus.RESOLVED)
                    .resolvedAt(clock.now())
                    .resolutionMessage(resolutionMessage)
                    .build();
            newlyResolved[0] = true;
            return updated[0];
        });
        if (updated[0] == null) {
            throw new AlertNotFoundException(instanceId);
        }
        if (newlyResolved[0]) {
            resolvedOrder.addLast(instanceId);
            evictResolved();
        }
        return updated[0];
    }

    private void evictResolved() {
        while (resolvedOrder.size() > resolvedRetention) {
            String oldest = resolvedOrder.pollFirst();
            if (oldest == null) {
                return;
            }
            instances.remove(oldest);
            log.debug("[Alert] Evicted resolved instance {}", oldest);
        }
    }

    public List<AlertInstance> listInstances() {
        List<AlertInstance> result = new ArrayList<>(instances.values());
        result.sort((a, b) -> a.getTriggeredAt().compareTo(b.getTriggeredAt()));
        return Collections.unmodifiableList(result);
    }
}
