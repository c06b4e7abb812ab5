package com.telemon.api.alert;

import com.telemon.api.model.LogLevel;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * 告警触发实例
 */
@Value
@Builder(toBuilder = true)
public class AlertInstance {
    String instanceId;
    String alertId;
    Instant triggeredAt;
    Instant resolvedAt;

    @Builder.Default
    AlertStatus status = AlertStatus.ACTIVE;

    double value;
    String message;
    String component;
    LogLevel severity;
    Map<String, Object> metadata;
    String acknowledgedBy;
    Instant acknowledgedAt;
    String resolutionMessage;
}
