package com.telemon.api.alert;

import com.telemon.api.model.LogLevel;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * 告警定义
 * <p>
 * condition 仅作为描述性表达式保存，不在客户端求值。
 */
@Value
@Builder(toBuilder = true)
public class AlertConfig {

    @Builder.Default
    String alertId = UUID.randomUUID().toString();

    String name;
    String description;
    String component;
    String condition;

    @Builder.Default
    LogLevel severity = LogLevel.WARNING;

    @Singular
    List<String> notificationChannels;

    /**
     * 冷却期（秒），期间重复触发被抑制
     */
    @Builder.Default
    int cooldownSeconds = 300;

    @Builder.Default
    boolean enabled = true;

    @Singular
    List<String> tags;
}
