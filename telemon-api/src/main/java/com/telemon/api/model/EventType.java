package com.telemon.api.model;

import java.util.Locale;

/**
 * 事件类型
 */
public enum EventType {
    REQUEST,
    RESPONSE,
    EXCEPTION,
    METRIC,
    LIFECYCLE,
    VALIDATION,
    AUTHENTICATION,
    SYSTEM,
    SPAN,
    HEALTH,
    ALERT;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EventType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Event type must not be null");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("AUTH".equals(normalized)) {
            return AUTHENTICATION;
        }
        return EventType.valueOf(normalized);
    }
}
