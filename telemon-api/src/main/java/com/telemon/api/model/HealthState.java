package com.telemon.api.model;

import java.util.Locale;

public enum HealthState {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static HealthState fromValue(String value) {
        return HealthState.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
