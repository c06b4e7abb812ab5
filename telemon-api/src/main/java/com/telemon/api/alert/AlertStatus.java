package com.telemon.api.alert;

public enum AlertStatus {
    ACTIVE,
    ACKNOWLEDGED,
    RESOLVED
}
