package com.telemon.api.trace;

import java.util.Locale;

public enum SpanStatus {
    OPEN,
    OK,
    ERROR;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
