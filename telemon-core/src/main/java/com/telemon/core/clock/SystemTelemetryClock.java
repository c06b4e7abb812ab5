package com.telemon.core.clock;

import java.time.Instant;

public final class SystemTelemetryClock implements TelemetryClock {

    static final SystemTelemetryClock INSTANCE = new SystemTelemetryClock();

    private SystemTelemetryClock() {
    }

    @Override
    public Instant now() {
        return Instant.now();
    }

    @Override
    public long monotonicNanos() {
        return System.nanoTime();
    }
}
