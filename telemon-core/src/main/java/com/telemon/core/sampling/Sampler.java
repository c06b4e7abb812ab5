package com.telemon.core.sampling;

import com.telemon.api.model.LogLevel;
import com.telemon.api.model.TelemetryEvent;

/**
 * 采样器：决定一条事件是否保留
 */
public interface Sampler {

    boolean admit(LogLevel level);

    default boolean admit(TelemetryEvent event) {
        return event != null && admit(event.getLevel());
    }
}
