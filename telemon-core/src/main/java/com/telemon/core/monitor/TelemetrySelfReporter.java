package com.telemon.core.monitor;

import com.telemon.api.model.EventType;
import com.telemon.api.model.LogLevel;
import com.telemon.api.model.TelemetryEvent;
import com.telemon.core.clock.IdGenerator;
import com.telemon.core.clock.TelemetryClock;
import com.telemon.core.event.EventBus;
import com.telemon.core.event.SelfReportListener;
import com.telemon.core.event.TelemetryEvents;
import com.telemon.core.resilience.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * 将投递管线与熔断器的内部事件转换为 telemetry 组件的遥测事件
 */
@Slf4j
class TelemetrySelfReporter implements SelfReportListener {

    static final String COMPONENT = "telemetry";

    private final TelemetryClock clock;
    private final Consumer<TelemetryEvent> output;

    TelemetrySelfReporter(TelemetryClock clock, Consumer<TelemetryEvent> output) {
        this.clock = clock;
        this.output = output;
    }

    void register(EventBus eventBus, String ownerId) {
        eventBus.register(ownerId, this);
    }

    @Override
    public void onDeliveryFailed(TelemetryEvents.DeliveryFailed event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("batch_id", event.getBatchId());
        data.put("item_count", event.getItemCount());
        data.put("attempts", event.getAttempts());
        if (event.getStatusCode() != null) {
            data.put("status_code", event.getStatusCode());
        }
        data.put("reason", event.getReason());
        data.put("permanent", event.isPermanent());
        emit(LogLevel.ERROR, String.format("Telemetry batch dropped after %d attempt(s): %s",
                event.getAttempts(), event.getReason()), data);
    }

    @Override
    public void onDeliveryPartial(TelemetryEvents.DeliveryPartial event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("batch_id", event.getBatchId());
        data.put("item_count", event.getItemCount());
        data.put("rejected_count", event.getRejectedCount());
        data.put("reason", event.getReason());
        emit(LogLevel.WARNING, String.format("Telemetry batch partially accepted: %d of %d rejected",
                event.getRejectedCount(), event.getItemCount()), data);
    }

    @Override
    public void onBatchDropped(TelemetryEvents.BatchDropped event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("batch_id", event.getBatchId());
        data.put("item_count", event.getItemCount());
        data.put("reason", event.getReason());
        emit(LogLevel.WARNING, "Telemetry batch dropped: " + event.getReason(), data);
    }

    @Override
    public void onCircuitStateChanged(TelemetryEvents.CircuitStateChanged event) {
        // HALF_OPEN 试探不单独上报
        if (CircuitBreaker.State.HALF_OPEN.name().equals(event.getNewState())) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("breaker", event.getBreakerName());
        data.put("old_state", event.getOldState());
        data.put("new_state", event.getNewState());
        data.put("consecutive_failures", event.getConsecutiveFailures());
        LogLevel level = CircuitBreaker.State.OPEN.name().equals(event.getNewState())
                ? LogLevel.WARNING : LogLevel.INFO;
        emit(level, String.format("Telemetry circuit %s -> %s", event.getOldState(), event.getNewState()), data);
    }

    private void emit(LogLevel level, String message, Map<String, Object> data) {
        try {
            output.accept(TelemetryEvent.builder()
                    .eventId(IdGenerator.eventId())
                    .timestamp(clock.now())
                    .level(level)
                    .component(COMPONENT)
                    .eventType(EventType.SYSTEM)
                    .message(message)
                    .data(data)
                    .build());
        } catch (RuntimeException e) {
            log.warn("[Monitor] Failed to record self-report event: {}", e.getMessage());
        }
    }
}
