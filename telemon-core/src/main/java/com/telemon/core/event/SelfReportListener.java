package com.telemon.core.event;

/**
 * 自监控事件监听器
 * <p>
 * 按事件种类回调；未覆盖的种类落到 {@link #onSelfReport}，默认忽略。
 */
public interface SelfReportListener {

    default void onCircuitStateChanged(TelemetryEvents.CircuitStateChanged event) {
        onSelfReport(event);
    }

    default void onDeliveryFailed(TelemetryEvents.DeliveryFailed event) {
        onSelfReport(event);
    }

    default void onDeliveryPartial(TelemetryEvents.DeliveryPartial event) {
        onSelfReport(event);
    }

    default void onBatchDropped(TelemetryEvents.BatchDropped event) {
        onSelfReport(event);
    }

    default void onSelfReport(TelemetryEvents.SelfReport event) {
    }
}
