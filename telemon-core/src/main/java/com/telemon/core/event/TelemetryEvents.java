package com.telemon.core.event;

import com.telemon.api.event.TelemonEvent;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 遥测子系统自监控事件集合
 */
public class TelemetryEvents {

    /**
     * 所有自监控事件的基类，按种类回调到 {@link SelfReportListener}
     */
    @Getter
    public abstract static class SelfReport implements TelemonEvent {
        private final long timestamp = System.currentTimeMillis();

        abstract void dispatchTo(SelfReportListener listener);
    }

    @Getter
    @RequiredArgsConstructor
    public static class CircuitStateChanged extends SelfReport {
        private final String breakerName;
        private final String oldState;
        private final String newState;
        private final int consecutiveFailures;

        @Override
        void dispatchTo(SelfReportListener listener) {
            listener.onCircuitStateChanged(this);
        }
    }

    /**
     * 批次在重试耗尽或永久失败后被放弃
     */
    @Getter
    @RequiredArgsConstructor
    public static class DeliveryFailed extends SelfReport {
        private final String batchId;
        private final int itemCount;
        private final int attempts;
        private final Integer statusCode;
        private final String reason;
        private final boolean permanent;

        @Override
        void dispatchTo(SelfReportListener listener) {
            listener.onDeliveryFailed(this);
        }
    }

    /**
     * 后端接收批次但拒绝了部分条目
     */
    @Getter
    @RequiredArgsConstructor
    public static class DeliveryPartial extends SelfReport {
        private final String batchId;
        private final int itemCount;
        private final int rejectedCount;
        private final String reason;

        @Override
        void dispatchTo(SelfReportListener listener) {
            listener.onDeliveryPartial(this);
        }
    }

    /**
     * 因队列溢出被丢弃的批次（重试缓冲区或投递队列）
     */
    @Getter
    @RequiredArgsConstructor
    public static class BatchDropped extends SelfReport {
        private final String batchId;
        private final int itemCount;
        private final String reason;

        @Override
        void dispatchTo(SelfReportListener listener) {
            listener.onBatchDropped(this);
        }
    }
}

