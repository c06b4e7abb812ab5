package com.telemon.core.event;

import com.telemon.api.event.TelemonEventListener;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 自监控事件总线
 * <p>
 * 熔断状态变化、投递失败、部分接收、批次丢弃经此同步分发给 {@link SelfReportListener}。
 * 监听器可接收全部种类，也可只订阅某一种；按 ownerId 整体注销。
 * 监听器抛出的运行时异常计数后传播给发布方，由发布方决定是否吞掉。
 */
@Slf4j
public class EventBus {

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    private final AtomicLong publishedEvents = new AtomicLong();
    private final AtomicLong listenerFailures = new AtomicLong();

    @Value
    static class Registration {
        String ownerId;
        Class<? extends TelemetryEvents.SelfReport> eventType;
        SelfReportListener listener;
    }

    /**
     * 注册接收全部自监控事件的监听器
     */
    public void register(String ownerId, SelfReportListener listener) {
        registrations.add(new Registration(ownerId, TelemetryEvents.SelfReport.class, listener));
    }

    /**
     * 只订阅某一种自监控事件
     */
    public <E extends TelemetryEvents.SelfReport> void subscribe(String ownerId, Class<E> eventType,
                                                                 TelemonEventListener<E> listener) {
        SelfReportListener adapter = new SelfReportListener() {
            @Override
            public void onSelfReport(TelemetryEvents.SelfReport event) {
                listener.onEvent(eventType.cast(event));
            }
        };
        registrations.add(new Registration(ownerId, eventType, adapter));
    }

    /**
     * 移除某个归属方注册的所有监听器
     */
    public void unsubscribeAll(String ownerId) {
        log.debug("[Telemetry] Removing self-report listeners for owner: {}", ownerId);
        registrations.removeIf(registration -> registration.getOwnerId().equals(ownerId));
    }

    public void publish(TelemetryEvents.SelfReport event) {
        if (event == null) {
            return;
        }
        publishedEvents.incrementAndGet();
        for (Registration registration : registrations) {
            if (!registration.getEventType().isInstance(event)) {
                continue;
            }
            try {
                if (registration.getEventType() == TelemetryEvents.SelfReport.class) {
                    event.dispatchTo(registration.getListener());
                } else {
                    registration.getListener().onSelfReport(event);
                }
            } catch (RuntimeException e) {
                listenerFailures.incrementAndGet();
                log.warn("[Telemetry] Self-report listener of {} failed on {}: {}",
                        registration.getOwnerId(), event.getClass().getSimpleName(), e.getMessage());
                throw e;
            }
        }
    }

    /**
     * 会收到该种类事件的监听器数量
     */
    public int listenerCount(Class<? extends TelemetryEvents.SelfReport> eventType) {
        int count = 0;
        for (Registration registration : registrations) {
            if (registration.getEventType().isAssignableFrom(eventType)) {
                count++;
            }
        }
        return count;
    }

    public long getPublishedEvents() {
        return publishedEvents.get();
    }

    public long getListenerFailures() {
        return listenerFailures.get();
    }
}
