package com.telemon.core.event;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EventBus 单元测试")
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    @Test
    @DisplayName("按事件具体类型分发")
    void shouldDispatchByType() {
        List<Object> dropped = new ArrayList<>();
        List<Object> failed = new ArrayList<>();
        eventBus.subscribe("a", TelemetryEvents.BatchDropped.class, dropped::add);
        eventBus.subscribe("a", TelemetryEvents.DeliveryFailed.class, failed::add);

        eventBus.publish(new TelemetryEvents.BatchDropped("b1", 3, "full"));

        assertEquals(1, dropped.size());
        assertTrue(failed.isEmpty());
    }

    @Test
    @DisplayName("按 ownerId 注销")
    void shouldUnsubscribeByOwner() {
        List<Object> received = new ArrayList<>();
        eventBus.subscribe("a", TelemetryEvents.BatchDropped.class, received::add);
        eventBus.subscribe("b", TelemetryEvents.BatchDropped.class, received::add);

        eventBus.unsubscribeAll("a");
        eventBus.publish(new TelemetryEvents.BatchDropped("b1", 1, "full"));

        assertEquals(1, received.size());
        assertEquals(1, eventBus.listenerCount(TelemetryEvents.BatchDropped.class));
    }

    @Test
    @DisplayName("监听器异常传播给发布方")
    void shouldPropagateListenerFailure() {
        eventBus.subscribe("a", TelemetryEvents.BatchDropped.class, e -> {
            throw new IllegalStateException("boom");
        });

        assertThrows(IllegalStateException.class,
                () -> eventBus.publish(new TelemetryEvents.BatchDropped("b1", 1, "full")));
    }

    @Test
    @DisplayName("全量监听器按事件种类回调")
    void registeredListenerShouldReceiveEveryKind() {
        List<String> calls = new ArrayList<>();
        eventBus.register("monitor", new SelfReportListener() {
            @Override
            public void onCircuitStateChanged(TelemetryEvents.CircuitStateChanged event) {
                calls.add("circuit:" + event.getNewState());
            }

            @Override
            public void onDeliveryFailed(TelemetryEvents.DeliveryFailed event) {
                calls.add("failed:" + event.getBatchId());
            }

            @Override
            public void onSelfReport(TelemetryEvents.SelfReport event) {
                calls.add("other:" + event.getClass().getSimpleName());
            }
        });

        eventBus.publish(new TelemetryEvents.CircuitStateChanged("remote", "CLOSED", "OPEN", 5));
        eventBus.publish(new TelemetryEvents.DeliveryFailed("b1", 10, 4, 503, "unavailable", false));
        eventBus.publish(new TelemetryEvents.BatchDropped("b2", 1, "retry buffer full"));

        assertEquals(List.of("circuit:OPEN", "failed:b1", "other:BatchDropped"), calls);
        assertEquals(3, eventBus.getPublishedEvents());
        assertEquals(1, eventBus.listenerCount(TelemetryEvents.DeliveryPartial.class));
    }

    @Test
    @DisplayName("监听器失败被计数")
    void listenerFailuresShouldBeCounted() {
        eventBus.register("bad", new SelfReportListener() {
            @Override
            public void onBatchDropped(TelemetryEvents.BatchDropped event) {
                throw new IllegalStateException("sink down");
            }
        });

        assertThrows(IllegalStateException.class,
                () -> eventBus.publish(new TelemetryEvents.BatchDropped("b1", 1, "full")));
        assertDoesNotThrow(() -> eventBus.publish(new TelemetryEvents.DeliveryPartial("b2", 4, 1, "schema")));
        assertEquals(1, eventBus.getListenerFailures());
    }

    @Test
    @DisplayName("无监听器时发布为空操作")
    void shouldIgnoreWithoutListeners() {
        assertDoesNotThrow(() -> eventBus.publish(new TelemetryEvents.BatchDropped("b1", 1, "full")));
        assertEquals(0, eventBus.listenerCount(TelemetryEvents.BatchDropped.class));
    }
}
