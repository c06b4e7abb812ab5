package com.telemon.core.sink;

import com.telemon.api.model.TelemetryEvent;
import com.telemon.api.model.TelemetryItem;
import com.telemon.api.sink.SendResult;
import com.telemon.api.sink.TelemetryBatch;
import com.telemon.api.sink.TelemetrySink;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 内存环形缓冲落点
 * <p>
 * 容量满时淘汰最旧条目。可查询，供本地排障与测试使用。
 */
public class InMemoryTelemetrySink implements TelemetrySink {

    private final int capacity;
    private final Deque<TelemetryItem> buffer;
    private final AtomicLong receivedBatches = new AtomicLong();
    private final AtomicLong receivedItems = new AtomicLong();
    private final AtomicLong evictedItems = new AtomicLong();

    public InMemoryTelemetrySink(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    @Override
    public SendResult send(TelemetryBatch batch) {
        synchronized (buffer) {
            for (TelemetryItem item : batch.getItems()) {
                if (buffer.size() >= capacity) {
                    buffer.pollFirst();
                    evictedItems.incrementAndGet();
                }
                buffer.addLast(item);
            }
        }
        receivedBatches.incrementAndGet();
        receivedItems.addAndGet(batch.size());
        return SendResult.success();
    }

    public List<TelemetryItem> getItems() {
        synchronized (buffer) {
            return new ArrayList<>(buffer);
        }
    }

    public List<TelemetryEvent> getEvents() {
        return getEvents(e -> true);
    }

    public List<TelemetryEvent> getEvents(Predicate<TelemetryEvent> filter) {
        return getItems().stream()
                .filter(TelemetryEvent.class::isInstance)
                .map(TelemetryEvent.class::cast)
                .filter(filter)
                .collect(Collectors.toList());
    }

    public int size() {
        synchronized (buffer) {
            return buffer.size();
        }
    }

    public void clear() {
        synchronized (buffer) {
            buffer.clear();
        }
    }

    public long getReceivedBatches() {
        return receivedBatches.get();
    }

    public long getReceivedItems() {
        return receivedItems.get();
    }

    public long getEvictedItems() {
        return evictedItems.get();
    }

    public int getCapacity() {
        return capacity;
    }

    @Override
    public String getName() {
        return "memory";
    }

    @Override
    public boolean isLocal() {
        return true;
    }
}
