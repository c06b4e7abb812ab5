package com.telemon.core.batch;

import com.telemon.api.model.TelemetryItem;
import com.telemon.api.sink.TelemetryBatch;
import com.telemon.core.clock.IdGenerator;
import com.telemon.core.clock.TelemetryClock;
import com.telemon.core.config.TelemonConfig;
import com.telemon.core.delivery.DeliveryOutcome;
import com.telemon.core.delivery.DeliveryPipeline;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 批处理与刷新引擎
 * <p>
 * 生产者调用 {@link #enqueue} 永不阻塞、永不抛出。触发刷新的条件（先到先触发）：
 * <ul>
 * <li>当前批次达到 batchSize</li>
 * <li>距上次刷新超过 flushInterval 且批次非空（调度线程检查）</li>
 * <li>显式 {@link #flush()}</li>
 * </ul>
 * 入队与换批在同一把锁下互斥，临界区只做引用交换，不含任何 I/O；批次在锁外移交投递管线。
 * <p>
 * 缓冲上限 maxQueueSize 覆盖当前批次与已移交但未完成的条目，达到上限时丢弃当前批次中最旧的条目。
 */
@Slf4j
public class BatchingEngine {

    private static final long MIN_TICK_MILLIS = 10;
    private static final long MAX_TICK_MILLIS = 1000;

    private final int batchSize;
    private final int maxQueueSize;
    private final long flushIntervalNanos;
    private final long tickMillis;
    private final Duration drainTimeout;
    private final DeliveryPipeline pipeline;
    private final ScheduledExecutorService scheduler;
    private final TelemetryClock clock;
    private final Map<String, Object> resource;

    private final ReentrantLock lock = new ReentrantLock();
    // guarded by lock
    private ArrayDeque<TelemetryItem> current;
    // guarded by lock
    private long lastFlushNanos;
    // guarded by lock
    private boolean closed;

    // 已移交、投递未完成的批次
    private final Set<CompletableFuture<DeliveryOutcome>> outstanding = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicInteger handedOffItems = new AtomicInteger();
    private final AtomicLong enqueuedItems = new AtomicLong();
    private final AtomicLong droppedItems = new AtomicLong();
    private final AtomicLong flushCount = new AtomicLong();
    private volatile ScheduledFuture<?> tickHandle;
    private volatile boolean drainedOnShutdown;

    public BatchingEngine(TelemonConfig config,
                          DeliveryPipeline pipeline,
                          ScheduledExecutorService scheduler,
                          TelemetryClock clock,
                          Map<String, Object> resource) {
        this.batchSize = config.getBatchSize();
        this.maxQueueSize = config.getMaxQueueSize();
        this.flushIntervalNanos = config.getFlushInterval().toNanos();
        this.tickMillis = Math.max(MIN_TICK_MILLIS, Math.min(config.getFlushInterval().toMillis() / 4, MAX_TICK_MILLIS));
        this.drainTimeout = config.getDrainTimeout();
        this.pipeline = pipeline;
        this.scheduler = scheduler;
        this.clock = clock != null ? clock : TelemetryClock.system();
        this.resource = resource == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(resource));
        this.current = new ArrayDeque<>(batchSize);
        this.lastFlushNanos = this.clock.monotonicNanos();
    }

    /**
     * 启动周期性刷新
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        tickHandle = scheduler.scheduleWithFixedDelay(this::tick, tickMillis, tickMillis, TimeUnit.MILLISECONDS);
        log.debug("[Batching] Started: batchSize={}, flushInterval={}ms, tick={}ms",
                batchSize, TimeUnit.NANOSECONDS.toMillis(flushIntervalNanos), tickMillis);
    }

    // ==================== 入队 ====================

    /**
     * 入队
     *
     * @return 条目被接收返回 true；关闭后或缓冲已满且无可淘汰条目时返回 false
     */
    public boolean enqueue(TelemetryItem item) {
        if (item == null) {
            return false;
        }
        ArrayDeque<TelemetryItem> ready = null;
        lock.lock();
        try {
            if (closed) {
                droppedItems.incrementAndGet();
                return false;
            }
            if (current.size() + handedOffItems.get() >= maxQueueSize) {
                if (current.isEmpty()) {
                    droppedItems.incrementAndGet();
                    log.debug("[Batching] Queue full ({}), dropping new item", maxQueueSize);
                    return false;
                }
                current.pollFirst();
                droppedItems.incrementAndGet();
            }
            current.addLast(item);
            enqueuedItems.incrementAndGet();
            if (current.size() >= batchSize) {
                ready = swapLocked();
            }
        } finally {
            lock.unlock();
        }

        if (ready != null) {
            handOff(ready);
        }
        return true;
    }

    // ==================== 刷新 ====================

    /**
     * 显式刷新
     * <p>
     * 交付当前批次，并等待此前已移交但尚未完成的批次。当前批次非空时结果为它的投递结果；
     * 为空时若等待的批次中有未落地的，返回其中一个的结果，否则为 DELIVERED。
     */
    public CompletableFuture<DeliveryOutcome> flush() {
        ArrayDeque<TelemetryItem> ready;
        lock.lock();
        try {
            ready = swapLocked();
        } finally {
            lock.unlock();
        }
        List<CompletableFuture<DeliveryOutcome>> earlier = new ArrayList<>();
        for (CompletableFuture<DeliveryOutcome> f : outstanding) {
            if (!f.isDone()) {
                earlier.add(f);
            }
        }
        CompletableFuture<DeliveryOutcome> last = ready != null ? handOff(ready) : null;
        if (earlier.isEmpty()) {
            return last != null ? last : CompletableFuture.completedFuture(DeliveryOutcome.DELIVERED);
        }
        List<CompletableFuture<DeliveryOutcome>> all = new ArrayList<>(earlier);
        if (last != null) {
            all.add(last);
        }
        return CompletableFuture.allOf(all.toArray(new CompletableFuture[0]))
                .handle((ignored, error) -> {
                    if (last != null) {
                        return last.getNow(DeliveryOutcome.DROPPED);
                    }
                    for (CompletableFuture<DeliveryOutcome> f : earlier) {
                        DeliveryOutcome outcome = f.isCompletedExceptionally() ? DeliveryOutcome.DROPPED : f.join();
                        if (!outcome.isPersisted()) {
                            return outcome;
                        }
                    }
                    return DeliveryOutcome.DELIVERED;
                });
    }

    /**
     * 调度线程周期调用：按时间触发刷新，并让投递管线重试缓冲批次
     */
    public void tick() {
        try {
            ArrayDeque<TelemetryItem> ready = null;
            lock.lock();
            try {
                if (closed) {
                    return;
                }
                if (!current.isEmpty() && clock.monotonicNanos() - lastFlushNanos >= flushIntervalNanos) {
                    ready = swapLocked();
                }
            } finally {
                lock.unlock();
            }
            if (ready != null) {
                log.trace("[Batching] Interval flush of {} item(s)", ready.size());
                handOff(ready);
            }
            pipeline.onTick();
        } catch (RuntimeException e) {
            // 异常会终止周期任务，必须在此截获
            log.error("[Batching] Error in flush tick: {}", e.getMessage(), e);
        }
    }

    private ArrayDeque<TelemetryItem> swapLocked() {
        lastFlushNanos = clock.monotonicNanos();
        if (current.isEmpty()) {
            return null;
        }
        ArrayDeque<TelemetryItem> full = current;
        current = new ArrayDeque<>(batchSize);
        return full;
    }

    private CompletableFuture<DeliveryOutcome> handOff(ArrayDeque<TelemetryItem> items) {
        int count = items.size();
        TelemetryBatch batch = new TelemetryBatch(IdGenerator.batchId(), clock.now(), new ArrayList<>(items), resource);
        handedOffItems.addAndGet(count);
        flushCount.incrementAndGet();
        CompletableFuture<DeliveryOutcome> future;
        try {
            future = pipeline.deliver(batch);
        } catch (RejectedExecutionException e) {
            handedOffItems.addAndGet(-count);
            droppedItems.addAndGet(count);
            log.warn("[Batching] Delivery rejected batch {} ({} items)", batch.getBatchId(), count);
            return CompletableFuture.completedFuture(DeliveryOutcome.DROPPED);
        }
        outstanding.add(future);
        future.whenComplete((outcome, error) -> {
            handedOffItems.addAndGet(-count);
            outstanding.remove(future);
        });
        return future;
    }

    // ==================== 生命周期 ====================

    /**
     * 关闭：停止定时器，最终刷新，在 drainTimeout 内等待投递完成。幂等。
     *
     * @return 在超时内排空返回 true
     */
    public boolean shutdown() {
        ArrayDeque<TelemetryItem> ready;
        lock.lock();
        try {
            if (closed) {
                return drainedOnShutdown;
            }
            closed = true;
            ready = swapLocked();
        } finally {
            lock.unlock();
        }

        ScheduledFuture<?> handle = tickHandle;
        if (handle != null) {
            handle.cancel(false);
        }
        if (ready != null) {
            handOff(ready);
        }
        drainedOnShutdown = pipeline.shutdown(drainTimeout);
        log.info("[Batching] Shutdown complete: enqueued={}, dropped={}, drained={}",
                enqueuedItems.get(), getDroppedItems(), drainedOnShutdown);
        return drainedOnShutdown;
    }

    public boolean isShutdown() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    // ==================== 统计 ====================

    /**
     * 当前批次中尚未移交的条目数
     */
    public int getBufferedItems() {
        lock.lock();
        try {
            return current.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 尚未完成投递的条目总数（当前批次 + 已移交）
     */
    public int getPendingItems() {
        return getBufferedItems() + handedOffItems.get();
    }

    public long getEnqueuedItems() {
        return enqueuedItems.get();
    }

    /**
     * 引擎与投递管线丢弃的条目总数
     */
    public long getDroppedItems() {
        return droppedItems.get() + pipeline.getDroppedItems();
    }

    public long getFlushCount() {
        return flushCount.get();
    }

    public DeliveryPipeline getPipeline() {
        return pipeline;
    }
}
