package com.telemon.core.delivery;

import com.telemon.api.exception.TelemetryDeliveryException;
import com.telemon.api.sink.SendResult;
import com.telemon.api.sink.TelemetryBatch;
import com.telemon.api.sink.TelemetrySink;
import com.telemon.core.config.TelemonConfig;
import com.telemon.core.event.EventBus;
import com.telemon.core.event.TelemetryEvents;
import com.telemon.core.resilience.CircuitBreaker;
import com.telemon.core.resilience.ExponentialBackoff;
import com.telemon.core.util.DaemonThreadFactory;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 投递管线
 * <p>
 * 职责：批次调度、熔断闸门、超时控制、退避重试、本地兜底路由。
 * <ol>
 * <li>无远端落点：直接写本地兜底</li>
 * <li>熔断拒绝：不发生 I/O，批次进入有界重试缓冲区（溢出丢最旧）；
 * 熔断持续打开超过放弃阈值后改写本地兜底</li>
 * <li>放行：在超时内调用 {@link TelemetrySink#send}，结果反馈给熔断器；
 * 瞬时失败按指数退避在调度线程上定时重试，耗尽后丢弃并发布自监控事件</li>
 * </ol>
 * 最多 maxInFlightDeliveries 个批次同时投递，等待中的批次放在有界队列里，溢出时丢弃最旧批次。
 */
@Slf4j
public class DeliveryPipeline {

    private final TelemetrySink remoteSink;
    private final TelemetrySink fallbackSink;
    private final CircuitBreaker breaker;
    private final ExponentialBackoff backoff;
    private final int maxRetries;
    private final long sendTimeoutMillis;
    private final Duration fallbackAfterOpen;
    private final int retryBufferCapacity;
    private final ScheduledExecutorService scheduler;
    private final EventBus eventBus;

    private final ThreadPoolExecutor deliveryExecutor;
    private final ExecutorService transportExecutor;

    // 熔断期间暂存的批次
    private final Deque<TelemetryBatch> retryBuffer = new ArrayDeque<>();
    // 等待退避的重试，key 为 batchId
    private final Map<String, PendingRetry> pendingRetries = new ConcurrentHashMap<>();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    // 统计
    private final AtomicLong deliveredBatches = new AtomicLong();
    private final AtomicLong partialBatches = new AtomicLong();
    private final AtomicLong failedBatches = new AtomicLong();
    private final AtomicLong shortCircuitedBatches = new AtomicLong();
    private final AtomicLong fallbackBatches = new AtomicLong();
    private final AtomicLong droppedItems = new AtomicLong();

    /**
     * @param remoteSink   远端落点，可为 null（仅本地）
     * @param fallbackSink 本地兜底落点
     * @param scheduler    共享调度线程，用于退避等待
     * @param eventBus     自监控事件总线，可为 null
     */
    public DeliveryPipeline(TelemonConfig config,
                            TelemetrySink remoteSink,
                            TelemetrySink fallbackSink,
                            CircuitBreaker breaker,
                            ScheduledExecutorService scheduler,
                            EventBus eventBus) {
        this.remoteSink = remoteSink;
        this.fallbackSink = fallbackSink;
        this.breaker = breaker;
        this.backoff = new ExponentialBackoff(config.getInitialBackoffMillis(), 2.0, config.getMaxBackoffMillis());
        this.maxRetries = config.getMaxRetries();
        this.sendTimeoutMillis = config.getTimeout().toMillis();
        this.fallbackAfterOpen = config.getFallbackAfterOpen();
        this.retryBufferCapacity = config.getRetryBufferCapacity();
        this.scheduler = scheduler;
        this.eventBus = eventBus;

        int inFlight = config.getMaxInFlightDeliveries();
        this.deliveryExecutor = new ThreadPoolExecutor(
                inFlight, inFlight,
                60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(config.getMaxPendingBatches()),
                new DaemonThreadFactory("telemon-delivery", true),
                new DropOldestPolicy());
        this.transportExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("telemon-transport", true));
    }

    // ==================== 入口 ====================

    /**
     * 提交批次，立即返回
     */
    public CompletableFuture<DeliveryOutcome> deliver(TelemetryBatch batch) {
        CompletableFuture<DeliveryOutcome> future = new CompletableFuture<>();
        if (batch == null || batch.isEmpty()) {
            future.complete(DeliveryOutcome.DELIVERED);
            return future;
        }
        dispatch(new DeliveryTask(batch, 0, future));
        return future;
    }

    /**
     * 周期性调用：重新尝试重试缓冲区中的批次
     * <p>
     * 熔断关闭时全部重新投递；恢复期已过时只取最旧的一个作为试探；
     * 恢复期未到或试探进行中时缓冲区保持原样。
     */
    public void onTick() {
        if (shuttingDown.get()) {
            return;
        }
        List<TelemetryBatch> toRetry = new ArrayList<>();
        boolean giveUp = false;
        synchronized (retryBuffer) {
            if (retryBuffer.isEmpty()) {
                return;
            }
            if (breaker.getState() == CircuitBreaker.State.CLOSED) {
                toRetry.addAll(retryBuffer);
                retryBuffer.clear();
            } else if (openTooLong()) {
                giveUp = true;
            } else if (breaker.isTrialDue()) {
                toRetry.add(retryBuffer.pollFirst());
            }
        }
        if (giveUp) {
            drainRetryBufferToFallback();
            return;
        }
        for (TelemetryBatch batch : toRetry) {
            dispatch(new DeliveryTask(batch, 0, new CompletableFuture<>()));
        }
    }

    private void dispatch(DeliveryTask task) {
        try {
            deliveryExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            // 执行器已关闭
            complete(task, toFallback(task.batch));
        }
    }

    // ==================== 投递 ====================

    private void process(DeliveryTask task) {
        TelemetryBatch batch = task.batch;
        try {
            if (remoteSink == null) {
                complete(task, toFallback(batch));
                return;
            }

            if (!breaker.allowRequest()) {
                if (shuttingDown.get() || openTooLong()) {
                    drainRetryBufferToFallback();
                    complete(task, toFallback(batch));
                } else {
                    shortCircuit(batch);
                    complete(task, DeliveryOutcome.SHORT_CIRCUITED);
                }
                return;
            }

            SendResult result = sendWithTimeout(batch);
            handleResult(task, result);
        } catch (RuntimeException e) {
            log.error("[Delivery] Unexpected error while delivering batch {}", batch.getBatchId(), e);
            droppedItems.addAndGet(batch.size());
            failedBatches.incrementAndGet();
            complete(task, DeliveryOutcome.DROPPED);
        }
    }

    private void handleResult(DeliveryTask task, SendResult result) {
        TelemetryBatch batch = task.batch;

        if (result.isSuccess()) {
            breaker.recordSuccess();
            deliveredBatches.incrementAndGet();
            log.debug("[Delivery] Batch {} delivered ({} items)", batch.getBatchId(), batch.size());
            complete(task, DeliveryOutcome.DELIVERED);
            drainRetryBuffer();
            return;
        }

        if (result.isPartial()) {
            breaker.recordSuccess();
            partialBatches.incrementAndGet();
            log.warn("[Delivery] Batch {} partially delivered: {} of {} items rejected",
                    batch.getBatchId(), result.getRejectedCount(), batch.size());
            publish(new TelemetryEvents.DeliveryPartial(batch.getBatchId(), batch.size(),
                    result.getRejectedCount(), result.getMessage()));
            complete(task, DeliveryOutcome.PARTIALLY_DELIVERED);
            drainRetryBuffer();
            return;
        }

        breaker.recordFailure();
        int attempts = task.attempt + 1;

        if (!result.isRetryable()) {
            log.error("[Delivery] Batch {} rejected permanently (status={}): {}",
                    batch.getBatchId(), result.getStatusCode(), result.getMessage());
            drop(task, attempts, result, true);
            return;
        }

        if (shuttingDown.get()) {
            complete(task, toFallback(batch));
            return;
        }

        if (task.attempt < maxRetries) {
            scheduleRetry(task, result);
            return;
        }

        log.error("[Delivery] Batch {} dropped after {} attempts: {}", batch.getBatchId(), attempts, result.getMessage());
        drop(task, attempts, result, false);
    }

    private void drop(DeliveryTask task, int attempts, SendResult result, boolean permanent) {
        TelemetryBatch batch = task.batch;
        failedBatches.incrementAndGet();
        droppedItems.addAndGet(batch.size());
        publish(new TelemetryEvents.DeliveryFailed(batch.getBatchId(), batch.size(), attempts,
                result.getStatusCode(), result.getMessage(), permanent));
        complete(task, DeliveryOutcome.DROPPED);
    }

    /**
     * 在超时内等待传输结果
     */
    private SendResult sendWithTimeout(TelemetryBatch batch) {
        Future<SendResult> future;
        try {
            future = transportExecutor.submit(() -> remoteSink.send(batch));
        } catch (RejectedExecutionException e) {
            return SendResult.transientFailure("transport unavailable");
        }
        try {
            SendResult result = future.get(sendTimeoutMillis, TimeUnit.MILLISECONDS);
            return result != null ? result : SendResult.transientFailure("sink returned no result");
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Delivery] Send timeout ({}ms) for batch {}", sendTimeoutMillis, batch.getBatchId());
            return SendResult.transientFailure("timeout after " + sendTimeoutMillis + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TelemetryDeliveryException) {
                TelemetryDeliveryException de = (TelemetryDeliveryException) cause;
                return de.isRetryable()
                        ? SendResult.transientFailure(de.getMessage())
                        : SendResult.permanentFailure(de.getMessage());
            }
            log.debug("[Delivery] Sink {} threw for batch {}: {}", remoteSink.getName(), batch.getBatchId(), String.valueOf(cause));
            return SendResult.transientFailure(cause != null ? cause.getClass().getSimpleName() + ": " + cause.getMessage() : "unknown");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SendResult.transientFailure("interrupted");
        }
    }

    // ==================== 重试 ====================

    private void scheduleRetry(DeliveryTask task, SendResult result) {
        int nextAttempt = task.attempt + 1;
        long delay = backoff.delayMillis(nextAttempt);
        DeliveryTask next = new DeliveryTask(task.batch, nextAttempt, task.future);
        String key = task.batch.getBatchId();
        PendingRetry pending = new PendingRetry(next);

        log.info("[Delivery] Batch {} failed ({}), retry {}/{} in {}ms",
                key, result.getMessage(), nextAttempt, maxRetries, delay);

        pendingRetries.put(key, pending);
        try {
            pending.handle = scheduler.schedule(() -> {
                if (pendingRetries.remove(key, pending)) {
                    dispatch(next);
                }
            }, delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            if (pendingRetries.remove(key, pending)) {
                complete(next, toFallback(next.batch));
            }
        }
    }

    // ==================== 重试缓冲区 ====================

    private void shortCircuit(TelemetryBatch batch) {
        shortCircuitedBatches.incrementAndGet();
        TelemetryBatch evicted = null;
        synchronized (retryBuffer) {
            retryBuffer.addLast(batch);
            if (retryBuffer.size() > retryBufferCapacity) {
                evicted = retryBuffer.pollFirst();
            }
        }
        log.debug("[Delivery] Circuit {} - batch {} buffered without I/O", breaker.getState(), batch.getBatchId());
        if (evicted != null) {
            droppedItems.addAndGet(evicted.size());
            log.warn("[Delivery] Retry buffer full ({}), dropped batch {} ({} items)",
                    retryBufferCapacity, evicted.getBatchId(), evicted.size());
            publish(new TelemetryEvents.BatchDropped(evicted.getBatchId(), evicted.size(), "retry buffer full"));
        }
    }

    private void drainRetryBuffer() {
        List<TelemetryBatch> buffered;
        synchronized (retryBuffer) {
            if (retryBuffer.isEmpty()) {
                return;
            }
            buffered = new ArrayList<>(retryBuffer);
            retryBuffer.clear();
        }
        log.info("[Delivery] Backend reachable again, re-dispatching {} buffered batch(es)", buffered.size());
        for (TelemetryBatch batch : buffered) {
            dispatch(new DeliveryTask(batch, 0, new CompletableFuture<>()));
        }
    }

    private void drainRetryBufferToFallback() {
        List<TelemetryBatch> buffered;
        synchronized (retryBuffer) {
            buffered = new ArrayList<>(retryBuffer);
            retryBuffer.clear();
        }
        for (TelemetryBatch batch : buffered) {
            toFallback(batch);
        }
    }

    private boolean openTooLong() {
        return breaker.getState() != CircuitBreaker.State.CLOSED
                && breaker.openDuration().compareTo(fallbackAfterOpen) >= 0;
    }

    // ==================== 本地兜底 ====================

    private DeliveryOutcome toFallback(TelemetryBatch batch) {
        if (fallbackSink == null) {
            droppedItems.addAndGet(batch.size());
            return DeliveryOutcome.DROPPED;
        }
        try {
            SendResult result = fallbackSink.send(batch);
            if (!result.isFailure()) {
                fallbackBatches.incrementAndGet();
                return DeliveryOutcome.FALLBACK;
            }
            log.warn("[Delivery] Fallback sink refused batch {}: {}", batch.getBatchId(), result.getMessage());
        } catch (RuntimeException e) {
            log.warn("[Delivery] Fallback sink failed for batch {}: {}", batch.getBatchId(), e.getMessage());
        }
        droppedItems.addAndGet(batch.size());
        return DeliveryOutcome.DROPPED;
    }

    // ==================== 生命周期 ====================

    /**
     * 关闭：取消退避等待并将其批次写入本地兜底，排空调度队列（有超时），
     * 正在进行的传输调用允许完成或超时。
     *
     * @return 在超时内排空返回 true
     */
    public boolean shutdown(Duration drainTimeout) {
        if (!shuttingDown.compareAndSet(false, true)) {
            return deliveryExecutor.isTerminated();
        }

        pendingRetries.forEach((key, pending) -> {
            if (pendingRetries.remove(key, pending)) {
                if (pending.handle != null) {
                    pending.handle.cancel(false);
                }
                complete(pending.task, toFallback(pending.task.batch));
            }
        });
        drainRetryBufferToFallback();

        deliveryExecutor.shutdown();
        boolean drained;
        try {
            drained = deliveryExecutor.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!drained) {
                log.warn("[Delivery] Drain timeout ({}ms) exceeded, moving remaining batches to fallback",
                        drainTimeout.toMillis());
                for (Runnable r : deliveryExecutor.shutdownNow()) {
                    if (r instanceof DeliveryTask) {
                        DeliveryTask task = (DeliveryTask) r;
                        complete(task, toFallback(task.batch));
                    }
                }
            }
        } catch (InterruptedException e) {
            deliveryExecutor.shutdownNow();
            Thread.currentThread().interrupt();
            drained = false;
        }
        transportExecutor.shutdown();
        return drained;
    }

    public boolean isShutdown() {
        return shuttingDown.get();
    }

    // ==================== 统计 ====================

    public long getDeliveredBatches() {
        return deliveredBatches.get();
    }

    public long getPartialBatches() {
        return partialBatches.get();
    }

    public long getFailedBatches() {
        return failedBatches.get();
    }

    public long getShortCircuitedBatches() {
        return shortCircuitedBatches.get();
    }

    public long getFallbackBatches() {
        return fallbackBatches.get();
    }

    public long getDroppedItems() {
        return droppedItems.get();
    }

    public int getRetryBufferSize() {
        synchronized (retryBuffer) {
            return retryBuffer.size();
        }
    }

    public int getPendingRetryCount() {
        return pendingRetries.size();
    }

    public int getQueuedBatchCount() {
        return deliveryExecutor.getQueue().size();
    }

    public boolean hasRemoteSink() {
        return remoteSink != null;
    }

    public CircuitBreaker getBreaker() {
        return breaker;
    }

    // ==================== 内部类 ====================

    private void complete(DeliveryTask task, DeliveryOutcome outcome) {
        task.future.complete(outcome);
    }

    private void publish(TelemetryEvents.SelfReport event) {
        if (eventBus == null) {
            return;
        }
        try {
            eventBus.publish(event);
        } catch (RuntimeException e) {
            log.warn("[Delivery] Self-report listener failed: {}", e.getMessage());
        }
    }

    private final class DeliveryTask implements Runnable {
        private final TelemetryBatch batch;
        private final int attempt;
        private final CompletableFuture<DeliveryOutcome> future;

        DeliveryTask(TelemetryBatch batch, int attempt, CompletableFuture<DeliveryOutcome> future) {
            this.batch = batch;
            this.attempt = attempt;
            this.future = future;
        }

        @Override
        public void run() {
            process(this);
        }
    }

    private static final class PendingRetry {
        private final DeliveryTask task;
        private volatile ScheduledFuture<?> handle;

        PendingRetry(DeliveryTask task) {
            this.task = task;
        }
    }

    /**
     * 调度队列满时丢弃最旧的等待批次
     */
    private final class DropOldestPolicy implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            if (executor.isShutdown()) {
                throw new RejectedExecutionException("Delivery executor is shut down");
            }
            Runnable evicted = executor.getQueue().poll();
            if (evicted instanceof DeliveryTask) {
                DeliveryTask task = (DeliveryTask) evicted;
                droppedItems.addAndGet(task.batch.size());
                log.warn("[Delivery] Dispatch queue full, dropped oldest batch {} ({} items)",
                        task.batch.getBatchId(), task.batch.size());
                publish(new TelemetryEvents.BatchDropped(task.batch.getBatchId(), task.batch.size(), "dispatch queue full"));
                complete(task, DeliveryOutcome.DROPPED);
            }
            executor.execute(r);
        }
    }
}
