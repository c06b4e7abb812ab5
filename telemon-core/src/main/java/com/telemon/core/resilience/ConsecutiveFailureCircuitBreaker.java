package com.telemon.core.resilience;

import com.telemon.api.exception.ConfigurationException;
import com.telemon.core.clock.TelemetryClock;
import com.telemon.core.event.EventBus;
import com.telemon.core.event.TelemetryEvents;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 连续失败熔断器
 * <p>
 * 连续 failureThreshold 次失败后打开；recoveryTimeout 过后下一次 allowRequest
 * 切换到 HALF_OPEN 并只放行一次试探（CAS 保证），试探成功关闭、失败重新打开并重置计时。
 */
@Slf4j
public class ConsecutiveFailureCircuitBreaker implements CircuitBreaker {

    private static final long NOT_OPEN = Long.MIN_VALUE;

    private final String name;
    private final int failureThreshold;
    private final long recoveryTimeoutNanos;
    private final TelemetryClock clock;
    private final EventBus eventBus;

    // 状态
    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicLong stateTransitionNanos = new AtomicLong();
    // 离开 CLOSED 的时刻，兜底路由据此判断是否放弃远端
    private final AtomicLong openSinceNanos = new AtomicLong(NOT_OPEN);
    private volatile Instant openedAt;

    public ConsecutiveFailureCircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout,
                                            TelemetryClock clock) {
        this(name, failureThreshold, recoveryTimeout, clock, null);
    }

    public ConsecutiveFailureCircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout,
                                            TelemetryClock clock, EventBus eventBus) {
        if (failureThreshold < 1) {
            throw new ConfigurationException("failureThreshold", failureThreshold, "must be >= 1");
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
            throw new ConfigurationException("recoveryTimeout", recoveryTimeout, "must be >= 0");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeoutNanos = recoveryTimeout.toNanos();
        this.clock = clock != null ? clock : TelemetryClock.system();
        this.eventBus = eventBus;
        this.stateTransitionNanos.set(this.clock.monotonicNanos());
    }

    @Override
    public boolean allowRequest() {
        State currentState = state.get();

        if (currentState == State.CLOSED) {
            return true;
        }

        if (currentState == State.OPEN) {
            long now = clock.monotonicNanos();
            if (now - stateTransitionNanos.get() >= recoveryTimeoutNanos) {
                // 只有一个调用方能赢得 CAS，获得试探资格
                if (state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
                    stateTransitionNanos.set(now);
                    log.info("[Breaker:{}] State changed: OPEN -> HALF_OPEN (Trial starts)", name);
                    publishStateEvent(State.OPEN, State.HALF_OPEN);
                    return true;
                }
            }
            return false;
        }

        // HALF_OPEN: 试探进行中，其余请求一律拒绝
        return false;
    }

    @Override
    public synchronized void recordSuccess() {
        State currentState = state.get();
        consecutiveFailures.set(0);
        if (currentState == State.HALF_OPEN) {
            transitionToClosed();
        }
    }

    @Override
    public synchronized void recordFailure() {
        State currentState = state.get();
        int failures = consecutiveFailures.incrementAndGet();

        if (currentState == State.HALF_OPEN) {
            log.warn("[Breaker:{}] Trial request failed. Re-OPENING.", name);
            transitionToOpen(State.HALF_OPEN);
            return;
        }

        if (currentState == State.CLOSED && failures >= failureThreshold) {
            log.warn("[Breaker:{}] {} consecutive failures reached threshold {}. OPENING.",
                    name, failures, failureThreshold);
            transitionToOpen(State.CLOSED);
        }
    }

    private void transitionToOpen(State from) {
        // 先写计时再发布 OPEN，allowRequest 读到 OPEN 时必然看到新的计时起点
        long now = clock.monotonicNanos();
        stateTransitionNanos.set(now);
        if (state.compareAndSet(from, State.OPEN)) {
            openSinceNanos.compareAndSet(NOT_OPEN, now);
            openedAt = clock.now();
            publishStateEvent(from, State.OPEN);
        }
    }

    private void transitionToClosed() {
        if (state.compareAndSet(State.HALF_OPEN, State.CLOSED)) {
            stateTransitionNanos.set(clock.monotonicNanos());
            openSinceNanos.set(NOT_OPEN);
            log.info("[Breaker:{}] State changed: HALF_OPEN -> CLOSED (Recovered)", name);
            publishStateEvent(State.HALF_OPEN, State.CLOSED);
        }
    }

    private void publishStateEvent(State oldState, State newState) {
        if (eventBus != null) {
            try {
                eventBus.publish(new TelemetryEvents.CircuitStateChanged(
                        name, oldState.name(), newState.name(), consecutiveFailures.get()));
            } catch (Exception e) {
                log.warn("[Breaker:{}] Failed to publish state event {} -> {}: {}",
                        name, oldState, newState, e.getMessage());
            }
        }
    }

    @Override
    public boolean isTrialDue() {
        return state.get() == State.OPEN
                && clock.monotonicNanos() - stateTransitionNanos.get() >= recoveryTimeoutNanos;
    }

    @Override
    public State getState() {
        return state.get();
    }

    @Override
    public CircuitSnapshot snapshot() {
        return new CircuitSnapshot(state.get(), consecutiveFailures.get(), openedAt);
    }

    @Override
    public Duration openDuration() {
        long since = openSinceNanos.get();
        if (since == NOT_OPEN) {
            return Duration.ZERO;
        }
        return Duration.ofNanos(Math.max(0L, clock.monotonicNanos() - since));
    }

    public String getName() {
        return name;
    }
}
