package com.telemon.core.resilience;

import com.telemon.api.exception.ConfigurationException;
import com.telemon.core.event.EventBus;
import com.telemon.core.event.TelemetryEvents;
import com.telemon.core.support.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConsecutiveFailureCircuitBreaker 单元测试")
class ConsecutiveFailureCircuitBreakerTest {

    private ManualClock clock;
    private EventBus eventBus;
    private List<TelemetryEvents.CircuitStateChanged> transitions;
    private ConsecutiveFailureCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        eventBus = new EventBus();
        transitions = new CopyOnWriteArrayList<>();
        eventBus.subscribe("test", TelemetryEvents.CircuitStateChanged.class, transitions::add);
        breaker = new ConsecutiveFailureCircuitBreaker("test", 3, Duration.ofSeconds(30), clock, eventBus);
    }

    private void tripOpen() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }
    }

    @Nested
    @DisplayName("阈值")
    class ThresholdTests {

        @Test
        @DisplayName("初始状态为 CLOSED 且放行")
        void shouldStartClosed() {
            assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
            assertTrue(breaker.allowRequest());
            assertEquals(Duration.ZERO, breaker.openDuration());
        }

        @Test
        @DisplayName("打开瞬间并发的 allowRequest 不会拿到旧计时下的试探资格")
        void openTransitionShouldNotLeakStaleTimestamp() {
            AtomicBoolean armed = new AtomicBoolean(false);
            List<CircuitBreaker.State> observed = new CopyOnWriteArrayList<>();
            ConsecutiveFailureCircuitBreaker[] holder = new ConsecutiveFailureCircuitBreaker[1];
            ManualClock racingClock = new ManualClock() {
                @Override
                public long monotonicNanos() {
                    if (armed.compareAndSet(true, false)) {
                        holder[0].allowRequest();
                        observed.add(holder[0].getState());
                    }
                    return super.monotonicNanos();
                }
            };
            holder[0] = new ConsecutiveFailureCircuitBreaker("race", 1, Duration.ofSeconds(30), racingClock);
            racingClock.advance(Duration.ofMinutes(5));

            armed.set(true);
            holder[0].recordFailure();

            assertFalse(observed.isEmpty());
            assertNotEquals(CircuitBreaker.State.HALF_OPEN, observed.get(0));
            assertEquals(CircuitBreaker.State.OPEN, holder[0].getState());
            assertFalse(holder[0].allowRequest());
        }

        @Test
        @DisplayName("连续失败达到阈值后打开")
        void shouldOpenAtThreshold() {
            breaker.recordFailure();
            breaker.recordFailure();
            assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());

            breaker.recordFailure();

            assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
            assertFalse(breaker.allowRequest());
            assertEquals(3, breaker.snapshot().getConsecutiveFailures());
            assertNotNull(breaker.snapshot().getOpenedAt());
        }

        @Test
        @DisplayName("成功会重置连续失败计数")
        void successShouldResetCount() {
            breaker.recordFailure();
            breaker.recordFailure();
            breaker.recordSuccess();
            breaker.recordFailure();
            breaker.recordFailure();

            assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
            assertEquals(2, breaker.snapshot().getConsecutiveFailures());
        }

        @Test
        @DisplayName("打开时发布状态事件")
        void shouldPublishOpenEvent() {
            tripOpen();

            assertEquals(1, transitions.size());
            assertEquals("CLOSED", transitions.get(0).getOldState());
            assertEquals("OPEN", transitions.get(0).getNewState());
            assertEquals(3, transitions.get(0).getConsecutiveFailures());
        }
    }

    @Nested
    @DisplayName("半开试探")
    class HalfOpenTests {

        @Test
        @DisplayName("恢复期未到时保持拒绝")
        void shouldRejectBeforeRecoveryTimeout() {
            tripOpen();
            clock.advance(Duration.ofSeconds(29));

            assertFalse(breaker.allowRequest());
            assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
        }

        @Test
        @DisplayName("恢复期后只放行一次试探")
        void shouldAllowSingleTrial() {
            tripOpen();
            clock.advance(Duration.ofSeconds(30));

            assertTrue(breaker.allowRequest());
            assertEquals(CircuitBreaker.State.HALF_OPEN, breaker.getState());
            assertFalse(breaker.allowRequest());
            assertFalse(breaker.allowRequest());
        }

        @Test
        @DisplayName("试探成功后关闭")
        void trialSuccessShouldClose() {
            tripOpen();
            clock.advance(Duration.ofSeconds(30));
            assertTrue(breaker.allowRequest());

            breaker.recordSuccess();

            assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
            assertTrue(breaker.allowRequest());
            assertEquals(Duration.ZERO, breaker.openDuration());
            assertEquals("CLOSED", transitions.get(transitions.size() - 1).getNewState());
        }

        @Test
        @DisplayName("试探失败后重新打开并重新计时")
        void trialFailureShouldReopen() {
            tripOpen();
            clock.advance(Duration.ofSeconds(30));
            assertTrue(breaker.allowRequest());

            breaker.recordFailure();

            assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
            clock.advance(Duration.ofSeconds(29));
            assertFalse(breaker.allowRequest());
            clock.advance(Duration.ofSeconds(1));
            assertTrue(breaker.allowRequest());
        }

        @Test
        @DisplayName("openDuration 跨越 OPEN/HALF_OPEN 周期连续计算")
        void openDurationShouldSpanCycles() {
            tripOpen();
            clock.advance(Duration.ofSeconds(30));
            breaker.allowRequest();
            breaker.recordFailure();
            clock.advance(Duration.ofSeconds(10));

            assertEquals(Duration.ofSeconds(40), breaker.openDuration());
        }

        @Test
        @DisplayName("并发调用时只有一个线程获得试探资格")
        void shouldGrantTrialToOneThread() throws InterruptedException {
            tripOpen();
            clock.advance(Duration.ofSeconds(30));

            int threads = 16;
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);
            AtomicInteger granted = new AtomicInteger();
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        if (breaker.allowRequest()) {
                            granted.incrementAndGet();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(5, TimeUnit.SECONDS));
            executor.shutdownNow();

            assertEquals(1, granted.get());
        }
    }

    @Test
    @DisplayName("非法参数抛出配置异常")
    void shouldValidateArguments() {
        assertThrows(ConfigurationException.class,
                () -> new ConsecutiveFailureCircuitBreaker("x", 0, Duration.ofSeconds(1), clock));
        assertThrows(ConfigurationException.class,
                () -> new ConsecutiveFailureCircuitBreaker("x", 1, Duration.ofSeconds(-1), clock));
    }

    @Test
    @DisplayName("监听器异常不影响状态切换")
    void listenerFailureShouldNotBreakTransition() {
        eventBus.subscribe("bad", TelemetryEvents.CircuitStateChanged.class, e -> {
            throw new IllegalStateException("listener down");
        });

        tripOpen();

        assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
    }
}
