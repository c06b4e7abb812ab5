package com.telemon.core.sampling;

import com.telemon.api.exception.ConfigurationException;
import com.telemon.api.model.LogLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LevelAwareSampler 单元测试")
class LevelAwareSamplerTest {

    @Nested
    @DisplayName("边界采样率")
    class BoundaryRateTests {

        @Test
        @DisplayName("rate=0 时 10000 次 DEBUG/INFO 全部拒绝")
        void zeroRateShouldRejectAllLowLevels() {
            LevelAwareSampler sampler = new LevelAwareSampler(0.0, true);

            for (int i = 0; i < 10_000; i++) {
                assertFalse(sampler.admit(LogLevel.DEBUG));
                assertFalse(sampler.admit(LogLevel.INFO));
            }
        }

        @Test
        @DisplayName("rate=0 时确定性模式仍保留 WARNING 及以上")
        void zeroRateShouldKeepWarningsWhenDeterministic() {
            LevelAwareSampler sampler = new LevelAwareSampler(0.0, true);

            for (int i = 0; i < 10_000; i++) {
                assertTrue(sampler.admit(LogLevel.WARNING));
                assertTrue(sampler.admit(LogLevel.ERROR));
                assertTrue(sampler.admit(LogLevel.CRITICAL));
            }
        }

        @Test
        @DisplayName("非确定性时仅 WARNING 参与抽样，ERROR/CRITICAL 不消耗随机数")
        void nonDeterministicShouldOnlySampleWarnings() {
            AtomicInteger draws = new AtomicInteger();
            LevelAwareSampler sampler = new LevelAwareSampler(0.5, false, () -> {
                draws.incrementAndGet();
                return 0.9;
            });

            assertTrue(sampler.admit(LogLevel.ERROR));
            assertTrue(sampler.admit(LogLevel.CRITICAL));
            assertEquals(0, draws.get());
            assertFalse(sampler.admit(LogLevel.WARNING));
            assertEquals(1, draws.get());
        }

        @Test
        @DisplayName("rate=1 时全部放行且不消耗随机数")
        void fullRateShouldAdmitAll() {
            AtomicInteger draws = new AtomicInteger();
            LevelAwareSampler sampler = new LevelAwareSampler(1.0, false, () -> {
                draws.incrementAndGet();
                return 0.99;
            });

            for (LogLevel level : LogLevel.values()) {
                assertTrue(sampler.admit(level));
            }
            assertEquals(0, draws.get());
        }
    }

    @Nested
    @DisplayName("概率采样")
    class ProbabilisticTests {

        @Test
        @DisplayName("随机数小于采样率时放行")
        void shouldCompareAgainstRate() {
            LevelAwareSampler low = new LevelAwareSampler(0.5, true, () -> 0.49);
            LevelAwareSampler high = new LevelAwareSampler(0.5, true, () -> 0.5);

            assertTrue(low.admit(LogLevel.INFO));
            assertFalse(high.admit(LogLevel.INFO));
        }

        @Test
        @DisplayName("rate=0.3 时放行比例接近 30%")
        void shouldApproximateRate() {
            LevelAwareSampler sampler = new LevelAwareSampler(0.3, true);
            int admitted = 0;
            for (int i = 0; i < 20_000; i++) {
                if (sampler.admit(LogLevel.DEBUG)) {
                    admitted++;
                }
            }
            double ratio = admitted / 20_000.0;
            assertTrue(ratio > 0.25 && ratio < 0.35, "ratio was " + ratio);
        }

        @Test
        @DisplayName("null 级别被拒绝")
        void shouldRejectNullLevel() {
            assertFalse(LevelAwareSampler.alwaysOn().admit((LogLevel) null));
        }
    }

    @Test
    @DisplayName("采样率越界时抛出配置异常")
    void shouldRejectInvalidRate() {
        assertThrows(ConfigurationException.class, () -> new LevelAwareSampler(-0.1, true));
        assertThrows(ConfigurationException.class, () -> new LevelAwareSampler(1.1, true));
        assertThrows(ConfigurationException.class, () -> new LevelAwareSampler(Double.NaN, true));
    }
}
