package com.telemon.core.config;

import com.telemon.api.exception.ConfigurationException;
import com.telemon.api.model.LogLevel;
import com.telemon.core.redact.DataSanitizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TelemonConfig 单元测试")
class TelemonConfigTest {

    @Nested
    @DisplayName("预设")
    class PresetTests {

        @Test
        @DisplayName("默认配置")
        void defaultsShouldMatchDocumentedValues() {
            TelemonConfig config = TelemonConfig.defaults("svc").validate();

            assertEquals("svc", config.getServiceName());
            assertEquals("development", config.getEnvironment());
            assertEquals(LogLevel.INFO, config.getMinLogLevel());
            assertEquals(50, config.getBatchSize());
            assertEquals(Duration.ofSeconds(5), config.getFlushInterval());
            assertEquals(3, config.getMaxRetries());
            assertEquals(5, config.getFailureThreshold());
            assertEquals(Duration.ofSeconds(30), config.getRecoveryTimeout());
            assertEquals(1.0, config.getSampleRate());
            assertEquals(DataSanitizer.DEFAULT_REDACTED_KEYS, config.getRedactedKeys());
            assertFalse(config.hasRemoteSink());
        }

        @Test
        @DisplayName("开发预设：DEBUG 级别、小批次、快速刷新")
        void developmentPreset() {
            TelemonConfig config = TelemonConfig.development("svc").validate();

            assertEquals(LogLevel.DEBUG, config.getMinLogLevel());
            assertEquals(10, config.getBatchSize());
            assertEquals(Duration.ofSeconds(1), config.getFlushInterval());
        }

        @Test
        @DisplayName("高吞吐预设：大批次、更大缓冲")
        void highThroughputPreset() {
            TelemonConfig config = TelemonConfig.highThroughput("svc").validate();

            assertEquals("production", config.getEnvironment());
            assertEquals(500, config.getBatchSize());
            assertEquals(100_000, config.getMaxQueueSize());
            assertEquals(2, config.getMaxInFlightDeliveries());
        }

        @Test
        @DisplayName("设置 apiKey 后启用远端落点")
        void apiKeyEnablesRemote() {
            assertTrue(TelemonConfig.defaults("svc").toBuilder().apiKey("t").build().hasRemoteSink());
            assertFalse(TelemonConfig.defaults("svc").toBuilder().apiKey("  ").build().hasRemoteSink());
        }
    }

    @Nested
    @DisplayName("校验")
    class ValidationTests {

        private ConfigurationException invalid(TelemonConfig.TelemonConfigBuilder builder) {
            return assertThrows(ConfigurationException.class, () -> builder.build().validate());
        }

        private TelemonConfig.TelemonConfigBuilder base() {
            return TelemonConfig.defaults("svc").toBuilder();
        }

        @Test
        @DisplayName("服务名不能为空")
        void serviceNameRequired() {
            assertEquals("serviceName", invalid(base().serviceName(" ")).getField());
        }

        @Test
        @DisplayName("采样率必须在 [0, 1]")
        void sampleRateRange() {
            assertEquals("sampleRate", invalid(base().sampleRate(1.5)).getField());
            assertEquals("sampleRate", invalid(base().sampleRate(-0.1)).getField());
            assertEquals("sampleRate", invalid(base().sampleRate(Double.NaN)).getField());
        }

        @Test
        @DisplayName("批次大小至少为 1，队列上限不小于批次大小")
        void batchBounds() {
            assertEquals("batchSize", invalid(base().batchSize(0)).getField());
            assertEquals("maxQueueSize", invalid(base().batchSize(100).maxQueueSize(50)).getField());
        }

        @Test
        @DisplayName("刷新间隔必须为正")
        void flushIntervalPositive() {
            assertEquals("flushIntervalSeconds", invalid(base().flushIntervalSeconds(0)).getField());
        }

        @Test
        @DisplayName("熔断阈值至少为 1，重试次数不能为负")
        void resilienceBounds() {
            assertEquals("failureThreshold", invalid(base().failureThreshold(0)).getField());
            assertEquals("maxRetries", invalid(base().maxRetries(-1)).getField());
        }

        @Test
        @DisplayName("最大退避不能小于初始退避")
        void backoffOrdering() {
            assertEquals("maxBackoffMillis", invalid(base().initialBackoffMillis(500).maxBackoffMillis(100)).getField());
        }

        @Test
        @DisplayName("设置 apiKey 时 endpoint 必填")
        void endpointRequiredWithApiKey() {
            assertEquals("endpoint", invalid(base().apiKey("t").endpoint("")).getField());
        }

        @Test
        @DisplayName("合法配置返回自身")
        void validReturnsSelf() {
            TelemonConfig config = base().build();

            assertSame(config, config.validate());
        }
    }
}
