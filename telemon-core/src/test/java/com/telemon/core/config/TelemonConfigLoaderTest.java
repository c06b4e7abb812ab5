package com.telemon.core.config;

import com.telemon.api.exception.ConfigurationException;
import com.telemon.api.model.LogLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TelemonConfigLoader 单元测试")
class TelemonConfigLoaderTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("加载")
    class LoadTests {

        @Test
        @DisplayName("从 classpath 加载 telemon.yml")
        void shouldLoadFromClasspath() {
            TelemonConfig config = TelemonConfigLoader.loadFromClasspath(TelemonConfigLoader.DEFAULT_RESOURCE);

            assertEquals("order-service", config.getServiceName());
            assertEquals("staging", config.getEnvironment());
            assertEquals(LogLevel.WARNING, config.getMinLogLevel());
            assertEquals(0.5, config.getSampleRate());
            assertEquals(25, config.getBatchSize());
            assertEquals(Duration.ofMillis(2500), config.getFlushInterval());
            assertEquals(4, config.getMaxRetries());
            assertEquals(3, config.getFailureThreshold());
            assertEquals(List.of("password", "ssn"), config.getRedactedKeys());
            assertEquals("payments", config.getGlobalTags().get("team"));
            assertEquals("checkout", config.getAdditionalMetadata().get("owner"));
            assertFalse(config.isConsoleFallback());
        }

        @Test
        @DisplayName("无顶层 telemon 节点时直接读取键值")
        void shouldAcceptFlatDocument() {
            TelemonConfig config = TelemonConfigLoader.load(yaml("service_name: flat\nbatch_size: \"7\"\n"));

            assertEquals("flat", config.getServiceName());
            assertEquals(7, config.getBatchSize());
        }

        @Test
        @DisplayName("从文件加载")
        void shouldLoadFromPath(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("telemon.yml");
            Files.writeString(file, "telemon:\n  service_name: from-file\n  api_key: abc\n");

            TelemonConfig config = TelemonConfigLoader.load(file);

            assertEquals("from-file", config.getServiceName());
            assertTrue(config.hasRemoteSink());
        }

        @Test
        @DisplayName("未知键被忽略")
        void unknownKeysShouldBeIgnored() {
            TelemonConfig config = TelemonConfigLoader.load(yaml("service_name: svc\nfuture_option: 1\n"));

            assertEquals("svc", config.getServiceName());
        }
    }

    @Nested
    @DisplayName("错误")
    class ErrorTests {

        @Test
        @DisplayName("类型错误报告字段名")
        void typeErrorShouldNameField() {
            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> TelemonConfigLoader.load(yaml("service_name: svc\nbatch_size: many\n")));

            assertEquals("batch_size", e.getField());
        }

        @Test
        @DisplayName("小数不能作为整数")
        void fractionalIntegerShouldFail() {
            assertThrows(ConfigurationException.class,
                    () -> TelemonConfigLoader.load(yaml("service_name: svc\nmax_retries: 1.5\n")));
        }

        @Test
        @DisplayName("未知日志级别")
        void unknownLevelShouldFail() {
            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> TelemonConfigLoader.load(yaml("service_name: svc\nmin_log_level: loud\n")));

            assertEquals("min_log_level", e.getField());
        }

        @Test
        @DisplayName("加载结果经过校验")
        void loadedConfigShouldBeValidated() {
            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> TelemonConfigLoader.load(yaml("service_name: svc\nsample_rate: 2\n")));

            assertEquals("sampleRate", e.getField());
        }

        @Test
        @DisplayName("非映射根节点与非法 YAML")
        void malformedDocumentsShouldFail() {
            assertThrows(ConfigurationException.class, () -> TelemonConfigLoader.load(yaml("- a\n- b\n")));
            assertThrows(ConfigurationException.class, () -> TelemonConfigLoader.load(yaml("a: [unclosed\n")));
            assertThrows(ConfigurationException.class, () -> TelemonConfigLoader.load(yaml("a: 1\na: 2\n")));
        }

        @Test
        @DisplayName("classpath 资源缺失")
        void missingResourceShouldFail() {
            assertThrows(ConfigurationException.class, () -> TelemonConfigLoader.loadFromClasspath("missing.yml"));
        }

        @Test
        @DisplayName("禁止任意类型标签")
        void shouldRejectJavaTypeTags() {
            assertThrows(ConfigurationException.class, () -> TelemonConfigLoader.load(
                    yaml("service_name: !!javax.script.ScriptEngineManager [x]\n")));
        }
    }
}
