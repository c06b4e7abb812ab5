package com.telemon.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogConfig / LogLevel 单元测试")
class LogConfigTest {

    @Nested
    @DisplayName("级别")
    class LevelTests {

        @Test
        @DisplayName("按严重程度比较")
        void shouldCompareBySeverity() {
            assertTrue(LogLevel.ERROR.isAtLeast(LogLevel.WARNING));
            assertTrue(LogLevel.INFO.isAtLeast(LogLevel.INFO));
            assertFalse(LogLevel.DEBUG.isAtLeast(LogLevel.INFO));
            assertTrue(LogLevel.DEBUG.isAtLeast(null));
        }

        @Test
        @DisplayName("宽松解析别名与大小写")
        void shouldParseLeniently() {
            assertEquals(LogLevel.WARNING, LogLevel.fromValue("warn"));
            assertEquals(LogLevel.WARNING, LogLevel.fromValue(" Warning "));
            assertEquals(LogLevel.CRITICAL, LogLevel.fromValue("FATAL"));
            assertEquals("critical", LogLevel.CRITICAL.value());
            assertThrows(IllegalArgumentException.class, () -> LogLevel.fromValue("verbose"));
            assertThrows(IllegalArgumentException.class, () -> LogLevel.fromValue(null));
        }
    }

    @Nested
    @DisplayName("过滤")
    class AcceptTests {

        @Test
        @DisplayName("默认只按最低级别过滤")
        void defaultsShouldFilterByLevelOnly() {
            LogConfig config = LogConfig.builder().serviceName("svc").build();

            assertTrue(config.accepts(LogLevel.INFO, "any", EventType.LIFECYCLE));
            assertFalse(config.accepts(LogLevel.DEBUG, "any", EventType.LIFECYCLE));
            assertFalse(config.accepts(null, "any", EventType.LIFECYCLE));
        }

        @Test
        @DisplayName("排除优先于包含")
        void excludeShouldWinOverInclude() {
            LogConfig config = LogConfig.builder()
                    .includeComponents(Set.of("orders", "payments"))
                    .excludeComponents(Set.of("payments"))
                    .build();

            assertTrue(config.accepts(LogLevel.INFO, "orders", EventType.SYSTEM));
            assertFalse(config.accepts(LogLevel.INFO, "payments", EventType.SYSTEM));
            assertFalse(config.accepts(LogLevel.INFO, "billing", EventType.SYSTEM));
        }

        @Test
        @DisplayName("不可变集合下 null 组件与 null 类型不会抛出")
        void nullComponentShouldBeTolerated() {
            LogConfig excluding = LogConfig.builder()
                    .excludeComponents(Set.of("noisy"))
                    .excludeEventTypes(Set.of(EventType.METRIC))
                    .build();
            LogConfig including = LogConfig.builder().includeComponents(Set.of("orders")).build();

            assertTrue(excluding.accepts(LogLevel.INFO, null, null));
            assertFalse(including.accepts(LogLevel.INFO, null, EventType.SYSTEM));
        }

        @Test
        @DisplayName("构造后修改调用方集合不影响过滤")
        void shouldCopyCallerCollections() {
            Set<String> excluded = new HashSet<>();
            excluded.add("noisy");
            Map<String, Object> extra = new HashMap<>();
            extra.put("region", "eu");
            LogConfig config = LogConfig.builder().excludeComponents(excluded).additionalFields(extra).build();

            excluded.clear();
            extra.put("team", "core");

            assertFalse(config.accepts(LogLevel.INFO, "noisy", EventType.SYSTEM));
            assertEquals(Map.of("region", "eu"), config.getAdditionalFields());
            assertThrows(UnsupportedOperationException.class, () -> config.getExcludeComponents().add("x"));
        }

        @Test
        @DisplayName("未设置时取默认环境与级别，toBuilder 保留原值")
        void shouldApplyDefaults() {
            LogConfig config = LogConfig.builder().serviceName("svc").build();
            LogConfig copy = config.toBuilder().minLevel(LogLevel.ERROR).build();

            assertEquals("development", config.getEnvironment());
            assertEquals(LogLevel.INFO, config.getMinLevel());
            assertEquals("svc", copy.getServiceName());
            assertEquals(LogLevel.ERROR, copy.getMinLevel());
            assertNull(copy.getIncludeComponents());
        }

        @Test
        @DisplayName("按事件类型包含与排除")
        void shouldFilterByEventType() {
            LogConfig onlyAuth = LogConfig.builder().includeEventTypes(Set.of(EventType.AUTHENTICATION)).build();
            LogConfig noMetrics = LogConfig.builder().excludeEventTypes(Set.of(EventType.METRIC)).build();

            assertTrue(onlyAuth.accepts(LogLevel.INFO, "auth", EventType.AUTHENTICATION));
            assertFalse(onlyAuth.accepts(LogLevel.CRITICAL, "auth", EventType.SYSTEM));
            assertFalse(noMetrics.accepts(LogLevel.INFO, "svc", EventType.METRIC));
            assertTrue(noMetrics.accepts(LogLevel.INFO, "svc", EventType.REQUEST));
        }
    }
}
