package com.telemon.api.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 运行期日志过滤配置
 * <p>
 * include* 为 null 表示不限制；exclude* 优先于 include*。
 * 构造时复制调用方传入的集合，之后对原集合的修改不影响过滤结果。
 */
@Value
public class LogConfig {

    String serviceName;

    String environment;

    LogLevel minLevel;

    Set<String> includeComponents;

    Set<String> excludeComponents;

    Set<EventType> includeEventTypes;

    Set<EventType> excludeEventTypes;

    /**
     * 附加到所有事件 data 中的字段
     */
    Map<String, Object> additionalFields;

    @Builder(toBuilder = true)
    private LogConfig(String serviceName,
                      String environment,
                      LogLevel minLevel,
                      Set<String> includeComponents,
                      Set<String> excludeComponents,
                      Set<EventType> includeEventTypes,
                      Set<EventType> excludeEventTypes,
                      Map<String, Object> additionalFields) {
        this.serviceName = serviceName;
        this.environment = environment;
        this.minLevel = minLevel;
        this.includeComponents = includeComponents == null ? null : copyOf(includeComponents);
        this.excludeComponents = excludeComponents == null ? Collections.emptySet() : copyOf(excludeComponents);
        this.includeEventTypes = includeEventTypes == null ? null : copyOf(includeEventTypes);
        this.excludeEventTypes = excludeEventTypes == null ? Collections.emptySet() : copyOf(excludeEventTypes);
        this.additionalFields = additionalFields == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(additionalFields));
    }

    private static <T> Set<T> copyOf(Set<T> source) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(source));
    }

    /**
     * 判断一条事件是否通过过滤
     */
    public boolean accepts(LogLevel level, String component, EventType eventType) {
        if (level == null || !level.isAtLeast(minLevel)) {
            return false;
        }
        if (excludeComponents.contains(component)) {
            return false;
        }
        if (includeComponents != null && !includeComponents.contains(component)) {
            return false;
        }
        if (excludeEventTypes.contains(eventType)) {
            return false;
        }
        return includeEventTypes == null || includeEventTypes.contains(eventType);
    }

    public static class LogConfigBuilder {
        private String environment = "development";
        private LogLevel minLevel = LogLevel.INFO;
    }
}
