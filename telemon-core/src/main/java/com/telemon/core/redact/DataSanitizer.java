package com.telemon.core.redact;

import lombok.extern.slf4j.Slf4j;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 结构化数据脱敏与类型收敛
 * <p>
 * 键名（忽略大小写）包含任一黑名单片段时，值替换为 {@value #REDACTED}，嵌套 Map 递归处理。
 * 值统一收敛为 JSON 安全类型：字符串、数字、布尔、List、Map、null；其余对象取 toString。
 */
@Slf4j
public class DataSanitizer {

    public static final String REDACTED = "***REDACTED***";

    public static final List<String> DEFAULT_REDACTED_KEYS = Collections.unmodifiableList(Arrays.asList(
            "password", "token", "secret", "key", "apikey", "api_key",
            "authorization", "auth", "credential", "credentials"));

    private static final int MAX_DEPTH = 16;

    private final List<String> fragments;

    public DataSanitizer() {
        this(DEFAULT_REDACTED_KEYS);
    }

    public DataSanitizer(Collection<String> redactedKeys) {
        Collection<String> source = redactedKeys != null ? redactedKeys : DEFAULT_REDACTED_KEYS;
        this.fragments = source.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * 脱敏并拷贝；输入为 null 时返回空 Map
     */
    public Map<String, Object> sanitize(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Collections.emptyMap();
        }
        return sanitizeMap(data, 0);
    }

    public boolean isSensitive(String key) {
        if (key == null) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        for (String fragment : fragments) {
            if (lower.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    private Map<String, Object> sanitizeMap(Map<?, ?> data, int depth) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : data.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (isSensitive(key)) {
                result.put(key, REDACTED);
            } else {
                result.put(key, coerce(entry.getValue(), depth + 1));
            }
        }
        return result;
    }

    private Object coerce(Object value, int depth) {
        if (value == null
                || value instanceof String
                || value instanceof Boolean
                || value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte) {
            return value;
        }
        if (depth > MAX_DEPTH) {
            return "[MaxDepth]";
        }
        try {
            if (value instanceof Double || value instanceof Float) {
                double d = ((Number) value).doubleValue();
                // NaN / Infinity 不是合法 JSON 数字
                return Double.isFinite(d) ? value : String.valueOf(d);
            }
            if (value instanceof Number) {
                return value.toString();
            }
            if (value instanceof CharSequence || value instanceof Character || value instanceof UUID) {
                return value.toString();
            }
            if (value instanceof Enum<?>) {
                return ((Enum<?>) value).name();
            }
            if (value instanceof TemporalAccessor) {
                return value.toString();
            }
            if (value instanceof Optional<?>) {
                return coerce(((Optional<?>) value).orElse(null), depth);
            }
            if (value instanceof Map<?, ?>) {
                return sanitizeMap((Map<?, ?>) value, depth);
            }
            if (value instanceof Collection<?>) {
                List<Object> list = new ArrayList<>(((Collection<?>) value).size());
                for (Object element : (Collection<?>) value) {
                    list.add(coerce(element, depth + 1));
                }
                return list;
            }
            if (value.getClass().isArray()) {
                return coerceArray(value, depth);
            }
            if (value instanceof Throwable) {
                Throwable t = (Throwable) value;
                return t.getClass().getSimpleName() + ": " + t.getMessage();
            }
            return String.valueOf(value);
        } catch (RuntimeException e) {
            log.debug("Failed to coerce value of type {}: {}", value.getClass().getName(), e.getMessage());
            return "[" + value.getClass().getSimpleName() + "]";
        }
    }

    private List<Object> coerceArray(Object array, int depth) {
        if (array instanceof Object[]) {
            List<Object> list = new ArrayList<>();
            for (Object element : (Object[]) array) {
                list.add(coerce(element, depth + 1));
            }
            return list;
        }
        int length = java.lang.reflect.Array.getLength(array);
        List<Object> list = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            list.add(coerce(java.lang.reflect.Array.get(array, i), depth + 1));
        }
        return list;
    }

    public List<String> getRedactedKeys() {
        return fragments;
    }
}
