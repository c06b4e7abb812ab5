package com.telemon.api.model;

import java.util.Locale;

/**
 * 日志级别
 * 按严重程度递增排序，ordinal 即比较依据。
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    /**
     * 是否不低于给定级别
     */
    public boolean isAtLeast(LogLevel other) {
        return other == null || this.ordinal() >= other.ordinal();
    }

    /**
     * 线上格式（小写）
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 宽松解析：忽略大小写，兼容 "warn" / "fatal" 别名
     *
     * @throws IllegalArgumentException 无法识别时
     */
    public static LogLevel fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Log level must not be null");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "WARN":
                return WARNING;
            case "FATAL":
                return CRITICAL;
            default:
                return LogLevel.valueOf(normalized);
        }
    }
}
