package com.telemon.core.clock;

import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 标识生成
 * <ul>
 * <li>traceId: 32 位十六进制（去掉连字符的 UUID）</li>
 * <li>spanId: 16 位十六进制</li>
 * <li>eventId / batchId: 标准 UUID 字符串</li>
 * </ul>
 */
public final class IdGenerator {

    private IdGenerator() {
    }

    public static String traceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static String spanId() {
        long value;
        do {
            value = ThreadLocalRandom.current().nextLong();
        } while (value == 0L);
        return String.format("%016x", value);
    }

    public static String eventId() {
        return UUID.randomUUID().toString();
    }

    public static String batchId() {
        return UUID.randomUUID().toString();
    }
}
