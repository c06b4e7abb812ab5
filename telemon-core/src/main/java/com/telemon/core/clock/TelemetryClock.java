package com.telemon.core.clock;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * 时间源
 * <p>
 * 墙上时间用于事件时间戳，单调时间用于耗时与超时计算。
 * 熔断器、批处理引擎统一依赖此接口，测试中以可控时钟替换。
 */
public interface TelemetryClock {

    /**
     * 墙上时间（UTC）
     */
    Instant now();

    /**
     * 单调时间（纳秒），仅用于计算差值
     */
    long monotonicNanos();

    default long monotonicMillis() {
        return TimeUnit.NANOSECONDS.toMillis(monotonicNanos());
    }

    static TelemetryClock system() {
        return SystemTelemetryClock.INSTANCE;
    }
}
