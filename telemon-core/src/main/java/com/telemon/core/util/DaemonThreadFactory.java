package com.telemon.core.util;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 守护线程工厂，线程名为 {@code prefix-N}（单线程时直接使用 prefix）
 */
@Slf4j
public class DaemonThreadFactory implements ThreadFactory {

    private final String prefix;
    private final boolean numbered;
    private final AtomicInteger threadNumber = new AtomicInteger(1);

    public DaemonThreadFactory(String prefix, boolean numbered) {
        this.prefix = prefix;
        this.numbered = numbered;
    }

    @Override
    public Thread newThread(Runnable r) {
        String name = numbered ? prefix + "-" + threadNumber.getAndIncrement() : prefix;
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        t.setUncaughtExceptionHandler(
                (thread, e) -> log.error("Telemetry thread {} error: {}", thread.getName(), e.getMessage(), e));
        return t;
    }
}
