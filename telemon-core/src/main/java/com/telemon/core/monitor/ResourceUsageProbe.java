package com.telemon.core.monitor;

import com.telemon.api.model.ResourceUsage;
import lombok.extern.slf4j.Slf4j;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.time.Instant;

/**
 * 基于 JVM 管理接口的资源快照
 * <p>
 * CPU 为进程负载；内存为已用堆占最大堆的百分比，memoryRss 取已提交的堆与非堆之和。
 * 磁盘与网络计数 JVM 无法可移植地获取，固定为 0。
 */
@Slf4j
public final class ResourceUsageProbe {

    private ResourceUsageProbe() {
    }

    public static ResourceUsage snapshot() {
        ResourceUsage.ResourceUsageBuilder builder = ResourceUsage.builder().timestamp(Instant.now());

        Runtime runtime = Runtime.getRuntime();
        long used = runtime.totalMemory() - runtime.freeMemory();
        long max = runtime.maxMemory();
        builder.memoryPercent(max > 0 && max != Long.MAX_VALUE ? used * 100.0 / max : 0.0);

        try {
            long committed = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage().getCommitted()
                    + ManagementFactory.getMemoryMXBean().getNonHeapMemoryUsage().getCommitted();
            builder.memoryRss(committed);
        } catch (RuntimeException e) {
            log.debug("Memory MXBean unavailable: {}", e.getMessage());
            builder.memoryRss(used);
        }

        try {
            OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
            if (os instanceof com.sun.management.OperatingSystemMXBean) {
                double load = ((com.sun.management.OperatingSystemMXBean) os).getProcessCpuLoad();
                builder.cpuPercent(load >= 0 ? load * 100.0 : 0.0);
            }
            if (os instanceof com.sun.management.UnixOperatingSystemMXBean) {
                long fds = ((com.sun.management.UnixOperatingSystemMXBean) os).getOpenFileDescriptorCount();
                builder.openFileDescriptors((int) Math.min(Integer.MAX_VALUE, fds));
            }
        } catch (RuntimeException | LinkageError e) {
            log.debug("OS MXBean unavailable: {}", e.getMessage());
        }
        return builder.build();
    }
}
