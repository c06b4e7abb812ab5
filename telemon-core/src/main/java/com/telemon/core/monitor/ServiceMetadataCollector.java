package com.telemon.core.monitor;

import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 采集主机、运行时与服务元数据，作为批次的 resource 属性
 */
@Slf4j
public final class ServiceMetadataCollector {

    private ServiceMetadataCollector() {
    }

    public static Map<String, Object> collect(String serviceName, String environment, boolean includeHost,
                                              Map<String, Object> additional) {
        Map<String, Object> metadata = new LinkedHashMap<>();

        if (includeHost) {
            Map<String, Object> host = new LinkedHashMap<>();
            try {
                InetAddress local = InetAddress.getLocalHost();
                host.put("name", local.getHostName());
                host.put("ip", local.getHostAddress());
            } catch (UnknownHostException | SecurityException e) {
                log.warn("Failed to resolve local host metadata: {}", e.getMessage());
            }
            host.put("os", System.getProperty("os.name"));
            host.put("os_version", System.getProperty("os.version"));
            host.put("arch", System.getProperty("os.arch"));
            metadata.put("host", host);

            Map<String, Object> runtime = new LinkedHashMap<>();
            runtime.put("java_version", System.getProperty("java.version"));
            runtime.put("java_vendor", System.getProperty("java.vendor"));
            runtime.put("available_processors", Runtime.getRuntime().availableProcessors());
            metadata.put("runtime", runtime);
        }

        Map<String, Object> service = new LinkedHashMap<>();
        service.put("name", serviceName);
        service.put("environment", environment);
        metadata.put("service", service);

        if (additional != null && !additional.isEmpty()) {
            metadata.put("custom", new LinkedHashMap<>(additional));
        }
        return metadata;
    }
}
