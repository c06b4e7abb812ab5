package com.telemon.runtime;

import com.telemon.api.monitor.Monitor;
import com.telemon.core.config.TelemonConfig;
import com.telemon.core.config.TelemonConfigLoader;
import com.telemon.core.monitor.DefaultMonitor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Telemon Native 启动器
 * <p>
 * 非 Spring 应用通过此类创建遥测句柄。不持有全局单例：
 * 调用方保存 {@link #init} 返回的 {@link Monitor}，并在退出前交给 {@link #shutdown}。
 */
@Slf4j
public final class NativeTelemon {

    public static final String ENV_WRITE_TOKEN = "TELEMON_WRITE_TOKEN";
    public static final String ENV_PROJECT_ID = "TELEMON_PROJECT_ID";
    public static final String ENV_ENDPOINT = "TELEMON_ENDPOINT";
    public static final String ENV_ENVIRONMENT = "ENVIRONMENT";

    // 句柄 -> JVM 关闭钩子
    private static final Map<Monitor, Thread> SHUTDOWN_HOOKS = new ConcurrentHashMap<>();

    private NativeTelemon() {
    }

    /**
     * 以给定配置初始化，并注册 JVM 关闭钩子
     */
    public static Monitor init(TelemonConfig config) {
        return init(config, true);
    }

    public static Monitor init(TelemonConfig config, boolean registerShutdownHook) {
        long start = System.currentTimeMillis();
        log.info("Starting Telemon native runtime: {}", config);

        DefaultMonitor monitor = new DefaultMonitor(config);

        if (registerShutdownHook) {
            Thread hook = new Thread(() -> {
                log.info("Telemon shutting down...");
                monitor.shutdown();
            }, "telemon-shutdown");
            try {
                Runtime.getRuntime().addShutdownHook(hook);
                SHUTDOWN_HOOKS.put(monitor, hook);
            } catch (IllegalStateException e) {
                log.warn("JVM is already shutting down, hook not registered");
            }
        }

        log.info("Telemon native runtime started in {} ms", System.currentTimeMillis() - start);
        return monitor;
    }

    /**
     * 从类路径 telemon.yml 初始化
     */
    public static Monitor initFromClasspath() {
        return init(TelemonConfigLoader.loadFromClasspath(TelemonConfigLoader.DEFAULT_RESOURCE));
    }

    /**
     * 从环境变量初始化；未设置 TELEMON_WRITE_TOKEN 时只使用本地回退 sink
     */
    public static Monitor initFromEnvironment(String serviceName) {
        return init(configFromEnvironment(serviceName, System::getenv));
    }

    /**
     * 由环境变量构造配置
     *
     * @param env 变量查询函数，便于替换
     */
    public static TelemonConfig configFromEnvironment(String serviceName, Function<String, String> env) {
        TelemonConfig.TelemonConfigBuilder builder = TelemonConfig.builder().serviceName(serviceName);

        String token = trimToNull(env.apply(ENV_WRITE_TOKEN));
        if (token != null) {
            builder.apiKey(token);
        } else {
            log.info("{} not set, telemetry stays in the local fallback sink", ENV_WRITE_TOKEN);
        }
        String projectId = trimToNull(env.apply(ENV_PROJECT_ID));
        if (projectId != null) {
            builder.projectId(projectId);
        }
        String endpoint = trimToNull(env.apply(ENV_ENDPOINT));
        if (endpoint != null) {
            builder.endpoint(endpoint);
        }
        String environment = trimToNull(env.apply(ENV_ENVIRONMENT));
        if (environment != null) {
            builder.environment(environment);
        }
        return builder.build().validate();
    }

    /**
     * 关闭句柄并移除关闭钩子
     *
     * @return 排空是否在超时内完成
     */
    public static boolean shutdown(Monitor handle) {
        if (handle == null) {
            return true;
        }
        Thread hook = SHUTDOWN_HOOKS.remove(handle);
        if (hook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM shutdown in progress, hook stays registered");
            }
        }
        return handle.shutdown();
    }

    static boolean hasShutdownHook(Monitor handle) {
        return SHUTDOWN_HOOKS.containsKey(handle);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
