package com.telemon.api.sink;

/**
 * 遥测落点 SPI
 * <p>
 * 远端后端或本地兜底实现此接口。实现应通过 {@link SendResult} 报告失败；
 * 抛出的运行时异常会被投递管线视为瞬时失败。
 */
public interface TelemetrySink {

    /**
     * 同步发送一个批次
     */
    SendResult send(TelemetryBatch batch);

    /**
     * 名称，用于日志
     */
    default String getName() {
        return getClass().getSimpleName();
    }

    /**
     * 是否为本地落点（控制台、内存）
     */
    default boolean isLocal() {
        return false;
    }

    /**
     * 释放资源
     */
    default void close() {
    }
}
