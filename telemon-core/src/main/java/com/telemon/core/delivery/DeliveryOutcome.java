package com.telemon.core.delivery;

/**
 * 单个批次的投递结果
 */
public enum DeliveryOutcome {
    /**
     * 远端完整接收
     */
    DELIVERED,
    /**
     * 远端接收但拒绝了部分条目
     */
    PARTIALLY_DELIVERED,
    /**
     * 熔断拒绝，批次进入重试缓冲区，未发生网络 I/O
     */
    SHORT_CIRCUITED,
    /**
     * 写入本地兜底落点
     */
    FALLBACK,
    /**
     * 重试耗尽、永久失败或队列溢出而丢弃
     */
    DROPPED;

    public boolean isPersisted() {
        return this == DELIVERED || this == PARTIALLY_DELIVERED || this == FALLBACK;
    }
}
