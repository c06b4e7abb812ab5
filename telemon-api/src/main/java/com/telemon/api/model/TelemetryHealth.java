package com.telemon.api.model;

import lombok.Builder;
import lombok.Value;

/**
 * 遥测子系统自身的健康视图
 * 投递失败只通过此视图与自监控事件暴露，不以异常形式出现在调用点。
 */
@Value
@Builder
public class TelemetryHealth {
    String circuitState;
    int consecutiveFailures;
    boolean remoteSinkConfigured;
    boolean shutdown;

    long enqueuedItems;
    long droppedItems;
    int pendingItems;

    long deliveredBatches;
    long partialBatches;
    long failedBatches;
    long shortCircuitedBatches;
    long fallbackBatches;
    int retryBufferSize;
}
