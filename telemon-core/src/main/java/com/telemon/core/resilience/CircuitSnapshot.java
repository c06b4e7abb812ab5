package com.telemon.core.resilience;

import lombok.Value;

import java.time.Instant;

@Value
public class CircuitSnapshot {
    CircuitBreaker.State state;
    int consecutiveFailures;
    /**
     * 最近一次进入 OPEN 的时间，从未熔断时为 null
     */
    Instant openedAt;
}
