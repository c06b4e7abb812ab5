package com.telemon.core.resilience;

import com.telemon.api.exception.ConfigurationException;

/**
 * 指数退避（无抖动）
 * 第 n 次重试等待 initial * multiplier^(n-1)，上限 max。
 */
public class ExponentialBackoff {

    private final long initialDelayMillis;
    private final double multiplier;
    private final long maxDelayMillis;

    public ExponentialBackoff(long initialDelayMillis, double multiplier, long maxDelayMillis) {
        if (initialDelayMillis < 0) {
            throw new ConfigurationException("initialBackoffMillis", initialDelayMillis, "must be >= 0");
        }
        if (multiplier < 1.0) {
            throw new ConfigurationException("backoffMultiplier", multiplier, "must be >= 1");
        }
        if (maxDelayMillis < initialDelayMillis) {
            throw new ConfigurationException("maxBackoffMillis", maxDelayMillis, "must be >= initialBackoffMillis");
        }
        this.initialDelayMillis = initialDelayMillis;
        this.multiplier = multiplier;
        this.maxDelayMillis = maxDelayMillis;
    }

    /**
     * @param attempt 重试序号，从 1 开始
     */
    public long delayMillis(int attempt) {
        if (attempt <= 1) {
            return initialDelayMillis;
        }
        double delay = initialDelayMillis * Math.pow(multiplier, attempt - 1);
        if (Double.isInfinite(delay) || delay >= maxDelayMillis) {
            return maxDelayMillis;
        }
        return (long) delay;
    }
}
