package com.telemon.core.sampling;

import com.telemon.api.exception.ConfigurationException;
import com.telemon.api.model.LogLevel;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 按级别感知的概率采样器
 * <p>
 * ERROR 及以上级别总是放行，不消耗随机数；确定性模式下 WARNING 同样直接放行。
 * 其余级别按 sampleRate 做均匀抽样。
 */
public class LevelAwareSampler implements Sampler {

    private final double sampleRate;
    private final boolean deterministic;
    private final DoubleSupplier random;

    public LevelAwareSampler(double sampleRate, boolean deterministic) {
        this(sampleRate, deterministic, () -> ThreadLocalRandom.current().nextDouble());
    }

    public LevelAwareSampler(double sampleRate, boolean deterministic, DoubleSupplier random) {
        if (Double.isNaN(sampleRate) || sampleRate < 0.0 || sampleRate > 1.0) {
            throw new ConfigurationException("sampleRate", sampleRate, "must be within [0, 1]");
        }
        this.sampleRate = sampleRate;
        this.deterministic = deterministic;
        this.random = random;
    }

    public static LevelAwareSampler alwaysOn() {
        return new LevelAwareSampler(1.0, true);
    }

    @Override
    public boolean admit(LogLevel level) {
        if (level == null) {
            return false;
        }
        if (level.isAtLeast(LogLevel.ERROR)) {
            return true;
        }
        if (deterministic && level == LogLevel.WARNING) {
            return true;
        }
        if (sampleRate >= 1.0) {
            return true;
        }
        if (sampleRate <= 0.0) {
            return false;
        }
        return random.getAsDouble() < sampleRate;
    }

    public double getSampleRate() {
        return sampleRate;
    }

    public boolean isDeterministic() {
        return deterministic;
    }
}
