package com.telemon.core.resilience;

import java.time.Duration;

/**
 * 熔断器接口
 * <p>
 * allowRequest 是唯一的读入口，recordSuccess / recordFailure 是唯一的变更入口。
 */
public interface CircuitBreaker {

    /**
     * 是否允许请求通过
     */
    boolean allowRequest();

    /**
     * 记录成功
     */
    void recordSuccess();

    /**
     * 记录失败
     */
    void recordFailure();

    /**
     * OPEN 且恢复期已过，下一次 allowRequest 将获得试探资格；不改变状态
     */
    boolean isTrialDue();

    /**
     * 获取当前状态
     */
    State getState();

    /**
     * 不可变状态快照
     */
    CircuitSnapshot snapshot();

    /**
     * 自上次离开 CLOSED 起持续的时长；CLOSED 时为 0
     */
    Duration openDuration();

    enum State {
        CLOSED, // 关闭（正常）
        OPEN, // 打开（熔断）
        HALF_OPEN // 半开（试探）
    }
}
