package com.telemon.api.model;

import java.time.Instant;

/**
 * 可被批量投递的遥测条目
 * 事件、指标样本与健康快照三种形态。
 */
public interface TelemetryItem {

    Kind getKind();

    Instant getTimestamp();

    enum Kind {
        EVENT,
        METRIC,
        HEALTH
    }
}
