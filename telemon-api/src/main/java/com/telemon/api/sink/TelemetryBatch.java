package com.telemon.api.sink;

import com.telemon.api.model.TelemetryItem;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次投递的批次
 * <p>
 * 条目顺序即入队顺序；批次在 flush 时整体移交投递管线。
 * resource 为服务级元数据（服务名、环境、主机等）。
 */
@Value
public class TelemetryBatch {

    String batchId;
    Instant createdAt;
    List<TelemetryItem> items;
    Map<String, Object> resource;

    public TelemetryBatch(String batchId, Instant createdAt, List<? extends TelemetryItem> items,
                          Map<String, Object> resource) {
        this.batchId = batchId;
        this.createdAt = createdAt;
        this.items = items == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(items));
        this.resource = resource == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(resource));
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
