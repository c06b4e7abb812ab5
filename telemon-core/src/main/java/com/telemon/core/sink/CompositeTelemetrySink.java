package com.telemon.core.sink;

import com.telemon.api.sink.SendResult;
import com.telemon.api.sink.TelemetryBatch;
import com.telemon.api.sink.TelemetrySink;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 组合落点：依次写入所有成员，任一成员成功即视为成功
 */
@Slf4j
public class CompositeTelemetrySink implements TelemetrySink {

    private final List<TelemetrySink> delegates;

    public CompositeTelemetrySink(List<? extends TelemetrySink> delegates) {
        this.delegates = Collections.unmodifiableList(new ArrayList<>(delegates));
    }

    @Override
    public SendResult send(TelemetryBatch batch) {
        boolean anySuccess = false;
        String lastError = null;
        for (TelemetrySink sink : delegates) {
            try {
                SendResult result = sink.send(batch);
                if (!result.isFailure()) {
                    anySuccess = true;
                } else {
                    lastError = result.getMessage();
                }
            } catch (RuntimeException e) {
                lastError = e.getMessage();
                log.warn("[Sink:{}] Local sink failed for batch {}: {}", sink.getName(), batch.getBatchId(), e.getMessage());
            }
        }
        return anySuccess || delegates.isEmpty()
                ? SendResult.success()
                : SendResult.permanentFailure(lastError);
    }

    public List<TelemetrySink> getDelegates() {
        return delegates;
    }

    @Override
    public String getName() {
        return "composite";
    }

    @Override
    public boolean isLocal() {
        return delegates.stream().allMatch(TelemetrySink::isLocal);
    }

    @Override
    public void close() {
        for (TelemetrySink sink : delegates) {
            try {
                sink.close();
            } catch (RuntimeException e) {
                log.warn("[Sink:{}] Failed to close: {}", sink.getName(), e.getMessage());
            }
        }
    }
}
