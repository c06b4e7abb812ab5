package com.telemon.core.sink;

import com.telemon.api.model.HealthState;
import com.telemon.api.model.HealthStatus;
import com.telemon.api.model.MetricSample;
import com.telemon.api.model.TelemetryEvent;
import com.telemon.api.model.TelemetryItem;
import com.telemon.api.sink.SendResult;
import com.telemon.api.sink.TelemetryBatch;
import com.telemon.api.sink.TelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 控制台落点
 * <p>
 * 通过 SLF4J（logger 名 {@value #LOGGER_NAME}）逐条输出，日志级别与事件级别对应。
 * 实际输出位置由宿主应用的日志后端决定。
 */
public class ConsoleTelemetrySink implements TelemetrySink {

    public static final String LOGGER_NAME = "telemon.console";

    private final Logger output;

    public ConsoleTelemetrySink() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    public ConsoleTelemetrySink(Logger output) {
        this.output = output;
    }

    @Override
    public SendResult send(TelemetryBatch batch) {
        for (TelemetryItem item : batch.getItems()) {
            write(item);
        }
        return SendResult.success();
    }

    private void write(TelemetryItem item) {
        if (item instanceof TelemetryEvent) {
            writeEvent((TelemetryEvent) item);
        } else if (item instanceof MetricSample) {
            MetricSample m = (MetricSample) item;
            output.info("[metric] {}={}{} tags={}", m.getName(), m.getValue(),
                    m.getUnit() != null ? " " + m.getUnit() : "", m.getTags());
        } else if (item instanceof HealthStatus) {
            HealthStatus h = (HealthStatus) item;
            if (h.getStatus() == HealthState.HEALTHY) {
                output.info("[health] {} {} {}", h.getServiceId(), h.getStatus().value(), h.getMessage());
            } else {
                output.warn("[health] {} {} {}", h.getServiceId(), h.getStatus().value(), h.getMessage());
            }
        }
    }

    private void writeEvent(TelemetryEvent e) {
        String trace = e.getTraceId() != null ? " trace=" + e.getTraceId() : "";
        switch (e.getLevel()) {
            case DEBUG:
                output.debug("[{}][{}] {} data={}{}", e.getComponent(), e.getEventType().value(), e.getMessage(), e.getData(), trace);
                break;
            case INFO:
                output.info("[{}][{}] {} data={}{}", e.getComponent(), e.getEventType().value(), e.getMessage(), e.getData(), trace);
                break;
            case WARNING:
                output.warn("[{}][{}] {} data={}{}", e.getComponent(), e.getEventType().value(), e.getMessage(), e.getData(), trace);
                break;
            default:
                output.error("[{}][{}] {} data={}{}", e.getComponent(), e.getEventType().value(), e.getMessage(), e.getData(), trace);
                break;
        }
    }

    @Override
    public String getName() {
        return "console";
    }

    @Override
    public boolean isLocal() {
        return true;
    }
}
