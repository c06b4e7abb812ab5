package com.telemon.api.trace;

/**
 * 跨进程传播的最小上下文：traceId + spanId
 * <p>
 * 发送方将其序列化进请求元数据，接收方还原为新 Span 的 parent。
 */
public record SpanContext(String traceId, String spanId) {

    public boolean isValid() {
        return traceId != null && !traceId.isBlank() && spanId != null && !spanId.isBlank();
    }
}
