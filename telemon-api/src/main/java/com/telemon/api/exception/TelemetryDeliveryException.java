package com.telemon.api.exception;

/**
 * 投递异常
 * <p>
 * 仅在投递管线内部流转，用于携带传输层失败信息，不会越过管线边界。
 */
public class TelemetryDeliveryException extends TelemonException {

    private final boolean retryable;

    public TelemetryDeliveryException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public TelemetryDeliveryException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
