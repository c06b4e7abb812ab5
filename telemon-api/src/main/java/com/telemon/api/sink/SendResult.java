package com.telemon.api.sink;

import lombok.Value;

/**
 * 投递结果
 * <p>
 * PARTIAL 与 SUCCESS 显式区分：后端接收了批次但拒绝了部分条目。
 * FAILURE 通过 retryable 区分瞬时错误（网络/超时/5xx/429）与永久错误（鉴权等 4xx）。
 */
@Value
public class SendResult {

    public enum Status {
        SUCCESS,
        PARTIAL,
        FAILURE
    }

    Status status;
    boolean retryable;
    Integer statusCode;
    String message;
    int rejectedCount;

    public static SendResult success() {
        return new SendResult(Status.SUCCESS, false, null, null, 0);
    }

    public static SendResult success(int statusCode) {
        return new SendResult(Status.SUCCESS, false, statusCode, null, 0);
    }

    public static SendResult partial(int rejectedCount, String message) {
        return new SendResult(Status.PARTIAL, false, null, message, rejectedCount);
    }

    public static SendResult transientFailure(String message) {
        return new SendResult(Status.FAILURE, true, null, message, 0);
    }

    public static SendResult transientFailure(int statusCode, String message) {
        return new SendResult(Status.FAILURE, true, statusCode, message, 0);
    }

    public static SendResult permanentFailure(String message) {
        return new SendResult(Status.FAILURE, false, null, message, 0);
    }

    public static SendResult permanentFailure(int statusCode, String message) {
        return new SendResult(Status.FAILURE, false, statusCode, message, 0);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isPartial() {
        return status == Status.PARTIAL;
    }

    public boolean isFailure() {
        return status == Status.FAILURE;
    }
}
