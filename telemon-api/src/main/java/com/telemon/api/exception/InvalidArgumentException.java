package com.telemon.api.exception;

/**
 * 无效参数异常
 * 管理类 API 收到不满足要求的参数时抛出。
 */
public class InvalidArgumentException extends TelemonException {

    private final String paramName;

    public InvalidArgumentException(String paramName, String message) {
        super(message);
        this.paramName = paramName;
    }

    public String getParamName() {
        return paramName;
    }
}
