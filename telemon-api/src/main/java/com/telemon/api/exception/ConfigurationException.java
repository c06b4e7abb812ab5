package com.telemon.api.exception;

/**
 * 配置异常
 * 缺失或非法的配置项，在初始化阶段同步抛给调用方。
 */
public class ConfigurationException extends TelemonException {

    private final String field;
    private final Object invalidValue;

    public ConfigurationException(String message) {
        super(message);
        this.field = null;
        this.invalidValue = null;
    }

    public ConfigurationException(String field, Object invalidValue, String message) {
        super("Invalid configuration '" + field + "' = " + invalidValue + ": " + message);
        this.field = field;
        this.invalidValue = invalidValue;
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.field = null;
        this.invalidValue = null;
    }

    public String getField() {
        return field;
    }

    public Object getInvalidValue() {
        return invalidValue;
    }
}
