package com.telemon.api.exception;

/**
 * 告警或告警实例不存在
 */
public class AlertNotFoundException extends TelemonException {

    private final String id;

    public AlertNotFoundException(String id) {
        super("Alert not found: " + id);
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
