package com.telemon.api.exception;

/**
 * Telemon 异常基类
 * <p>
 * 所有框架异常均为非受检异常。日志 / 指标 / Span 等热路径从不向调用方抛出，
 * 该层级只出现在启动配置与管理类 API（告警、配置更新）上。
 */
public class TelemonException extends RuntimeException {

    public TelemonException(String message) {
        super(message);
    }

    public TelemonException(String message, Throwable cause) {
        super(message, cause);
    }
}
