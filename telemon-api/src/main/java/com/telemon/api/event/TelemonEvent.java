package com.telemon.api.event;

/**
 * 内部事件标记接口
 * 熔断状态变化、投递失败等自监控事件均实现此接口。
 */
public interface TelemonEvent {
}
