package com.telemon.api.event;

@FunctionalInterface
public interface TelemonEventListener<E extends TelemonEvent> {

    void onEvent(E event);
}
