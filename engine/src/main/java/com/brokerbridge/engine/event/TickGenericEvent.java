package com.brokerbridge.engine.event;

public record TickGenericEvent(int requestId, String tickType, double value) implements RequestScopedEvent {

    @Override
    public EventKind kind() {
        return EventKind.TICK_GENERIC;
    }
}
