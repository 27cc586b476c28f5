package com.brokerbridge.engine.event;

public record TickStringEvent(int requestId, String tickType, String value) implements RequestScopedEvent {

    @Override
    public EventKind kind() {
        return EventKind.TICK_STRING;
    }
}
