package com.brokerbridge.engine.event;

public record TickSizeEvent(int requestId, String tickType, double size) implements RequestScopedEvent {

    @Override
    public EventKind kind() {
        return EventKind.TICK_SIZE;
    }
}
