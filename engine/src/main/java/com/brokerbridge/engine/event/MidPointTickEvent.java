package com.brokerbridge.engine.event;

import java.time.Instant;

public record MidPointTickEvent(int requestId, Instant timestamp, double midPoint) implements RequestScopedEvent {

    @Override
    public EventKind kind() {
        return EventKind.MID_POINT_TICK;
    }
}
