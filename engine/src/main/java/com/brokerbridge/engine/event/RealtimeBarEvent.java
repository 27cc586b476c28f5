package com.brokerbridge.engine.event;

import java.time.Instant;

/**
 * One real-time bar. {@code timestamp} is the start of the bar.
 */
public record RealtimeBarEvent(int requestId, Instant timestamp, double open, double high, double low, double close,
                               double volume, double wap, long count) implements RequestScopedEvent {

    @Override
    public EventKind kind() {
        return EventKind.REALTIME_BAR;
    }
}
