package com.brokerbridge.engine.event;

import java.time.Instant;

/**
 * One historical bar.
 */
public record BarEvent(int requestId, Instant timestamp, double open, double high, double low, double close,
                       double volume, double wap, long barCount) implements RequestScopedEvent {

    @Override
    public EventKind kind() {
        return EventKind.HISTORICAL_BAR;
    }
}
