package com.brokerbridge.engine.event;

import java.time.Instant;

/**
 * A last-trade tick, real-time or historical.
 */
public record TradeTickEvent(int requestId, Instant timestamp, double price, double size, String exchange,
                             String specialConditions, boolean pastLimit, boolean unreported)
        implements RequestScopedEvent {

    @Override
    public EventKind kind() {
        return EventKind.TRADE_TICK;
    }
}
