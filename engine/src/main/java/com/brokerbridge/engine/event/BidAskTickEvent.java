package com.brokerbridge.engine.event;

import java.time.Instant;

public record BidAskTickEvent(int requestId, Instant timestamp, double bidPrice, double askPrice,
                              double bidSize, double askSize, boolean bidPastLow, boolean askPastHigh)
        implements RequestScopedEvent {

    @Override
    public EventKind kind() {
        return EventKind.BID_ASK_TICK;
    }
}
