package com.brokerbridge.engine.event;

public record PnlEvent(int requestId, double dailyPnl, double unrealizedPnl, double realizedPnl)
        implements RequestScopedEvent {

    @Override
    public EventKind kind() {
        return EventKind.PNL;
    }
}
