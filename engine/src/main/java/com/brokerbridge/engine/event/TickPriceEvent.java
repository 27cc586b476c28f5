package com.brokerbridge.engine.event;

public record TickPriceEvent(int requestId, String tickType, double price, boolean canAutoExecute,
                             boolean pastLimit, boolean preOpen) implements RequestScopedEvent {

    @Override
    public EventKind kind() {
        return EventKind.TICK_PRICE;
    }
}
