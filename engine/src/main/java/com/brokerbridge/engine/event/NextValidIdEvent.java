package com.brokerbridge.engine.event;

public record NextValidIdEvent(int orderId) implements BrokerEvent {

    @Override
    public EventKind kind() {
        return EventKind.NEXT_VALID_ID;
    }
}
