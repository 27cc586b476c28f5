package com.brokerbridge.engine.event;

/**
 * The transport connected, or lost its connection.
 */
public record ConnectionStateEvent(boolean connected, String reason) implements BrokerEvent {

    @Override
    public EventKind kind() {
        return EventKind.CONNECTION_STATE;
    }
}
