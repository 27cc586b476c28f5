package com.brokerbridge.engine.event;

/**
 * An error or notice. {@code requestId} is a request id, an order id, or one of the
 * uncorrelated markers of {@link BrokerEvent}.
 */
public record ErrorEvent(int requestId, int errorCode, String message, String advancedOrderRejectJson)
        implements RequestScopedEvent {

    public ErrorEvent(int requestId, int errorCode, String message) {
        this(requestId, errorCode, message, null);
    }

    public boolean isCorrelated() {
        return BrokerEvent.isCorrelated(requestId);
    }

    @Override
    public EventKind kind() {
        return EventKind.ERROR;
    }
}
