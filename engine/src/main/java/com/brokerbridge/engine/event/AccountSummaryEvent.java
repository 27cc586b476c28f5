package com.brokerbridge.engine.event;

public record AccountSummaryEvent(int requestId, String account, String tag, String value, String currency)
        implements RequestScopedEvent {

    @Override
    public EventKind kind() {
        return EventKind.ACCOUNT_SUMMARY;
    }
}
