package com.brokerbridge.engine.event;

/**
 * One account overview value from an account-updates subscription.
 */
public record AccountValueEvent(int requestId, String account, String modelCode, String key, String value,
                                String currency) implements RequestScopedEvent {

    @Override
    public EventKind kind() {
        return EventKind.ACCOUNT_VALUE;
    }
}
