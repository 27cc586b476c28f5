package com.brokerbridge.engine.event;

public record NewsProviderEvent(String providerCode, String providerName) implements BrokerEvent {

    @Override
    public EventKind kind() {
        return EventKind.NEWS_PROVIDER;
    }
}
