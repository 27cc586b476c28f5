package com.brokerbridge.engine.event;

import java.util.List;

public record ManagedAccountsEvent(List<String> accounts) implements BrokerEvent {

    @Override
    public EventKind kind() {
        return EventKind.MANAGED_ACCOUNTS;
    }
}
