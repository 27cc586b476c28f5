package com.brokerbridge.engine.event;

public record FamilyCodeEvent(String accountId, String familyCode) implements BrokerEvent {

    @Override
    public EventKind kind() {
        return EventKind.FAMILY_CODE;
    }
}
