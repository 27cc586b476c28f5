package com.brokerbridge.engine.event;

import com.brokerbridge.engine.contract.ContractDetails;

public record ContractDetailsEvent(int requestId, ContractDetails details) implements RequestScopedEvent {

    @Override
    public EventKind kind() {
        return EventKind.CONTRACT_DETAILS;
    }
}
