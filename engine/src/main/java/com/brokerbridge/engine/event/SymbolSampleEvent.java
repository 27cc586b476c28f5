package com.brokerbridge.engine.event;

import com.brokerbridge.engine.contract.Contract;

import java.util.List;

/**
 * One instrument matching a symbol pattern, with the derivative types listed on it.
 */
public record SymbolSampleEvent(int requestId, Contract contract, List<String> derivativeSecTypes)
        implements RequestScopedEvent {

    @Override
    public EventKind kind() {
        return EventKind.SYMBOL_SAMPLE;
    }
}
