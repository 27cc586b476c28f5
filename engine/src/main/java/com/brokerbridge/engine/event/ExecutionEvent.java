package com.brokerbridge.engine.event;

import com.brokerbridge.engine.contract.Contract;

/**
 * A fill. {@code requestId} is the executions query id, or -1 for fills pushed as they happen.
 */
public record ExecutionEvent(int requestId, Contract contract, String execId, int orderId, String time,
                             String account, String exchange, String side, double shares, double price,
                             long permId, double cumQty, double avgPrice) implements RequestScopedEvent {

    @Override
    public EventKind kind() {
        return EventKind.EXECUTION;
    }
}
