package com.brokerbridge.engine.event;

import com.brokerbridge.engine.contract.Contract;

public record PositionEvent(int requestId, String account, String modelCode, Contract contract, double position,
                            double averageCost) implements RequestScopedEvent {

    @Override
    public EventKind kind() {
        return EventKind.POSITION;
    }
}
