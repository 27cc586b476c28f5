package com.brokerbridge.engine.event;

import com.brokerbridge.engine.contract.Contract;

/**
 * An order that reached a final state, reported by a completed-orders query.
 */
public record CompletedOrderEvent(Contract contract, OrderInfo order, String status, String completedTime,
                                  String completedStatus) implements BrokerEvent {

    @Override
    public EventKind kind() {
        return EventKind.COMPLETED_ORDER;
    }
}
