package com.brokerbridge.engine.event;

import com.brokerbridge.engine.contract.Contract;

/**
 * An order the broker reports as open, including the broker's view of its parameters.
 */
public record OpenOrderEvent(int orderId, Contract contract, OrderInfo order, String status)
        implements BrokerEvent {

    @Override
    public EventKind kind() {
        return EventKind.OPEN_ORDER;
    }
}
