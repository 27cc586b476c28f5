package com.brokerbridge.engine.order;

import com.brokerbridge.engine.contract.RegisteredContract;

/**
 * Caller handle for an order placed through a session.
 */
public class OrderHandle {

    private final TrackedOrder order;
    private final RegisteredContract contract;

    public OrderHandle(TrackedOrder order, RegisteredContract contract) {
        this.order = order;
        this.contract = contract;
    }

    public int getOrderId() {
        return order.getOrderId();
    }

    public RegisteredContract getContract() {
        return contract;
    }

    public OrderState getState() {
        return order.getState();
    }

    public TrackedOrder getOrder() {
        return order;
    }

    @Override
    public String toString() {
        return "OrderHandle[" + order.getOrderId() + " " + order.getState() + "]";
    }
}
