package com.brokerbridge.engine.order;

/**
 * Notified after each order state transition, on the thread that applied it.
 */
@FunctionalInterface
public interface OrderStateListener {

    void onOrderStateChanged(TrackedOrder order, OrderState previous, OrderState current);
}
