package com.brokerbridge.engine.event;

public record OrderStatusEvent(int orderId, String status, double filled, double remaining, double avgFillPrice,
                               long permId, int parentId, double lastFillPrice, int clientId, String whyHeld,
                               double mktCapPrice) implements BrokerEvent {

    /**
     * Status event carrying only the fields the order lifecycle needs.
     */
    public static OrderStatusEvent of(int orderId, String status, double filled, double remaining,
                                      double avgFillPrice) {
        return new OrderStatusEvent(orderId, status, filled, remaining, avgFillPrice, 0, 0, 0, 0, null, 0);
    }

    @Override
    public EventKind kind() {
        return EventKind.ORDER_STATUS;
    }
}
