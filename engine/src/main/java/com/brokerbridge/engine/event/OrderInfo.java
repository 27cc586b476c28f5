package com.brokerbridge.engine.event;

/**
 * The order parameters echoed back by the broker on open and completed order reports.
 */
public record OrderInfo(int orderId, long permId, int clientId, String account, String action, String orderType,
                        double totalQuantity, double limitPrice, double auxPrice, String timeInForce,
                        String orderRef) {
}
