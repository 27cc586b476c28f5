package com.brokerbridge.engine.order;

/**
 * Result of cancelling one order.
 *
 * @param state the order state when the cancel was handled
 * @param detail failure reason, or null
 */
public record CancelOutcome(int orderId, Status status, OrderState state, String detail) {

    public enum Status {
        /** Cancel sent to the broker; the order becomes CANCELLED when the broker confirms */
        REQUESTED,
        /** Nothing to cancel, the order already reached a terminal state */
        ALREADY_TERMINAL,
        /** The cancel could not be sent */
        FAILED
    }

    public static CancelOutcome requested(int orderId, OrderState state) {
        return new CancelOutcome(orderId, Status.REQUESTED, state, null);
    }

    public static CancelOutcome alreadyTerminal(int orderId, OrderState state) {
        return new CancelOutcome(orderId, Status.ALREADY_TERMINAL, state, null);
    }

    public static CancelOutcome failed(int orderId, OrderState state, String detail) {
        return new CancelOutcome(orderId, Status.FAILED, state, detail);
    }
}
