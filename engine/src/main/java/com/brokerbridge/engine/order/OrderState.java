package com.brokerbridge.engine.order;

/**
 * Lifecycle state of an order.
 *
 * <p>States only move forward: CREATED, SUBMITTED, ACKNOWLEDGED, PARTIALLY_FILLED, then
 * one of the terminal states. Partial fills may repeat. Steps may be skipped, since the
 * broker does not report every intermediate status.</p>
 */
public enum OrderState {
    /** Known locally, not yet sent */
    CREATED(0),
    /** Sent, not yet accepted by the broker */
    SUBMITTED(1),
    /** Working at the broker */
    ACKNOWLEDGED(2),
    PARTIALLY_FILLED(3),
    FILLED(4),
    CANCELLED(4),
    REJECTED(4);

    private final int rank;

    OrderState(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return rank == 4;
    }

    public boolean canTransitionTo(OrderState target) {
        if (isTerminal()) {
            return false;
        }
        return target.rank > rank || (this == PARTIALLY_FILLED && target == PARTIALLY_FILLED);
    }

    /**
     * Map a broker order status string.
     *
     * @return the state the status implies, or null if it implies no transition
     */
    public static OrderState fromUpstreamStatus(String status, double filled, double remaining) {
        if (status == null) {
            return null;
        }
        switch (status) {
            case "PendingSubmit":
            case "ApiPending":
                return SUBMITTED;
            case "PreSubmitted":
            case "Submitted":
                return filled > 0 ? PARTIALLY_FILLED : ACKNOWLEDGED;
            case "Filled":
                return remaining > 0 ? PARTIALLY_FILLED : FILLED;
            case "Cancelled":
            case "ApiCancelled":
                return CANCELLED;
            case "Inactive":
                return REJECTED;
            default:
                // PendingCancel and anything unknown
                return null;
        }
    }
}
