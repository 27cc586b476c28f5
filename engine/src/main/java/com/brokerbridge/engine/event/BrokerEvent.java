package com.brokerbridge.engine.event;

/**
 * A decoded inbound event from the broker gateway.
 */
public interface BrokerEvent {

    /**
     * Correlation id the broker uses for events not tied to a request.
     */
    int NO_REQUEST_ID = -1;

    /**
     * Correlation id the broker puts on session-wide errors and notices.
     */
    int UNSET_REQUEST_ID = Integer.MAX_VALUE;

    EventKind kind();

    static boolean isCorrelated(int requestId) {
        return requestId != NO_REQUEST_ID && requestId != UNSET_REQUEST_ID;
    }
}
