package com.brokerbridge.engine;

/**
 * Lifecycle state of a {@link BrokerSession}.
 */
public enum SessionState {
    /** Created, never connected */
    CREATED,
    /** Transport connect in progress */
    CONNECTING,
    /** Connected and serving requests */
    CONNECTED,
    /** Disconnected by the caller or by connection loss */
    DISCONNECTED;

    public boolean isConnected() {
        return this == CONNECTED;
    }

    /**
     * Numeric form for gauges.
     */
    public int code() {
        return ordinal();
    }
}
