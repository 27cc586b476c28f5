package com.brokerbridge.engine.id;

/**
 * How a session obtains order ids from the broker.
 */
public enum OrderIdStrategy {
    /**
     * Ask the broker for every id; re-ask when an answer does not arrive in time.
     * The broker occasionally drops this request silently.
     */
    RETRY,
    /**
     * Ask the broker for every id, once. Fails fast.
     */
    BASIC,
    /**
     * Take the broker's id once at connect and count up locally. Unsafe when another
     * connection shares the same client id.
     */
    INCREMENT
}
