package com.brokerbridge.engine.error;

/**
 * Base class of all failures surfaced by a broker session.
 */
public class BrokerSessionException extends RuntimeException {

    public BrokerSessionException(String message) {
        super(message);
    }

    public BrokerSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
