package com.brokerbridge.engine.error;

/**
 * An order operation was attempted on a session configured read-only.
 * Raised before anything is sent upstream.
 */
public class ReadOnlySessionException extends BrokerSessionException {

    public ReadOnlySessionException(String operation) {
        super(operation + " is not allowed on a read-only session");
    }
}
