package com.brokerbridge.engine.error;

/**
 * The connection to the broker gateway could not be established or was lost.
 *
 * <p>Fatal to the session. The session does not reconnect on its own.</p>
 */
public class ConnectionException extends BrokerSessionException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
