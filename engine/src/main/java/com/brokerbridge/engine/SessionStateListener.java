package com.brokerbridge.engine;

/**
 * Notified of session state changes. Exceptions thrown by a listener are logged and ignored.
 */
@FunctionalInterface
public interface SessionStateListener {

    void onSessionStateChange(BrokerSession session, SessionState oldState, SessionState newState);
}
