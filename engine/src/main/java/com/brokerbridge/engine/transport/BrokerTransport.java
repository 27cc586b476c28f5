package com.brokerbridge.engine.transport;

import java.io.IOException;

/**
 * The decoded command/event boundary to the broker gateway.
 *
 * <p>Implementations own the wire codec and the receipt thread. Decoded events are
 * delivered to the listener passed to {@link #connect}, in arrival order, on that
 * receipt thread. A transport serves exactly one session.</p>
 */
public interface BrokerTransport {

    /**
     * Open the connection. Events start flowing to {@code listener} once this returns.
     *
     * @throws IOException if the gateway cannot be reached
     */
    void connect(String host, int port, int clientId, InboundEventListener listener) throws IOException;

    void disconnect();

    boolean isConnected();

    /**
     * Queue a command for sending. Must not block on the network.
     *
     * @throws com.brokerbridge.engine.error.ConnectionException if the transport is not connected
     */
    void send(OutboundCommand command);
}
