package com.brokerbridge.metrics;

import com.brokerbridge.engine.transport.BrokerTransport;
import com.brokerbridge.engine.transport.InboundEventListener;
import com.brokerbridge.engine.transport.OutboundCommand;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Accepts every command and never answers.
 */
public class LoopbackTransport implements BrokerTransport {

    private final List<OutboundCommand> sent = new CopyOnWriteArrayList<>();
    private volatile boolean connected;

    @Override
    public void connect(String host, int port, int clientId, InboundEventListener listener) {
        connected = true;
    }

    @Override
    public void disconnect() {
        connected = false;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void send(OutboundCommand command) {
        sent.add(command);
    }

    public List<OutboundCommand> sent() {
        return sent;
    }
}
