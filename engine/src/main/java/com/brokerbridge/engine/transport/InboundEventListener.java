package com.brokerbridge.engine.transport;

import com.brokerbridge.engine.event.BrokerEvent;

@FunctionalInterface
public interface InboundEventListener {

    void onEvent(BrokerEvent event);
}
