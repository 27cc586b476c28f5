package com.brokerbridge.engine.event;

/**
 * An event answering a request, matched on its correlation id.
 */
public interface RequestScopedEvent extends BrokerEvent {

    int requestId();
}
