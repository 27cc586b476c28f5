package com.brokerbridge.engine.event;

public record NewsBulletinEvent(int messageId, String messageType, String message, String originExchange)
        implements BrokerEvent {

    @Override
    public EventKind kind() {
        return EventKind.NEWS_BULLETIN;
    }
}
