package com.brokerbridge.engine.event;

public record NewsArticleEvent(int requestId, String articleType, String articleText) implements RequestScopedEvent {

    @Override
    public EventKind kind() {
        return EventKind.NEWS_ARTICLE;
    }
}
