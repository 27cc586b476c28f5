package com.brokerbridge.engine.event;

import java.time.Instant;

/**
 * A historical headline. The raw headline may start with a {@code {...}} metadata block.
 */
public record HistoricalNewsEvent(int requestId, Instant timestamp, String providerCode, String articleId,
                                  String headline) implements RequestScopedEvent {

    @Override
    public EventKind kind() {
        return EventKind.HISTORICAL_NEWS;
    }
}
