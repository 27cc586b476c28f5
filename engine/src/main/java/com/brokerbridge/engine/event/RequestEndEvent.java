package com.brokerbridge.engine.event;

/**
 * The broker finished answering a one-shot request. {@code source} names the
 * end-of-data callback, e.g. {@code contractDetailsEnd} or {@code openOrderEnd}.
 */
public record RequestEndEvent(int requestId, String source) implements RequestScopedEvent {

    @Override
    public EventKind kind() {
        return EventKind.REQUEST_END;
    }
}
