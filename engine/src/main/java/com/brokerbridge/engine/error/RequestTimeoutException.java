package com.brokerbridge.engine.error;

import java.time.Duration;

/**
 * A caller-side wait for a correlated response passed its deadline.
 */
public class RequestTimeoutException extends BrokerSessionException {

    private final int requestId;
    private final Duration timeout;

    public RequestTimeoutException(int requestId, Duration timeout, String message) {
        super(message);
        this.requestId = requestId;
        this.timeout = timeout;
    }

    /**
     * @return the correlation id waited on, or -1 when the wait was not tied to one
     */
    public int getRequestId() {
        return requestId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
