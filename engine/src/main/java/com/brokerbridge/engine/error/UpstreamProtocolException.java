package com.brokerbridge.engine.error;

/**
 * An error code reported by the broker for a specific request or order.
 */
public class UpstreamProtocolException extends BrokerSessionException {

    private final int requestId;
    private final int errorCode;
    private final String upstreamMessage;

    public UpstreamProtocolException(int requestId, int errorCode, String message) {
        super("Broker error " + errorCode + " for request " + requestId + ": " + message);
        this.requestId = requestId;
        this.errorCode = errorCode;
        this.upstreamMessage = message;
    }

    public int getRequestId() {
        return requestId;
    }

    public int getErrorCode() {
        return errorCode;
    }

    /**
     * The broker's own text, without the code and request prefix.
     */
    public String getUpstreamMessage() {
        return upstreamMessage;
    }
}
