package com.brokerbridge.engine.request;

import java.time.Duration;

/**
 * Caller handle for an issued request.
 */
public class RequestHandle {

    private final PendingRequest request;
    private final RequestTracker tracker;

    public RequestHandle(PendingRequest request, RequestTracker tracker) {
        this.request = request;
        this.tracker = tracker;
    }

    public int getId() {
        return request.getId();
    }

    public RequestKind getKind() {
        return request.getKind();
    }

    public RequestStatus getStatus() {
        return request.getStatus();
    }

    /**
     * @return true while the request is open and can be cancelled upstream
     */
    public boolean isCancellable() {
        return request.getKind().isCancellable() && request.isOpen();
    }

    /**
     * Cancel the request. Idempotent.
     *
     * @return true if this call cancelled it
     */
    public boolean cancel() {
        return tracker.cancel(request.getId());
    }

    /**
     * Wait for a one-shot request to finish.
     *
     * @see RequestTracker#await(PendingRequest, Duration)
     */
    public Object await(Duration timeout) {
        return tracker.await(request, timeout);
    }

    @Override
    public String toString() {
        return "RequestHandle[" + request.getId() + " " + request.getKind() + " " + request.getStatus() + "]";
    }
}
