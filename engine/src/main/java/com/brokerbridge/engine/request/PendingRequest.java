package com.brokerbridge.engine.request;

import com.brokerbridge.engine.contract.Contract;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An outstanding request, keyed by its correlation id.
 *
 * <p>Status moves from {@link RequestStatus#OPEN} to exactly one terminal status;
 * the completion future is resolved with it.</p>
 */
public class PendingRequest {

    private final int id;
    private final RequestKind kind;
    private final Instant createdAt;
    private final Contract contract;
    private final Map<String, Object> context;
    private final AtomicReference<RequestStatus> status = new AtomicReference<>(RequestStatus.OPEN);
    private final CompletableFuture<Object> completion = new CompletableFuture<>();
    private final AtomicLong eventCount = new AtomicLong();

    PendingRequest(int id, RequestKind kind, Instant createdAt, Contract contract, Map<String, ?> context) {
        this.id = id;
        this.kind = kind;
        this.createdAt = createdAt;
        this.contract = contract;
        this.context = context == null || context.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public int getId() {
        return id;
    }

    public RequestKind getKind() {
        return kind;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * @return the contract the request is about, or null
     */
    public Contract getContract() {
        return contract;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    @SuppressWarnings("unchecked")
    public <T> T context(String key) {
        return (T) context.get(key);
    }

    public RequestStatus getStatus() {
        return status.get();
    }

    public boolean isOpen() {
        return status.get() == RequestStatus.OPEN;
    }

    /**
     * A view of the completion. Completing the returned future has no effect on the request.
     */
    public CompletableFuture<Object> getCompletion() {
        return completion.copy();
    }

    /**
     * Number of events routed to this request so far.
     */
    public long getEventCount() {
        return eventCount.get();
    }

    void recordEvent() {
        eventCount.incrementAndGet();
    }

    boolean transition(RequestStatus target) {
        return status.compareAndSet(RequestStatus.OPEN, target);
    }

    CompletableFuture<Object> completion() {
        return completion;
    }

    @Override
    public String toString() {
        return "PendingRequest[" + id + " " + kind + " " + status.get()
                + (contract != null ? " " + contract : "") + "]";
    }
}
