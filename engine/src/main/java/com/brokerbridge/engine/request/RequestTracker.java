package com.brokerbridge.engine.request;

import com.brokerbridge.config.ClockProvider;
import com.brokerbridge.engine.contract.Contract;
import com.brokerbridge.engine.error.BrokerSessionException;
import com.brokerbridge.engine.error.RequestTimeoutException;
import com.brokerbridge.engine.error.UpstreamProtocolException;
import com.brokerbridge.engine.id.RequestIdSequence;
import com.brokerbridge.engine.transport.CommandGateway;
import com.brokerbridge.engine.transport.OutboundCommand;
import com.brokerbridge.tables.TableWriter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Maps open correlation ids to their {@link PendingRequest}s.
 *
 * <p>Each id is open at most once. A terminal transition is won by compare-and-set on
 * the request status, so cancelling concurrently with completion yields exactly one
 * terminal status. Closing an id that is not open is a warning, not an error: the
 * broker sometimes repeats end-of-data and error callbacks.</p>
 *
 * <p>Every transition is written to the {@code requests} table.</p>
 */
public class RequestTracker {

    private static final Logger log = LoggerFactory.getLogger(RequestTracker.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String ACTION_OPEN = "OPEN";
    static final String ACTION_COMPLETE = "COMPLETE";
    static final String ACTION_ERROR = "ERROR";
    static final String ACTION_CANCEL = "CANCEL";

    private final String sessionName;
    private final RequestIdSequence sequence;
    private final CommandGateway gateway;
    private final TableWriter requestsTable;
    private final ClockProvider clock;

    private final Map<Integer, PendingRequest> open = new ConcurrentHashMap<>();

    private final AtomicLong opened = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong cancelled = new AtomicLong();
    private final AtomicLong staleTransitions = new AtomicLong();

    public RequestTracker(String sessionName, RequestIdSequence sequence, CommandGateway gateway,
                          TableWriter requestsTable, ClockProvider clock) {
        this.sessionName = sessionName;
        this.sequence = sequence;
        this.gateway = gateway;
        this.requestsTable = requestsTable;
        this.clock = clock;
    }

    /**
     * Open a request under a fresh id from the session sequence.
     */
    public PendingRequest open(RequestKind kind, Contract contract, Map<String, ?> context) {
        return register(sequence.next(), kind, contract, context);
    }

    /**
     * Open a request under an id allocated elsewhere, e.g. an order id.
     *
     * @throws IllegalStateException if the id is already open
     */
    public PendingRequest openWithId(int id, RequestKind kind, Contract contract, Map<String, ?> context) {
        return register(id, kind, contract, context);
    }

    private PendingRequest register(int id, RequestKind kind, Contract contract, Map<String, ?> context) {
        PendingRequest request = new PendingRequest(id, kind, clock.instant(), contract, context);
        PendingRequest existing = open.putIfAbsent(id, request);
        if (existing != null) {
            throw new IllegalStateException("[" + sessionName + "] Request id " + id + " is already open: " + existing);
        }
        try {
            writeRow(request, ACTION_OPEN, toJson(request.getContext()));
        } catch (RuntimeException e) {
            open.remove(id, request);
            throw e;
        }
        opened.incrementAndGet();
        log.debug("[{}] Opened {}", sessionName, request);
        return request;
    }

    /**
     * @return false if the id was not open
     */
    public boolean complete(int id, Object result) {
        PendingRequest request = open.get(id);
        if (request == null || !request.transition(RequestStatus.COMPLETED)) {
            return stale(id, "complete");
        }
        open.remove(id, request);
        completed.incrementAndGet();
        writeRow(request, ACTION_COMPLETE, null);
        request.completion().complete(result);
        log.debug("[{}] Completed request {} ({})", sessionName, id, request.getKind());
        return true;
    }

    /**
     * @return false if the id was not open
     */
    public boolean fail(int id, Throwable error) {
        PendingRequest request = open.get(id);
        if (request == null || !request.transition(RequestStatus.ERRORED)) {
            return stale(id, "fail");
        }
        open.remove(id, request);
        failed.incrementAndGet();
        Map<String, Object> note = new LinkedHashMap<>();
        note.put("error", error instanceof UpstreamProtocolException
                ? ((UpstreamProtocolException) error).getUpstreamMessage() : error.getMessage());
        writeRow(request, ACTION_ERROR, toJson(note));
        request.completion().completeExceptionally(error);
        log.debug("[{}] Failed request {} ({}): {}", sessionName, id, request.getKind(), error.getMessage());
        return true;
    }

    /**
     * Stop tracking a request. Cancellable kinds are also cancelled upstream.
     * Safe to call concurrently with completion: only one of them takes effect.
     *
     * @return false if the id was not open
     */
    public boolean cancel(int id) {
        PendingRequest request = open.get(id);
        if (request == null || !request.transition(RequestStatus.CANCELLED)) {
            return stale(id, "cancel");
        }
        open.remove(id, request);
        cancelled.incrementAndGet();
        writeRow(request, ACTION_CANCEL, null);
        request.completion().cancel(false);
        if (request.getKind().isCancellable()) {
            try {
                gateway.send(OutboundCommand.builder(request.getKind().getCancelCommand()).requestId(id).build());
            } catch (BrokerSessionException e) {
                log.warn("[{}] Request {} cancelled locally, upstream cancel not sent: {}",
                        sessionName, id, e.getMessage());
            }
        }
        log.debug("[{}] Cancelled request {} ({})", sessionName, id, request.getKind());
        return true;
    }

    public Optional<PendingRequest> lookup(int id) {
        return Optional.ofNullable(open.get(id));
    }

    /**
     * Note that an event was routed to an open request.
     *
     * @return the request, if open
     */
    public Optional<PendingRequest> route(int id) {
        PendingRequest request = open.get(id);
        if (request == null) {
            return Optional.empty();
        }
        request.recordEvent();
        return Optional.of(request);
    }

    /**
     * Wait for a request's result. On timeout the request is failed and late events
     * for it are dropped.
     *
     * @throws RequestTimeoutException if no result arrived in time
     * @throws BrokerSessionException  if the request failed
     * @throws CancellationException   if the request was cancelled
     */
    public Object await(PendingRequest request, Duration timeout) {
        try {
            return request.completion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            RequestTimeoutException timeoutError = new RequestTimeoutException(request.getId(), timeout,
                    "[" + sessionName + "] No response to " + request.getKind().getDisplayName()
                            + " request " + request.getId() + " within " + timeout.toMillis() + " ms");
            if (fail(request.getId(), timeoutError)) {
                throw timeoutError;
            }
            // lost the race against a completion arriving at the deadline
            return resultOf(request);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerSessionException("[" + sessionName + "] Interrupted while waiting for request "
                    + request.getId(), e);
        }
    }

    private static Object resultOf(PendingRequest request) {
        try {
            return request.completion().join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        }
    }

    /**
     * Fail every open request, e.g. on connection loss.
     *
     * @return the number of requests failed
     */
    public int failAll(RuntimeException error) {
        List<Integer> ids = new ArrayList<>(open.keySet());
        int count = 0;
        for (Integer id : ids) {
            if (fail(id, error)) {
                count++;
            }
        }
        if (count > 0) {
            log.warn("[{}] Failed {} open request(s): {}", sessionName, count, error.getMessage());
        }
        return count;
    }

    public int getOpenCount() {
        return open.size();
    }

    public List<PendingRequest> getOpenRequests() {
        return new ArrayList<>(open.values());
    }

    public long getOpenedCount() {
        return opened.get();
    }

    public long getCompletedCount() {
        return completed.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    public long getCancelledCount() {
        return cancelled.get();
    }

    public long getStaleTransitionCount() {
        return staleTransitions.get();
    }

    private boolean stale(int id, String action) {
        staleTransitions.incrementAndGet();
        log.warn("[{}] Ignoring {} for request {}: not open", sessionName, action, id);
        return false;
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new BrokerSessionException(cause.getMessage(), cause);
    }

    private void writeRow(PendingRequest request, String action, String note) {
        Contract contract = request.getContract();
        requestsTable.write(
                request.getId(),
                request.getKind().getDisplayName(),
                action,
                contract != null ? contract.getSymbol() : null,
                contract != null ? contract.getSecType() : null,
                contract != null ? contract.getExchange() : null,
                contract != null ? contract.getCurrency() : null,
                note);
    }

    private String toJson(Map<String, Object> values) {
        if (values.isEmpty()) {
            return null;
        }
        Map<String, String> strings = new LinkedHashMap<>();
        values.forEach((key, value) -> strings.put(key, String.valueOf(value)));
        try {
            return MAPPER.writeValueAsString(strings);
        } catch (JsonProcessingException e) {
            log.warn("[{}] Could not serialize request note {}: {}", sessionName, strings, e.getMessage());
            return strings.toString();
        }
    }
}
