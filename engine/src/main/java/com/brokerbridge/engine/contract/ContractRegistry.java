package com.brokerbridge.engine.contract;

import com.brokerbridge.engine.error.AmbiguousContractException;
import com.brokerbridge.engine.error.BrokerSessionException;
import com.brokerbridge.engine.error.ConnectionException;
import com.brokerbridge.engine.error.RequestTimeoutException;
import com.brokerbridge.engine.error.UnresolvedContractException;
import com.brokerbridge.engine.request.PendingRequest;
import com.brokerbridge.engine.request.RequestKind;
import com.brokerbridge.engine.request.RequestTracker;
import com.brokerbridge.engine.transport.CommandGateway;
import com.brokerbridge.engine.transport.CommandType;
import com.brokerbridge.engine.transport.OutboundCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Resolves contracts against the broker and caches the result for the session.
 *
 * <p>Entries are keyed by the {@link ContractKey} of the contract the caller asked for
 * and by the key of the resolved contract, so both descriptions hit the cache later.
 * Concurrent registrations of equivalent contracts share one in-flight resolution.
 * Failed resolutions are not cached.</p>
 *
 * <p>The receipt path feeds the registry through {@link #onContractDetails} and
 * {@link #onDetailsEnd}; callers block only in {@link #register}.</p>
 */
public class ContractRegistry {

    private static final Logger log = LoggerFactory.getLogger(ContractRegistry.class);

    private final String sessionName;
    private final RequestTracker tracker;
    private final CommandGateway gateway;
    private final Duration timeout;

    private final Map<ContractKey, RegisteredContract> byKey = new ConcurrentHashMap<>();
    private final Map<String, RegisteredContract> byIdentity = new ConcurrentHashMap<>();
    private final Map<ContractKey, CompletableFuture<RegisteredContract>> inFlight = new ConcurrentHashMap<>();
    private final Map<Integer, List<ContractDetails>> partialDetails = new ConcurrentHashMap<>();
    private final Set<Integer> requestedMarketRules = ConcurrentHashMap.newKeySet();
    private final AtomicLong nextInternalId = new AtomicLong(1);
    private final AtomicLong resolutions = new AtomicLong();

    public ContractRegistry(String sessionName, RequestTracker tracker, CommandGateway gateway, Duration timeout) {
        this.sessionName = sessionName;
        this.tracker = tracker;
        this.gateway = gateway;
        this.timeout = timeout;
    }

    /**
     * Resolve and cache a contract, blocking up to the contract timeout on a cache miss.
     *
     * @throws AmbiguousContractException  if the broker knows several matching instruments
     * @throws UnresolvedContractException if it knows none, reports an error, or does not answer in time
     * @throws ConnectionException         if the session is not connected
     */
    public RegisteredContract register(Contract contract) {
        ContractKey key = ContractKey.of(contract);
        RegisteredContract cached = byKey.get(key);
        if (cached != null) {
            return cached;
        }

        CompletableFuture<RegisteredContract> resolution = new CompletableFuture<>();
        CompletableFuture<RegisteredContract> shared = inFlight.putIfAbsent(key, resolution);
        PendingRequest request = null;
        if (shared == null) {
            shared = resolution;
            request = startResolution(contract, key, resolution, true);
        } else {
            log.debug("[{}] Joining in-flight resolution of {}", sessionName, contract);
        }

        try {
            return shared.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            RequestTimeoutException timeoutError = new RequestTimeoutException(
                    request != null ? request.getId() : -1, timeout,
                    "No contract details within " + timeout.toMillis() + " ms");
            if (request != null) {
                tracker.fail(request.getId(), timeoutError);
            }
            throw new UnresolvedContractException(contract, timeoutError.getMessage(), timeoutError);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BrokerSessionException) {
                throw (BrokerSessionException) cause;
            }
            throw new UnresolvedContractException(contract, String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UnresolvedContractException(contract, "interrupted", e);
        }
    }

    /**
     * Ask for details of a contract without waiting, e.g. for a contract seen in a
     * position or order report. Does nothing if it is cached or being resolved.
     */
    public void requestDetails(Contract contract) {
        ContractKey key = ContractKey.of(contract);
        if (byKey.containsKey(key)) {
            return;
        }
        CompletableFuture<RegisteredContract> resolution = new CompletableFuture<>();
        if (inFlight.putIfAbsent(key, resolution) != null) {
            return;
        }
        resolution.whenComplete((registered, error) -> {
            if (error != null) {
                log.debug("[{}] Background resolution of {} failed: {}", sessionName, contract, error.getMessage());
            }
        });
        startResolution(contract, key, resolution, false);
    }

    public Optional<RegisteredContract> lookup(Contract contract) {
        return Optional.ofNullable(byKey.get(ContractKey.of(contract)));
    }

    /**
     * Receipt path: one detail for a pending resolution.
     */
    public void onContractDetails(int requestId, ContractDetails details) {
        partialDetails.computeIfAbsent(requestId, id -> new CopyOnWriteArrayList<>()).add(details);
    }

    /**
     * Receipt path: all details for {@code requestId} were delivered.
     */
    public void onDetailsEnd(int requestId) {
        List<ContractDetails> details = partialDetails.remove(requestId);
        tracker.complete(requestId, details != null ? Collections.unmodifiableList(new ArrayList<>(details))
                : Collections.<ContractDetails>emptyList());
    }

    /**
     * Request each market rule of {@code details} not requested before in this session.
     */
    public void requestMarketRules(ContractDetails details) {
        for (Integer ruleId : details.marketRules()) {
            if (requestedMarketRules.add(ruleId)) {
                gateway.post(OutboundCommand.builder(CommandType.REQUEST_MARKET_RULE)
                        .param("marketRuleId", ruleId)
                        .build());
            }
        }
    }

    /**
     * @return the number of distinct registered contracts
     */
    public int size() {
        return byIdentity.size();
    }

    /**
     * @return the number of resolution round trips started
     */
    public long getResolutionCount() {
        return resolutions.get();
    }

    private PendingRequest startResolution(Contract contract, ContractKey key,
                                           CompletableFuture<RegisteredContract> resolution, boolean callerThread) {
        RegisteredContract cached = byKey.get(key);
        if (cached != null) {
            // registered between the cache check and claiming the in-flight slot
            inFlight.remove(key, resolution);
            resolution.complete(cached);
            return null;
        }

        PendingRequest request;
        try {
            request = tracker.open(RequestKind.CONTRACT_DETAILS, contract, Collections.emptyMap());
        } catch (RuntimeException e) {
            inFlight.remove(key, resolution);
            resolution.completeExceptionally(e);
            throw e;
        }
        resolutions.incrementAndGet();
        int requestId = request.getId();
        request.getCompletion().whenComplete((result, error) -> {
            partialDetails.remove(requestId);
            inFlight.remove(key, resolution);
            if (error != null) {
                resolution.completeExceptionally(resolutionFailure(contract, error));
                return;
            }
            try {
                @SuppressWarnings("unchecked")
                List<ContractDetails> details = (List<ContractDetails>) result;
                resolution.complete(accept(contract, key, details));
            } catch (BrokerSessionException e) {
                resolution.completeExceptionally(e);
            }
        });

        OutboundCommand command = OutboundCommand.builder(CommandType.REQUEST_CONTRACT_DETAILS)
                .requestId(requestId)
                .contract(contract)
                .build();
        try {
            if (callerThread) {
                gateway.send(command);
            } else {
                gateway.post(command);
            }
            log.debug("[{}] Resolving {} with request {}", sessionName, contract, requestId);
        } catch (BrokerSessionException e) {
            tracker.fail(requestId, e);
        }
        return request;
    }

    private RegisteredContract accept(Contract contract, ContractKey key, List<ContractDetails> details) {
        if (details.isEmpty()) {
            throw new UnresolvedContractException(contract, "no matching instrument");
        }
        if (details.size() > 1) {
            throw new AmbiguousContractException(contract, details);
        }
        ContractDetails resolved = details.get(0);
        RegisteredContract registered = byIdentity.computeIfAbsent(identityOf(resolved), identity -> {
            RegisteredContract created = new RegisteredContract(nextInternalId.getAndIncrement(), resolved);
            log.info("[{}] Registered {}", sessionName, created);
            return created;
        });
        byKey.putIfAbsent(key, registered);
        byKey.putIfAbsent(ContractKey.of(resolved.getContract()), registered);
        return byKey.get(key);
    }

    private static String identityOf(ContractDetails details) {
        Contract resolved = details.getContract();
        return resolved.getConId() > 0 ? "conId:" + resolved.getConId() : ContractKey.of(resolved).toString();
    }

    private static BrokerSessionException resolutionFailure(Contract contract, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof ConnectionException) {
            return (ConnectionException) cause;
        }
        if (cause instanceof CancellationException) {
            return new UnresolvedContractException(contract, "resolution request cancelled", cause);
        }
        return new UnresolvedContractException(contract, String.valueOf(cause.getMessage()), cause);
    }
}
