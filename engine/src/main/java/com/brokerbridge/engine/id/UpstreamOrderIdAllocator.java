package com.brokerbridge.engine.id;

import com.brokerbridge.engine.error.AllocationTimeoutException;
import com.brokerbridge.engine.error.BrokerSessionException;
import com.brokerbridge.engine.transport.CommandGateway;
import com.brokerbridge.engine.transport.CommandType;
import com.brokerbridge.engine.transport.OutboundCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Asks the broker for each order id, re-asking up to {@code maxAttempts} times when
 * no answer arrives within {@code attemptTimeout}. With one attempt this is the BASIC
 * strategy.
 */
public class UpstreamOrderIdAllocator implements OrderIdAllocator {

    private static final Logger log = LoggerFactory.getLogger(UpstreamOrderIdAllocator.class);

    private final String sessionName;
    private final OrderIdStrategy strategy;
    private final NextValidIdQueue queue;
    private final RequestIdSequence sequence;
    private final CommandGateway gateway;
    private final int maxAttempts;
    private final Duration attemptTimeout;
    private final ReentrantLock lock = new ReentrantLock(true);

    public UpstreamOrderIdAllocator(String sessionName, OrderIdStrategy strategy, NextValidIdQueue queue,
                                    RequestIdSequence sequence, CommandGateway gateway,
                                    int maxAttempts, Duration attemptTimeout) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.sessionName = sessionName;
        this.strategy = strategy;
        this.queue = queue;
        this.sequence = sequence;
        this.gateway = gateway;
        this.maxAttempts = maxAttempts;
        this.attemptTimeout = attemptTimeout;
    }

    @Override
    public int nextId() {
        lock.lock();
        try {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                CompletableFuture<Integer> answer = queue.await();
                gateway.send(OutboundCommand.builder(CommandType.REQUEST_IDS).build());
                try {
                    int upstreamId = answer.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
                    int id = sequence.reserveAtLeast(upstreamId);
                    log.debug("[{}] Allocated order id {} (broker offered {}, attempt {})",
                            sessionName, id, upstreamId, attempt);
                    return id;
                } catch (TimeoutException e) {
                    queue.abandon(answer);
                    if (attempt < maxAttempts) {
                        log.warn("[{}] No order id from broker within {} ms, retrying ({}/{})",
                                sessionName, attemptTimeout.toMillis(), attempt, maxAttempts);
                    }
                } catch (ExecutionException e) {
                    queue.abandon(answer);
                    Throwable cause = e.getCause();
                    if (cause instanceof BrokerSessionException) {
                        throw (BrokerSessionException) cause;
                    }
                    throw new BrokerSessionException("[" + sessionName + "] Order id allocation failed", cause);
                } catch (InterruptedException e) {
                    queue.abandon(answer);
                    Thread.currentThread().interrupt();
                    throw new BrokerSessionException("[" + sessionName + "] Interrupted while allocating order id", e);
                }
            }
            log.error("[{}] Broker did not supply an order id after {} attempts", sessionName, maxAttempts);
            throw new AllocationTimeoutException(maxAttempts, attemptTimeout);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public OrderIdStrategy getStrategy() {
        return strategy;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
