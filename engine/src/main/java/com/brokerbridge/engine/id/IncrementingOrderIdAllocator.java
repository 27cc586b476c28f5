package com.brokerbridge.engine.id;

import com.brokerbridge.engine.error.AllocationTimeoutException;
import com.brokerbridge.engine.error.BrokerSessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Takes the broker's first next-valid-id after connect as a seed and counts up locally.
 */
public class IncrementingOrderIdAllocator implements OrderIdAllocator {

    private static final Logger log = LoggerFactory.getLogger(IncrementingOrderIdAllocator.class);

    private final String sessionName;
    private final NextValidIdQueue queue;
    private final RequestIdSequence sequence;
    private final Duration seedTimeout;
    private final ReentrantLock lock = new ReentrantLock(true);

    private boolean seeded;

    public IncrementingOrderIdAllocator(String sessionName, NextValidIdQueue queue, RequestIdSequence sequence,
                                        Duration seedTimeout) {
        this.sessionName = sessionName;
        this.queue = queue;
        this.sequence = sequence;
        this.seedTimeout = seedTimeout;
    }

    @Override
    public int nextId() {
        lock.lock();
        try {
            if (!seeded) {
                int seed = awaitSeed();
                seeded = true;
                int id = sequence.reserveAtLeast(seed);
                log.info("[{}] Order ids start at {} (broker seed {})", sessionName, id, seed);
                return id;
            }
            return sequence.reserveAtLeast(sequence.last() + 1);
        } finally {
            lock.unlock();
        }
    }

    private int awaitSeed() {
        try {
            return queue.seed().get(seedTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.error("[{}] No order id seed from broker within {} ms", sessionName, seedTimeout.toMillis());
            throw new AllocationTimeoutException(1, seedTimeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BrokerSessionException) {
                throw (BrokerSessionException) cause;
            }
            throw new BrokerSessionException("[" + sessionName + "] Order id seed failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerSessionException("[" + sessionName + "] Interrupted while waiting for order id seed", e);
        }
    }

    /**
     * Forget the seed so the next allocation waits for a fresh one, e.g. after reconnect.
     */
    public void reset() {
        lock.lock();
        try {
            seeded = false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public OrderIdStrategy getStrategy() {
        return OrderIdStrategy.INCREMENT;
    }
}
