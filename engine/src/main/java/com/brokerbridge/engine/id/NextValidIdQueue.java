package com.brokerbridge.engine.id;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;

/**
 * Hands next-valid-id values from the receipt path to allocating callers, first come
 * first served.
 *
 * <p>The first value received after a {@link #reset} also completes the {@link #seed()}
 * future. A value arriving while nobody waits is dropped.</p>
 */
public class NextValidIdQueue {

    private static final Logger log = LoggerFactory.getLogger(NextValidIdQueue.class);

    private final String sessionName;
    private final Deque<CompletableFuture<Integer>> waiters = new ArrayDeque<>();
    private CompletableFuture<Integer> seed = new CompletableFuture<>();

    public NextValidIdQueue(String sessionName) {
        this.sessionName = sessionName;
    }

    /**
     * Register interest in the next value. Must be called before the request for it is sent.
     */
    public synchronized CompletableFuture<Integer> await() {
        CompletableFuture<Integer> waiter = new CompletableFuture<>();
        waiters.addLast(waiter);
        return waiter;
    }

    /**
     * Give up on a value, e.g. after a timeout.
     */
    public synchronized void abandon(CompletableFuture<Integer> waiter) {
        waiters.remove(waiter);
    }

    /**
     * Called from the receipt path with each next-valid-id value.
     */
    public void onNextValidId(int orderId) {
        CompletableFuture<Integer> waiter;
        CompletableFuture<Integer> seedToComplete = null;
        synchronized (this) {
            if (!seed.isDone()) {
                seedToComplete = seed;
            }
            waiter = waiters.pollFirst();
        }
        if (seedToComplete != null) {
            seedToComplete.complete(orderId);
            log.debug("[{}] Order id seed {}", sessionName, orderId);
        }
        if (waiter != null) {
            waiter.complete(orderId);
        } else if (seedToComplete == null) {
            log.debug("[{}] Dropping next valid id {}: nobody is waiting", sessionName, orderId);
        }
    }

    /**
     * Completed by the first value received since the last reset.
     */
    public synchronized CompletableFuture<Integer> seed() {
        return seed;
    }

    public synchronized int waiting() {
        return waiters.size();
    }

    /**
     * Forget the seed and fail every waiter, e.g. on disconnect.
     */
    public void reset(RuntimeException cause) {
        Deque<CompletableFuture<Integer>> pending;
        CompletableFuture<Integer> oldSeed;
        synchronized (this) {
            pending = new ArrayDeque<>(waiters);
            waiters.clear();
            oldSeed = seed;
            seed = new CompletableFuture<>();
        }
        oldSeed.completeExceptionally(cause);
        pending.forEach(waiter -> waiter.completeExceptionally(cause));
    }
}
