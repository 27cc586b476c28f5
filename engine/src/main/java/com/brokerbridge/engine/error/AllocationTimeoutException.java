package com.brokerbridge.engine.error;

import java.time.Duration;

/**
 * The upstream did not supply an order id within the allocation budget.
 */
public class AllocationTimeoutException extends RequestTimeoutException {

    private final int attempts;

    public AllocationTimeoutException(int attempts, Duration perAttemptTimeout) {
        super(-1, perAttemptTimeout, "No order id received from upstream after " + attempts
                + " attempt(s) of " + perAttemptTimeout.toMillis() + "ms");
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
