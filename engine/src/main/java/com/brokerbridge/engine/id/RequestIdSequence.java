package com.brokerbridge.engine.id;

/**
 * Strictly increasing id sequence shared by the requests and orders of one session.
 *
 * <p>Order ids handed out by the broker are passed through {@link #reserveAtLeast} so a
 * broker value that lags behind ids already used locally can never produce a duplicate.</p>
 */
public class RequestIdSequence {

    private int last;

    public RequestIdSequence() {
        this(0);
    }

    public RequestIdSequence(int last) {
        this.last = last;
    }

    /**
     * @return the next id for a request
     */
    public synchronized int next() {
        return ++last;
    }

    /**
     * Reserve {@code max(candidate, last + 1)}.
     */
    public synchronized int reserveAtLeast(int candidate) {
        last = Math.max(candidate, last + 1);
        return last;
    }

    public synchronized int last() {
        return last;
    }
}
