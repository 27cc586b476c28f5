package com.brokerbridge.engine.order;

import com.brokerbridge.engine.contract.Contract;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An order known to the session, placed here or discovered from broker reports.
 *
 * <p>State is readable from any thread; updates go through the
 * {@link OrderLifecycleManager}, one at a time per order.</p>
 */
public class TrackedOrder {

    private final int orderId;
    private final boolean external;
    private final Instant createdAt;
    private final AtomicReference<OrderState> state = new AtomicReference<>(OrderState.CREATED);
    private final AtomicInteger duplicateTerminalEvents = new AtomicInteger();
    private final Set<String> execIds = ConcurrentHashMap.newKeySet();

    private volatile Contract contract;
    private volatile OrderSpec spec;
    private volatile double filled;
    private volatile double remaining;
    private volatile double avgFillPrice;
    private volatile long permId;
    private volatile String lastStatus;
    private volatile String rejectReason;
    private volatile int rejectCode;
    private volatile Instant updatedAt;

    TrackedOrder(int orderId, Contract contract, OrderSpec spec, boolean external, Instant createdAt) {
        this.orderId = orderId;
        this.contract = contract;
        this.spec = spec;
        this.external = external;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.remaining = spec != null ? spec.getQuantity() : 0;
    }

    public int getOrderId() {
        return orderId;
    }

    /**
     * @return the contract, or null for an external order seen only through status events
     */
    public Contract getContract() {
        return contract;
    }

    /**
     * @return the submitted parameters, or null for an external order
     */
    public OrderSpec getSpec() {
        return spec;
    }

    public OrderState getState() {
        return state.get();
    }

    public boolean isTerminal() {
        return state.get().isTerminal();
    }

    /**
     * @return true if the order was not placed by this session
     */
    public boolean isExternal() {
        return external;
    }

    public double getFilled() {
        return filled;
    }

    public double getRemaining() {
        return remaining;
    }

    public double getAvgFillPrice() {
        return avgFillPrice;
    }

    public long getPermId() {
        return permId;
    }

    /**
     * @return the last status string reported by the broker
     */
    public String getLastStatus() {
        return lastStatus;
    }

    public String getRejectReason() {
        return rejectReason;
    }

    /**
     * @return the broker error code that rejected the order, 0 if none
     */
    public int getRejectCode() {
        return rejectCode;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * @return how many terminal events arrived after the order was already terminal
     */
    public int getDuplicateTerminalEvents() {
        return duplicateTerminalEvents.get();
    }

    boolean transition(OrderState from, OrderState to) {
        return state.compareAndSet(from, to);
    }

    int recordDuplicateTerminal() {
        return duplicateTerminalEvents.incrementAndGet();
    }

    /**
     * @return false if the execution was seen before
     */
    boolean recordExecution(String execId) {
        return execIds.add(execId);
    }

    void describe(Contract contract, OrderSpec spec) {
        if (contract != null && this.contract == null) {
            this.contract = contract;
        }
        if (spec != null && this.spec == null) {
            this.spec = spec;
        }
    }

    void updateFills(double filled, double remaining, double avgFillPrice) {
        this.filled = filled;
        this.remaining = remaining;
        this.avgFillPrice = avgFillPrice;
    }

    void setPermId(long permId) {
        if (permId != 0) {
            this.permId = permId;
        }
    }

    void setLastStatus(String lastStatus) {
        this.lastStatus = lastStatus;
    }

    void setRejectReason(String rejectReason) {
        this.rejectReason = rejectReason;
    }

    void setRejectCode(int rejectCode) {
        this.rejectCode = rejectCode;
    }

    void touch(Instant when) {
        this.updatedAt = when;
    }

    @Override
    public String toString() {
        return String.format("TrackedOrder[id=%d, %s, state=%s, filled=%s, remaining=%s%s]",
                orderId, contract != null ? contract.getSymbol() : "?", state.get(), filled, remaining,
                external ? ", external" : "");
    }
}
