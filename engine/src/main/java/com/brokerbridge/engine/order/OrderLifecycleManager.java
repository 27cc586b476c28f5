package com.brokerbridge.engine.order;

import com.brokerbridge.config.ClockProvider;
import com.brokerbridge.engine.contract.Contract;
import com.brokerbridge.engine.error.BrokerSessionException;
import com.brokerbridge.engine.table.SessionTables;
import com.brokerbridge.engine.transport.CommandGateway;
import com.brokerbridge.engine.transport.CommandType;
import com.brokerbridge.engine.transport.OutboundCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives the state machine of every order the session knows about.
 *
 * <p>Transitions come only from broker events matched on order id. An event for an
 * unknown order id first creates an external order in CREATED. Transitions out of a
 * terminal state are refused; a terminal event repeated on a terminal order is
 * counted on the order and otherwise ignored. Each applied transition writes one
 * row to the normalized {@code orders} table.</p>
 */
public class OrderLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(OrderLifecycleManager.class);

    private final String sessionName;
    private final SessionTables tables;
    private final CommandGateway gateway;
    private final ClockProvider clock;

    private final Map<Integer, TrackedOrder> orders = new ConcurrentHashMap<>();
    private final List<OrderStateListener> listeners = new CopyOnWriteArrayList<>();

    private final AtomicLong transitions = new AtomicLong();
    private final AtomicLong refusedTransitions = new AtomicLong();
    private final AtomicLong duplicateTerminalEvents = new AtomicLong();
    private final AtomicLong externalOrders = new AtomicLong();

    public OrderLifecycleManager(String sessionName, SessionTables tables, CommandGateway gateway,
                                 ClockProvider clock) {
        this.sessionName = sessionName;
        this.tables = tables;
        this.gateway = gateway;
        this.clock = clock;
    }

    public void addListener(OrderStateListener listener) {
        listeners.add(listener);
    }

    public void removeListener(OrderStateListener listener) {
        listeners.remove(listener);
    }

    /**
     * Track an order about to be placed by this session.
     *
     * @throws IllegalStateException if the order id is already known
     */
    public TrackedOrder create(int orderId, Contract contract, OrderSpec spec) {
        TrackedOrder order = new TrackedOrder(orderId, contract, spec, false, clock.instant());
        if (orders.putIfAbsent(orderId, order) != null) {
            throw new IllegalStateException("[" + sessionName + "] Order id " + orderId + " is already in use");
        }
        try {
            writeOrderRow(order, null);
        } catch (RuntimeException e) {
            orders.remove(orderId, order);
            throw e;
        }
        log.debug("[{}] Created order {}", sessionName, order);
        return order;
    }

    /**
     * The place command for {@code orderId} went out.
     */
    public void markSubmitted(int orderId) {
        TrackedOrder order = orders.get(orderId);
        if (order != null) {
            apply(order, OrderState.SUBMITTED);
        }
    }

    /**
     * The place command for {@code orderId} could not be sent.
     */
    public void markRejected(int orderId, String reason) {
        TrackedOrder order = orders.get(orderId);
        if (order != null) {
            order.setRejectReason(reason);
            apply(order, OrderState.REJECTED);
        }
    }

    public Optional<TrackedOrder> get(int orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    public boolean isKnown(int orderId) {
        return orders.containsKey(orderId);
    }

    /**
     * All known orders, by order id.
     */
    public List<TrackedOrder> getOrders() {
        List<TrackedOrder> all = new ArrayList<>(orders.values());
        all.sort(Comparator.comparingInt(TrackedOrder::getOrderId));
        return all;
    }

    public int getLiveOrderCount() {
        return (int) orders.values().stream().filter(order -> !order.isTerminal()).count();
    }

    /**
     * An open-order report: the broker's view of the order's parameters and status.
     */
    public TrackedOrder onOpenOrder(int orderId, Contract contract, long permId, String status) {
        TrackedOrder order = resolve(orderId, contract);
        order.setPermId(permId);
        onStatus(order, status, order.getFilled(), order.getRemaining(), order.getAvgFillPrice());
        return order;
    }

    /**
     * An order status report.
     */
    public TrackedOrder onOrderStatus(int orderId, String status, double filled, double remaining,
                                      double avgFillPrice, long permId) {
        TrackedOrder order = resolve(orderId, null);
        order.setPermId(permId);
        onStatus(order, status, filled, remaining, avgFillPrice);
        return order;
    }

    /**
     * A fill. Repeated executions (same exec id) are ignored.
     */
    public TrackedOrder onExecution(int orderId, Contract contract, String execId, double cumQty, double avgPrice) {
        TrackedOrder order = resolve(orderId, contract);
        synchronized (order) {
            if (!order.recordExecution(execId)) {
                log.debug("[{}] Execution {} for order {} already applied", sessionName, execId, orderId);
                return order;
            }
            if (order.isTerminal()) {
                log.debug("[{}] Execution {} for terminal order {}", sessionName, execId, orderId);
                return order;
            }
            double filled = Math.max(order.getFilled(), cumQty);
            OrderSpec spec = order.getSpec();
            double remaining = spec != null ? Math.max(spec.getQuantity() - filled, 0) : order.getRemaining();
            order.updateFills(filled, remaining, avgPrice);
            OrderState target = spec != null && remaining == 0 ? OrderState.FILLED : OrderState.PARTIALLY_FILLED;
            apply(order, target);
        }
        return order;
    }

    /**
     * The broker rejected an order through an error callback.
     *
     * @return false if no order with this id is known
     */
    public boolean onRejected(int orderId, int errorCode, String message) {
        TrackedOrder order = orders.get(orderId);
        if (order == null) {
            return false;
        }
        order.setRejectCode(errorCode);
        order.setRejectReason(message);
        apply(order, OrderState.REJECTED);
        return true;
    }

    /**
     * The broker confirmed a cancel through an error callback.
     *
     * @return false if no order with this id is known
     */
    public boolean onCancelConfirmed(int orderId) {
        TrackedOrder order = orders.get(orderId);
        if (order == null) {
            return false;
        }
        apply(order, OrderState.CANCELLED);
        return true;
    }

    /**
     * Send a cancel for one order.
     */
    public CancelOutcome cancel(int orderId) {
        TrackedOrder order = orders.get(orderId);
        if (order == null) {
            return CancelOutcome.failed(orderId, null, "unknown order");
        }
        OrderState state = order.getState();
        if (state.isTerminal()) {
            return CancelOutcome.alreadyTerminal(orderId, state);
        }
        try {
            gateway.send(OutboundCommand.builder(CommandType.CANCEL_ORDER).requestId(orderId).build());
            log.info("[{}] Cancel requested for order {} in state {}", sessionName, orderId, state);
            return CancelOutcome.requested(orderId, state);
        } catch (BrokerSessionException e) {
            log.warn("[{}] Could not cancel order {}: {}", sessionName, orderId, e.getMessage());
            return CancelOutcome.failed(orderId, state, e.getMessage());
        }
    }

    /**
     * Cancel every live order. Terminal orders are reported, not touched.
     *
     * @return one outcome per known order, by order id
     */
    public List<CancelOutcome> cancelAll() {
        List<CancelOutcome> outcomes = new ArrayList<>();
        for (TrackedOrder order : getOrders()) {
            outcomes.add(cancel(order.getOrderId()));
        }
        log.info("[{}] Cancel all: {} order(s)", sessionName, outcomes.size());
        return outcomes;
    }

    public long getTransitionCount() {
        return transitions.get();
    }

    public long getRefusedTransitionCount() {
        return refusedTransitions.get();
    }

    public long getDuplicateTerminalEventCount() {
        return duplicateTerminalEvents.get();
    }

    public long getExternalOrderCount() {
        return externalOrders.get();
    }

    private TrackedOrder resolve(int orderId, Contract contract) {
        TrackedOrder order = orders.computeIfAbsent(orderId, id -> {
            externalOrders.incrementAndGet();
            TrackedOrder external = new TrackedOrder(id, contract, null, true, clock.instant());
            log.info("[{}] Tracking external order {}", sessionName, id);
            return external;
        });
        order.describe(contract, null);
        return order;
    }

    private void onStatus(TrackedOrder order, String status, double filled, double remaining,
                          double avgFillPrice) {
        synchronized (order) {
            order.setLastStatus(status);
            OrderState target = OrderState.fromUpstreamStatus(status, filled, remaining);
            if (target == null) {
                log.debug("[{}] Order {} status {}: no transition", sessionName, order.getOrderId(), status);
                return;
            }
            if (!order.isTerminal() && (order.getState() == target || order.getState().canTransitionTo(target))) {
                order.updateFills(Math.max(order.getFilled(), filled), remaining, avgFillPrice);
            }
            apply(order, target);
        }
    }

    private void apply(TrackedOrder order, OrderState target) {
        OrderState previous;
        synchronized (order) {
            previous = order.getState();
            if (previous == target && !target.isTerminal() && target != OrderState.PARTIALLY_FILLED) {
                return;
            }
            if (previous.isTerminal()) {
                if (target.isTerminal()) {
                    int count = order.recordDuplicateTerminal();
                    duplicateTerminalEvents.incrementAndGet();
                    log.warn("[{}] Duplicate terminal event {} for order {} already {} (#{})",
                            sessionName, target, order.getOrderId(), previous, count);
                } else {
                    refusedTransitions.incrementAndGet();
                    log.warn("[{}] Late event {} for order {} already {}: ignored",
                            sessionName, target, order.getOrderId(), previous);
                }
                return;
            }
            if (!previous.canTransitionTo(target)) {
                refusedTransitions.incrementAndGet();
                log.debug("[{}] Order {} stays {}, not moving back to {}",
                        sessionName, order.getOrderId(), previous, target);
                return;
            }
            if (!order.transition(previous, target)) {
                refusedTransitions.incrementAndGet();
                return;
            }
            order.touch(clock.instant());
            transitions.incrementAndGet();
            writeOrderRow(order, previous);
        }
        log.info("[{}] Order {} {} -> {}", sessionName, order.getOrderId(), previous, target);
        notifyListeners(order, previous, target);
    }

    private void notifyListeners(TrackedOrder order, OrderState previous, OrderState current) {
        for (OrderStateListener listener : listeners) {
            try {
                listener.onOrderStateChanged(order, previous, current);
            } catch (Exception e) {
                log.error("[{}] Error notifying order listener of order {}", sessionName, order.getOrderId(), e);
            }
        }
    }

    private void writeOrderRow(TrackedOrder order, OrderState previous) {
        Contract contract = order.getContract();
        OrderSpec spec = order.getSpec();
        tables.row(SessionTables.ORDERS)
                .add((long) order.getOrderId())
                .add(contract != null && contract.getConId() > 0 ? (long) contract.getConId() : null)
                .add(contract != null ? contract.getSymbol() : null)
                .add(spec != null ? spec.getAction().name() : null)
                .add(spec != null ? spec.getOrderType().getCode() : null)
                .add(spec != null ? spec.getQuantity() : null)
                .add(spec != null && spec.getOrderType().needsLimitPrice() ? spec.getLimitPrice() : null)
                .add(order.getState().name())
                .add(previous != null ? previous.name() : null)
                .add(order.getFilled())
                .add(order.getRemaining())
                .add(order.getAvgFillPrice())
                .add(order.isExternal())
                .add(order.getLastStatus())
                .write();
    }
}
