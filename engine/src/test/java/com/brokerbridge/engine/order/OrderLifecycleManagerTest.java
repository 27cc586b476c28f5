package com.brokerbridge.engine.order;

import com.brokerbridge.config.ClockProvider;
import com.brokerbridge.config.testing.ControllableClock;
import com.brokerbridge.engine.contract.Contract;
import com.brokerbridge.engine.support.ScriptedTransport;
import com.brokerbridge.engine.table.SessionTables;
import com.brokerbridge.engine.transport.CommandGateway;
import com.brokerbridge.engine.transport.CommandType;
import com.brokerbridge.tables.InMemoryTableSink;
import com.brokerbridge.tables.TableRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrderLifecycleManagerTest {

    private static final Contract AAPL = Contract.stock("AAPL", "USD").toBuilder().conId(265598).build();

    private ScriptedTransport transport;
    private InMemoryTableSink sink;
    private OrderLifecycleManager orders;
    private final List<String> transitions = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        transport = new ScriptedTransport();
        transport.connect("localhost", 7497, 0, event -> { });
        sink = new InMemoryTableSink();
        ClockProvider clock = ClockProvider.of(ControllableClock.createUtc(Instant.parse("2024-03-04T14:30:00Z")));
        orders = new OrderLifecycleManager("test", new SessionTables(sink, clock),
                new CommandGateway("test", transport, clock, 0), clock);
        orders.addListener((order, previous, current) ->
                transitions.add(order.getOrderId() + ":" + previous + "->" + current));
    }

    private TrackedOrder placed(int orderId, double quantity) {
        TrackedOrder order = orders.create(orderId, AAPL, OrderSpec.limit(OrderAction.BUY, quantity, 190).build());
        orders.markSubmitted(orderId);
        return order;
    }

    @Test
    void fullLifecycleToFilled() {
        TrackedOrder order = placed(10, 100);

        orders.onOrderStatus(10, "Submitted", 0, 100, 0, 9001);
        orders.onOrderStatus(10, "Submitted", 40, 60, 189.9, 9001);
        orders.onOrderStatus(10, "Filled", 100, 0, 189.95, 9001);

        assertEquals(OrderState.FILLED, order.getState());
        assertEquals(100, order.getFilled());
        assertEquals(0, order.getRemaining());
        assertEquals(9001, order.getPermId());
        assertEquals(List.of("10:CREATED->SUBMITTED", "10:SUBMITTED->ACKNOWLEDGED",
                "10:ACKNOWLEDGED->PARTIALLY_FILLED", "10:PARTIALLY_FILLED->FILLED"), transitions);

        List<TableRow> rows = sink.rows(SessionTables.ORDERS);
        assertEquals(5, rows.size());
        TableRow last = rows.get(rows.size() - 1);
        assertEquals("FILLED", last.getString("State"));
        assertEquals("PARTIALLY_FILLED", last.getString("PreviousState"));
        assertEquals(265598L, last.getLong("ContractId"));
    }

    @Test
    void duplicateOrderIdIsRejected() {
        placed(10, 100);

        assertThrows(IllegalStateException.class,
                () -> orders.create(10, AAPL, OrderSpec.market(OrderAction.SELL, 1).build()));
    }

    @Test
    void orderIsNotKeptWhenItsRowCannotBeWritten() {
        ClockProvider clock = ClockProvider.of(ControllableClock.createUtc(Instant.parse("2024-03-04T14:30:00Z")));
        OrderLifecycleManager broken = new OrderLifecycleManager("test", new SessionTables((table, row) -> {
            throw new IllegalStateException("sink closed");
        }, clock), new CommandGateway("test", transport, clock, 0), clock);

        assertThrows(IllegalStateException.class,
                () -> broken.create(12, AAPL, OrderSpec.market(OrderAction.BUY, 1).build()));

        assertFalse(broken.isKnown(12));
        assertTrue(broken.getOrders().isEmpty());
        assertTrue(broken.cancelAll().isEmpty());
    }

    @Test
    void eventForUnknownOrderTracksAnExternalOrder() {
        TrackedOrder external = orders.onOpenOrder(77, AAPL, 5555, "Submitted");

        assertTrue(external.isExternal());
        assertEquals(OrderState.ACKNOWLEDGED, external.getState());
        assertEquals(AAPL, external.getContract());
        assertEquals(1, orders.getExternalOrderCount());
        assertTrue(orders.isKnown(77));
    }

    @Test
    void eventsOutOfOrderNeverMoveBackwards() {
        TrackedOrder order = placed(11, 100);
        orders.onOrderStatus(11, "Submitted", 50, 50, 190, 0);

        orders.onOrderStatus(11, "PreSubmitted", 0, 100, 0, 0);

        assertEquals(OrderState.PARTIALLY_FILLED, order.getState());
        assertEquals(1, orders.getRefusedTransitionCount());
    }

    @Test
    void repeatedTerminalEventIsCountedAndIgnored() {
        TrackedOrder order = placed(12, 10);
        orders.onOrderStatus(12, "Filled", 10, 0, 190, 0);
        int rowsAfterFill = sink.size(SessionTables.ORDERS);

        orders.onOrderStatus(12, "Filled", 10, 0, 190, 0);
        orders.onOrderStatus(12, "Cancelled", 10, 0, 190, 0);

        assertEquals(OrderState.FILLED, order.getState());
        assertEquals(2, order.getDuplicateTerminalEvents());
        assertEquals(2, orders.getDuplicateTerminalEventCount());
        assertEquals(rowsAfterFill, sink.size(SessionTables.ORDERS));
    }

    @Test
    void lateNonTerminalEventAfterTerminalIsRefused() {
        TrackedOrder order = placed(13, 10);
        orders.onCancelConfirmed(13);

        orders.onOrderStatus(13, "Submitted", 0, 10, 0, 0);

        assertEquals(OrderState.CANCELLED, order.getState());
        assertEquals(0, order.getDuplicateTerminalEvents());
        assertEquals(1, orders.getRefusedTransitionCount());
    }

    @Test
    void executionsAccumulateAndAreAppliedOnce() {
        TrackedOrder order = placed(14, 100);

        orders.onExecution(14, AAPL, "0001.01", 30, 190);
        orders.onExecution(14, AAPL, "0001.01", 30, 190);
        assertEquals(OrderState.PARTIALLY_FILLED, order.getState());
        assertEquals(70, order.getRemaining());

        orders.onExecution(14, AAPL, "0001.02", 100, 190.1);
        assertEquals(OrderState.FILLED, order.getState());
        assertEquals(190.1, order.getAvgFillPrice());
    }

    @Test
    void rejectionKeepsTheBrokerReason() {
        TrackedOrder order = placed(15, 10);

        assertTrue(orders.onRejected(15, 201, "Order rejected - reason: insufficient margin"));

        assertEquals(OrderState.REJECTED, order.getState());
        assertEquals(201, order.getRejectCode());
        assertEquals("Order rejected - reason: insufficient margin", order.getRejectReason());
        assertFalse(orders.onRejected(999, 201, "unknown"));
    }

    @Test
    void cancelAllReportsEachOrderSeparately() {
        placed(20, 10);
        placed(21, 10);
        orders.onOrderStatus(21, "Filled", 10, 0, 190, 0);

        List<CancelOutcome> outcomes = orders.cancelAll();

        assertEquals(2, outcomes.size());
        assertEquals(CancelOutcome.Status.REQUESTED, outcomes.get(0).status());
        assertEquals(20, outcomes.get(0).orderId());
        assertEquals(CancelOutcome.Status.ALREADY_TERMINAL, outcomes.get(1).status());
        assertEquals(OrderState.FILLED, outcomes.get(1).state());
        assertEquals(1, transport.commands(CommandType.CANCEL_ORDER).size());
        assertEquals(20, transport.lastCommand(CommandType.CANCEL_ORDER).getRequestId());
    }

    @Test
    void cancelFailsWhenTheConnectionIsGone() {
        placed(30, 10);
        transport.disconnect();

        CancelOutcome outcome = orders.cancel(30);

        assertEquals(CancelOutcome.Status.FAILED, outcome.status());
        assertEquals(OrderState.SUBMITTED, outcome.state());
    }

    @Test
    void cancelOfUnknownOrderFails() {
        assertEquals(CancelOutcome.Status.FAILED, orders.cancel(404).status());
    }

    @Test
    void listenerFailureDoesNotStopTransitions() {
        orders.addListener((order, previous, current) -> {
            throw new IllegalStateException("listener bug");
        });

        TrackedOrder order = placed(40, 10);
        orders.onOrderStatus(40, "Cancelled", 0, 10, 0, 0);

        assertEquals(OrderState.CANCELLED, order.getState());
        assertEquals(0, orders.getLiveOrderCount());
    }
}
