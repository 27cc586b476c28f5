package com.brokerbridge.engine.request;

import com.brokerbridge.config.ClockProvider;
import com.brokerbridge.config.testing.ControllableClock;
import com.brokerbridge.engine.contract.Contract;
import com.brokerbridge.engine.error.ConnectionException;
import com.brokerbridge.engine.error.RequestTimeoutException;
import com.brokerbridge.engine.error.UpstreamProtocolException;
import com.brokerbridge.engine.id.RequestIdSequence;
import com.brokerbridge.engine.support.ScriptedTransport;
import com.brokerbridge.engine.table.SessionTables;
import com.brokerbridge.engine.transport.CommandGateway;
import com.brokerbridge.engine.transport.CommandType;
import com.brokerbridge.tables.InMemoryTableSink;
import com.brokerbridge.tables.TableRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class RequestTrackerTest {

    private static final Contract AAPL = Contract.stock("AAPL", "USD");

    private ScriptedTransport transport;
    private InMemoryTableSink sink;
    private RequestTracker tracker;

    @BeforeEach
    void setUp() throws Exception {
        transport = new ScriptedTransport();
        transport.connect("localhost", 7497, 0, event -> { });
        sink = new InMemoryTableSink();
        ClockProvider clock = ClockProvider.of(ControllableClock.createUtc(Instant.parse("2024-03-04T14:30:00Z")));
        SessionTables tables = new SessionTables(sink, clock);
        CommandGateway gateway = new CommandGateway("test", transport, clock, 0);
        tracker = new RequestTracker("test", new RequestIdSequence(), gateway,
                tables.writer(SessionTables.REQUESTS), clock);
    }

    @Test
    void openAssignsIncreasingIdsAndLogsTheRequest() {
        PendingRequest first = tracker.open(RequestKind.MARKET_DATA, AAPL, Map.of("snapshot", false));
        PendingRequest second = tracker.open(RequestKind.HISTORICAL_BARS, AAPL, Map.of());

        assertTrue(second.getId() > first.getId());
        assertEquals(2, tracker.getOpenCount());

        TableRow row = sink.rows(SessionTables.REQUESTS).get(0);
        assertEquals((long) first.getId(), row.getLong("RequestId"));
        assertEquals("MarketData", row.getString("RequestType"));
        assertEquals("OPEN", row.getString("Action"));
        assertEquals("AAPL", row.getString("Symbol"));
        assertEquals("{\"snapshot\":\"false\"}", row.getString("Note"));
    }

    @Test
    void completionResolvesTheWaitAndClosesTheRequest() {
        PendingRequest request = tracker.open(RequestKind.HISTORICAL_BARS, AAPL, Map.of());

        assertTrue(tracker.complete(request.getId(), 12));

        assertEquals(12, tracker.await(request, Duration.ofMillis(100)));
        assertEquals(RequestStatus.COMPLETED, request.getStatus());
        assertFalse(tracker.lookup(request.getId()).isPresent());
        assertEquals("COMPLETE", sink.lastRow(SessionTables.REQUESTS).orElseThrow().getString("Action"));
    }

    @Test
    void secondTerminalTransitionIsIgnored() {
        PendingRequest request = tracker.open(RequestKind.NEWS_ARTICLE, null, Map.of());
        tracker.complete(request.getId(), "text");

        assertFalse(tracker.complete(request.getId(), "again"));
        assertFalse(tracker.fail(request.getId(), new IllegalStateException("late")));
        assertFalse(tracker.cancel(request.getId()));

        assertEquals(RequestStatus.COMPLETED, request.getStatus());
        assertEquals(3, tracker.getStaleTransitionCount());
        assertEquals(2, sink.size(SessionTables.REQUESTS));
    }

    @Test
    void failureSurfacesToTheWaiter() {
        PendingRequest request = tracker.open(RequestKind.HISTORICAL_NEWS, AAPL, Map.of());
        tracker.fail(request.getId(), new UpstreamProtocolException(request.getId(), 430, "No news"));

        UpstreamProtocolException error = assertThrows(UpstreamProtocolException.class,
                () -> tracker.await(request, Duration.ofMillis(100)));

        assertEquals(430, error.getErrorCode());
        assertEquals(RequestStatus.ERRORED, request.getStatus());
        assertEquals("{\"error\":\"No news\"}", sink.lastRow(SessionTables.REQUESTS).orElseThrow().getString("Note"));
    }

    @Test
    void awaitTimeoutFailsTheRequestAndLateEventsAreNotRouted() {
        PendingRequest request = tracker.open(RequestKind.HISTORICAL_BARS, AAPL, Map.of());

        RequestTimeoutException error = assertThrows(RequestTimeoutException.class,
                () -> tracker.await(request, Duration.ofMillis(50)));

        assertEquals(request.getId(), error.getRequestId());
        assertEquals(RequestStatus.ERRORED, request.getStatus());
        assertFalse(tracker.route(request.getId()).isPresent());
        assertFalse(tracker.complete(request.getId(), 1));
    }

    @Test
    void cancellingAStreamingRequestCancelsUpstream() {
        PendingRequest request = tracker.open(RequestKind.MARKET_DATA, AAPL, Map.of());

        assertTrue(tracker.cancel(request.getId()));
        assertFalse(tracker.cancel(request.getId()));

        assertEquals(request.getId(), transport.lastCommand(CommandType.CANCEL_MARKET_DATA).getRequestId());
        assertEquals(1, transport.commands(CommandType.CANCEL_MARKET_DATA).size());
        assertThrows(CancellationException.class, () -> tracker.await(request, Duration.ofMillis(50)));
    }

    @Test
    void cancellingAOneShotRequestSendsNothing() {
        PendingRequest request = tracker.open(RequestKind.NEWS_ARTICLE, null, Map.of());

        assertTrue(tracker.cancel(request.getId()));

        assertTrue(transport.commands().isEmpty());
        assertEquals(RequestStatus.CANCELLED, request.getStatus());
    }

    @Test
    void cancelIsLocalWhenTheConnectionIsGone() {
        PendingRequest request = tracker.open(RequestKind.REALTIME_BARS, AAPL, Map.of());
        transport.disconnect();

        assertTrue(tracker.cancel(request.getId()));
        assertEquals(RequestStatus.CANCELLED, request.getStatus());
    }

    @RepeatedTest(50)
    void cancelRacingCompletionHasExactlyOneWinner() throws Exception {
        PendingRequest request = tracker.open(RequestKind.MARKET_DATA, AAPL, Map.of());
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<Boolean> cancel = executor.submit(() -> {
                start.await();
                return tracker.cancel(request.getId());
            });
            Future<Boolean> complete = executor.submit(() -> {
                start.await();
                return tracker.complete(request.getId(), "done");
            });
            start.countDown();

            assertTrue(cancel.get() ^ complete.get());
        } finally {
            executor.shutdownNow();
        }

        assertTrue(request.getStatus() == RequestStatus.CANCELLED || request.getStatus() == RequestStatus.COMPLETED);
        assertEquals(1, tracker.getCancelledCount() + tracker.getCompletedCount());
        List<TableRow> rows = sink.rows(SessionTables.REQUESTS);
        assertEquals(2, rows.size());
    }

    @Test
    void openWithIdRejectsAnIdInUse() {
        tracker.openWithId(1000, RequestKind.ORDER_PLACE, AAPL, Map.of());

        assertThrows(IllegalStateException.class,
                () -> tracker.openWithId(1000, RequestKind.ORDER_PLACE, AAPL, Map.of()));
    }

    @Test
    void requestIsNotLeftOpenWhenItsRowCannotBeWritten() {
        ClockProvider clock = ClockProvider.of(ControllableClock.createUtc(Instant.parse("2024-03-04T14:30:00Z")));
        SessionTables failing = new SessionTables((table, row) -> {
            throw new IllegalStateException("sink closed");
        }, clock);
        RequestTracker broken = new RequestTracker("test", new RequestIdSequence(),
                new CommandGateway("test", transport, clock, 0), failing.writer(SessionTables.REQUESTS), clock);

        assertThrows(IllegalStateException.class,
                () -> broken.openWithId(1000, RequestKind.ORDER_PLACE, AAPL, Map.of()));

        assertEquals(0, broken.getOpenCount());
        assertFalse(broken.lookup(1000).isPresent());
        assertFalse(broken.route(1000).isPresent());
    }

    @Test
    void failAllClosesEveryOpenRequest() {
        PendingRequest streaming = tracker.open(RequestKind.ACCOUNT_PNL, null, Map.of());
        PendingRequest oneShot = tracker.open(RequestKind.HISTORICAL_TICKS, AAPL, Map.of());

        assertEquals(2, tracker.failAll(new ConnectionException("lost")));

        assertEquals(0, tracker.getOpenCount());
        assertThrows(ConnectionException.class, () -> tracker.await(oneShot, Duration.ofMillis(50)));
        assertEquals(RequestStatus.ERRORED, streaming.getStatus());
    }

    @Test
    void routedEventsAreCounted() {
        PendingRequest request = tracker.open(RequestKind.MARKET_DATA, AAPL, Map.of());

        tracker.route(request.getId());
        tracker.route(request.getId());

        assertEquals(2, request.getEventCount());
        assertFalse(tracker.route(request.getId() + 1).isPresent());
    }
}
