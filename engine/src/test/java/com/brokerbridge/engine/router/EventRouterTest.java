package com.brokerbridge.engine.router;

import com.brokerbridge.engine.contract.Contract;
import com.brokerbridge.engine.contract.RegisteredContract;
import com.brokerbridge.engine.error.UpstreamProtocolException;
import com.brokerbridge.engine.event.BarEvent;
import com.brokerbridge.engine.event.CommissionReportEvent;
import com.brokerbridge.engine.event.ErrorEvent;
import com.brokerbridge.engine.event.ExecutionEvent;
import com.brokerbridge.engine.event.FamilyCodeEvent;
import com.brokerbridge.engine.event.FinancialAdvisorDataEvent;
import com.brokerbridge.engine.event.FinancialAdvisorDataEvent.FaDataType;
import com.brokerbridge.engine.event.HistoricalNewsEvent;
import com.brokerbridge.engine.event.ManagedAccountsEvent;
import com.brokerbridge.engine.event.MarketRuleEvent;
import com.brokerbridge.engine.event.NewsArticleEvent;
import com.brokerbridge.engine.event.NewsProviderEvent;
import com.brokerbridge.engine.event.OpenOrderEvent;
import com.brokerbridge.engine.event.OrderInfo;
import com.brokerbridge.engine.event.OrderStatusEvent;
import com.brokerbridge.engine.event.PositionEvent;
import com.brokerbridge.engine.event.RealtimeBarEvent;
import com.brokerbridge.engine.event.RequestEndEvent;
import com.brokerbridge.engine.event.TickPriceEvent;
import com.brokerbridge.engine.event.TradeTickEvent;
import com.brokerbridge.engine.market.BarDataType;
import com.brokerbridge.engine.market.BarSize;
import com.brokerbridge.engine.market.HistoryPeriod;
import com.brokerbridge.engine.market.MarketDataType;
import com.brokerbridge.engine.market.TickDataType;
import com.brokerbridge.engine.order.OrderAction;
import com.brokerbridge.engine.order.OrderSpec;
import com.brokerbridge.engine.order.OrderState;
import com.brokerbridge.engine.order.TrackedOrder;
import com.brokerbridge.engine.request.RequestHandle;
import com.brokerbridge.engine.request.RequestStatus;
import com.brokerbridge.engine.support.SessionFixture;
import com.brokerbridge.engine.table.SessionTables;
import com.brokerbridge.engine.transport.CommandType;
import com.brokerbridge.tables.TableRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class EventRouterTest {

    private static final Duration WAIT = Duration.ofMillis(200);
    private static final Instant BAR_TIME = Instant.parse("2024-03-04T14:30:05Z");

    private SessionFixture fixture;
    private RegisteredContract aapl;

    @BeforeEach
    void setUp() {
        fixture = SessionFixture.create()
                .resolveContractsAs(SessionFixture.resolvedStock("AAPL", 265598))
                .connect(1);
        aapl = fixture.session.registerContract(Contract.stock("AAPL", "USD"));
        fixture.transport.clearCommands();
    }

    // ==================== Errors ====================

    @Test
    void everyErrorEventWritesExactlyOneErrorRow() {
        RequestHandle bars = fixture.session.requestBarsHistorical(aapl, BAR_TIME, HistoryPeriod.days(1),
                BarSize.MIN_1, BarDataType.TRADES, MarketDataType.FROZEN, false);
        RequestHandle ticks = fixture.session.requestMarketData(aapl);

        fixture.transport.deliver(new ErrorEvent(-1, 2104, "Market data farm connection is OK:usfarm"));
        fixture.transport.deliver(new ErrorEvent(ticks.getId(), 10167, "Displaying delayed market data"));
        fixture.transport.deliver(new ErrorEvent(bars.getId(), 162, "HMDS query returned no data"));
        fixture.transport.deliver(new ErrorEvent(99999, 300, "Can't find EId with tickerId:99999"));

        assertEquals(4, fixture.sink.size(SessionTables.ERRORS));
        assertEquals(4, fixture.session.getEventRouter().getErrorEvents());

        TableRow uncorrelated = fixture.sink.rows(SessionTables.ERRORS).get(0);
        assertNull(uncorrelated.get("RequestId"));
        assertEquals(2104L, uncorrelated.getLong("ErrorCode"));
        assertEquals("Market data farm connection is OK", uncorrelated.getString("ErrorDescription"));
        assertEquals("Market data farm connection is OK:usfarm", uncorrelated.getString("Error"));

        assertEquals(RequestStatus.OPEN, ticks.getStatus());
        assertEquals(RequestStatus.ERRORED, bars.getStatus());
        UpstreamProtocolException error = assertThrows(UpstreamProtocolException.class, () -> bars.await(WAIT));
        assertEquals(162, error.getErrorCode());
        assertEquals(bars.getId(), error.getRequestId());
    }

    @Test
    void errorForAPlacedOrderRejectsIt() {
        SessionFixture orders = SessionFixture.create()
                .resolveContractsAs(SessionFixture.resolvedStock("AAPL", 265598))
                .connect(500);
        RegisteredContract contract = orders.session.registerContract(Contract.stock("AAPL", "USD"));
        int orderId = orders.session.orderPlace(contract,
                OrderSpec.limit(OrderAction.BUY, 10, 1).build()).getOrderId();

        orders.transport.deliver(new ErrorEvent(orderId, 201, "Order rejected - reason: price too far"));

        assertEquals(OrderState.REJECTED, orders.session.getOrderManager().get(orderId).orElseThrow().getState());
        assertEquals(1, orders.sink.size(SessionTables.ERRORS));
    }

    @Test
    void refusedCancelLeavesAPartiallyFilledOrderWorking() {
        SessionFixture orders = SessionFixture.create()
                .resolveContractsAs(SessionFixture.resolvedStock("AAPL", 265598))
                .connect(500);
        RegisteredContract contract = orders.session.registerContract(Contract.stock("AAPL", "USD"));
        int orderId = orders.session.orderPlace(contract,
                OrderSpec.limit(OrderAction.BUY, 10, 180).build()).getOrderId();
        orders.transport.deliver(OrderStatusEvent.of(orderId, "Submitted", 5, 5, 180));

        orders.session.orderCancelAll();
        orders.transport.deliver(new ErrorEvent(orderId, 10148,
                "OrderId " + orderId + " that needs to be cancelled cannot be cancelled, state: Filled."));

        TrackedOrder order = orders.session.getOrderManager().get(orderId).orElseThrow();
        assertEquals(OrderState.PARTIALLY_FILLED, order.getState());
        assertEquals(1, orders.sink.size(SessionTables.ERRORS));

        orders.transport.deliver(OrderStatusEvent.of(orderId, "Filled", 10, 0, 180));
        assertEquals(OrderState.FILLED, order.getState());
    }

    @Test
    void statusForOrderIdZeroIsRecordedButNotTracked() {
        OrderInfo manual = new OrderInfo(0, 8888, 0, "DU123", "BUY", "LMT", 10, 180, 0, "DAY", "");

        fixture.transport.deliver(new OpenOrderEvent(0, aapl.getContract(), manual, "Submitted"));
        fixture.transport.deliver(OrderStatusEvent.of(0, "Submitted", 0, 10, 0));

        assertEquals(1, fixture.sink.size(SessionTables.ORDERS_SUBMITTED));
        assertEquals(1, fixture.sink.size(SessionTables.ORDERS_STATUS));
        assertFalse(fixture.session.getOrderManager().isKnown(0));
        assertTrue(fixture.session.orderCancelAll().isEmpty());
        assertTrue(fixture.transport.commands(CommandType.CANCEL_ORDER).isEmpty());
    }

    // ==================== Market data ====================

    @Test
    void snapshotCompletesAtItsEndMarker() {
        RequestHandle snapshot = fixture.session.requestMarketData(aapl, "", true);

        fixture.transport.deliver(new TickPriceEvent(snapshot.getId(), "LAST", 187.0, false, false, false));
        fixture.transport.deliver(new RequestEndEvent(snapshot.getId(), "tickSnapshotEnd"));

        assertEquals(RequestStatus.COMPLETED, snapshot.getStatus());
        assertEquals(1L, snapshot.await(WAIT));
        assertTrue(fixture.session.getRequestTracker().lookup(snapshot.getId()).isEmpty());
        assertEquals(0, fixture.session.getRequestTracker().getOpenCount());
    }

    @Test
    void subscriptionStaysOpenAfterAnEndMarker() {
        RequestHandle ticks = fixture.session.requestMarketData(aapl);

        fixture.transport.deliver(new RequestEndEvent(ticks.getId(), "tickSnapshotEnd"));

        assertEquals(RequestStatus.OPEN, ticks.getStatus());
    }

    @Test
    void zeroTickPriceIsWrittenAsNull() {
        RequestHandle ticks = fixture.session.requestMarketData(aapl);

        fixture.transport.deliver(new TickPriceEvent(ticks.getId(), "BID", 0, false, false, false));
        fixture.transport.deliver(new TickPriceEvent(ticks.getId(), "ASK", 187.25, true, false, false));

        List<TableRow> rows = fixture.sink.rows(SessionTables.TICKS_PRICE);
        assertEquals(2, rows.size());
        assertNull(rows.get(0).get("Price"));
        assertEquals(187.25, rows.get(1).getDouble("Price"));
        assertEquals(SessionFixture.START, rows.get(1).getReceiveTime());
    }

    @Test
    void eventsForACancelledRequestAreDropped() {
        RequestHandle ticks = fixture.session.requestMarketData(aapl);
        assertTrue(ticks.isCancellable());
        assertTrue(ticks.cancel());

        fixture.transport.deliver(new TickPriceEvent(ticks.getId(), "LAST", 187.0, false, false, false));

        assertEquals(0, fixture.sink.size(SessionTables.TICKS_PRICE));
        assertEquals(1, fixture.session.getEventRouter().getEventsDropped());
        assertFalse(ticks.isCancellable());
        assertEquals(ticks.getId(), fixture.transport.lastCommand(CommandType.CANCEL_MARKET_DATA).getRequestId());
    }

    @Test
    void historicalBarsCompleteAtTheEndMarker() {
        RequestHandle bars = fixture.session.requestBarsHistorical(aapl, BAR_TIME, HistoryPeriod.days(1),
                BarSize.MIN_1, BarDataType.TRADES, MarketDataType.FROZEN, false);

        fixture.transport.deliver(bar(bars.getId(), BAR_TIME));
        fixture.transport.deliver(bar(bars.getId(), BAR_TIME.plusSeconds(60)));
        fixture.transport.deliver(new RequestEndEvent(bars.getId(), "historicalDataEnd"));

        assertEquals(2L, bars.await(WAIT));
        assertEquals(2, fixture.sink.size(SessionTables.BARS_HISTORICAL));
        assertEquals(BAR_TIME, fixture.sink.rows(SessionTables.BARS_HISTORICAL).get(0).get("Timestamp"));
    }

    @Test
    void keepUpToDateBarsStayOpenAfterTheEndMarker() {
        RequestHandle bars = fixture.session.requestBarsHistorical(aapl, BAR_TIME, HistoryPeriod.days(1),
                BarSize.MIN_1, BarDataType.TRADES, MarketDataType.FROZEN, true);

        fixture.transport.deliver(new RequestEndEvent(bars.getId(), "historicalDataEnd"));
        fixture.transport.deliver(bar(bars.getId(), BAR_TIME));

        assertEquals(RequestStatus.OPEN, bars.getStatus());
        assertEquals(1, fixture.sink.size(SessionTables.BARS_HISTORICAL));
        assertEquals("", fixture.transport.lastCommand(CommandType.REQUEST_HISTORICAL_DATA).param("endDateTime"));
    }

    @Test
    void realtimeBarsGetAnEndTimeFromTheBarSize() {
        RequestHandle bars = fixture.session.requestBarsRealtime(aapl, BarDataType.MIDPOINT, 5,
                MarketDataType.REAL_TIME);

        fixture.transport.deliver(new RealtimeBarEvent(bars.getId(), BAR_TIME, 1, 2, 0.5, 1.5, 100, 1.2, 7));

        TableRow row = fixture.sink.lastRow(SessionTables.BARS_REALTIME).orElseThrow();
        assertEquals(BAR_TIME, row.get("Timestamp"));
        assertEquals(BAR_TIME.plusSeconds(5), row.get("TimestampEnd"));
        assertEquals(7L, row.getLong("Count"));
    }

    @Test
    void tradeTicksGoToTheTradeTable() {
        RequestHandle ticks = fixture.session.requestTickDataRealtime(aapl, TickDataType.LAST);

        fixture.transport.deliver(new TradeTickEvent(ticks.getId(), BAR_TIME, 187.1, 200, "NASDAQ", "", false, false));

        TableRow row = fixture.sink.lastRow(SessionTables.TICKS_TRADE).orElseThrow();
        assertEquals("NASDAQ", row.getString("Exchange"));
        assertNull(row.get("SpecialConditions"));
        assertEquals("Last", fixture.transport.lastCommand(CommandType.REQUEST_TICK_BY_TICK).param("tickType"));
    }

    // ==================== News ====================

    @Test
    void historicalHeadlinesLoseTheirMetadataPrefix() {
        RequestHandle news = fixture.session.requestNewsHistorical(aapl, "BRFG", BAR_TIME.minusSeconds(86400),
                BAR_TIME, 10);

        fixture.transport.deliver(new HistoricalNewsEvent(news.getId(), BAR_TIME, "BRFG", "BRFG$1234",
                "{A:800015:L:en:K:n/a:C:0.97}Apple beats estimates"));
        fixture.transport.deliver(new RequestEndEvent(news.getId(), "historicalNewsEnd"));

        assertEquals("Apple beats estimates",
                fixture.sink.lastRow(SessionTables.NEWS_HISTORICAL).orElseThrow().getString("Headline"));
        assertEquals(RequestStatus.COMPLETED, news.getStatus());
    }

    @Test
    void headlineCleanup() {
        assertEquals("Plain", EventRouter.cleanHeadline("Plain"));
        assertEquals("Tagged", EventRouter.cleanHeadline("{K:1}Tagged"));
        assertNull(EventRouter.cleanHeadline(null));
    }

    @Test
    void newsArticleCompletesItsRequest() {
        RequestHandle article = fixture.session.requestNewsArticle("BRFG", "BRFG$1234");

        fixture.transport.deliver(new NewsArticleEvent(article.getId(), "0", "Full text"));

        assertEquals("Full text", article.await(WAIT));
        assertEquals(1, fixture.sink.size(SessionTables.NEWS_ARTICLES));
    }

    @Test
    void newsProvidersAreRemembered() {
        fixture.transport.deliver(new NewsProviderEvent("BRFG", "Briefing.com General Market Columns"));
        fixture.transport.deliver(new NewsProviderEvent("DJNL", "Dow Jones Newsletters"));

        assertEquals(List.of("BRFG", "DJNL"), fixture.session.getEventRouter().getNewsProviders());
        fixture.session.requestNewsHistorical(aapl, null, BAR_TIME.minusSeconds(60), BAR_TIME, 5);
        assertEquals("BRFG+DJNL",
                fixture.transport.lastCommand(CommandType.REQUEST_HISTORICAL_NEWS).param("providerCodes"));
    }

    // ==================== Accounts ====================

    @Test
    void newManagedAccountsAreSubscribedOnce() {
        fixture.transport.deliver(new ManagedAccountsEvent(List.of("U1001", "U1002", "U1001")));
        fixture.transport.deliver(new ManagedAccountsEvent(List.of("U1002")));

        assertEquals(2, fixture.sink.size(SessionTables.ACCOUNTS_MANAGED));
        assertEquals(2, fixture.transport.commands(CommandType.REQUEST_PNL).size());
        assertEquals(2, fixture.transport.commands(CommandType.REQUEST_ACCOUNT_UPDATES_MULTI).size());
        assertEquals(2, fixture.transport.commands(CommandType.REQUEST_POSITIONS_MULTI).size());
        Set<Object> accounts = fixture.transport.commands(CommandType.REQUEST_PNL).stream()
                .map(command -> command.param("account"))
                .collect(Collectors.toSet());
        assertEquals(Set.of("U1001", "U1002"), accounts);
    }

    @Test
    void advisorGroupsAndAliasesAreTabulated() {
        fixture.transport.deliver(new FinancialAdvisorDataEvent(FaDataType.GROUPS, AdvisorXmlTest.GROUPS));
        fixture.transport.deliver(new FinancialAdvisorDataEvent(FaDataType.ALIASES, AdvisorXmlTest.ALIASES));

        assertEquals(3, fixture.sink.size(SessionTables.ACCOUNTS_GROUPS));
        assertEquals(2, fixture.sink.size(SessionTables.ACCOUNTS_ALIASES));
        assertEquals(List.of("Growth", "Income"), fixture.transport.commands(CommandType.REQUEST_ACCOUNT_SUMMARY)
                .stream().map(command -> command.param("group")).collect(Collectors.toList()));
    }

    @Test
    void malformedAdvisorXmlIsCountedAndRoutingContinues() {
        fixture.transport.deliver(new FinancialAdvisorDataEvent(FaDataType.GROUPS, "<ListOfGroups>"));
        fixture.transport.deliver(new FamilyCodeEvent("U1001", "F1001"));

        assertEquals(1, fixture.session.getEventRouter().getHandlerFailures());
        assertEquals(1, fixture.sink.size(SessionTables.ACCOUNTS_FAMILY_CODES));
    }

    @Test
    void positionsAreWrittenAndTheirContractsResolvedInTheBackground() {
        RequestHandle positions = fixture.session.requestAccountPositions("All");
        Contract msft = Contract.stock("MSFT", "USD").toBuilder().conId(272093).build();

        fixture.transport.deliver(new PositionEvent(positions.getId(), "U1001", "", msft, 50, 402.1));

        TableRow row = fixture.sink.lastRow(SessionTables.ACCOUNTS_POSITIONS).orElseThrow();
        assertEquals("MSFT", row.getString("Symbol"));
        assertEquals(272093L, row.getLong("ContractId"));
        assertNull(row.get("ModelCode"));
        assertEquals(1, fixture.transport.commands(CommandType.REQUEST_CONTRACT_DETAILS).size());
        assertEquals(RequestStatus.OPEN, positions.getStatus());
    }

    @Test
    void marketRulesAreTabulated() {
        fixture.transport.deliver(new MarketRuleEvent(26, List.of(
                new MarketRuleEvent.PriceIncrement(0, 0.01), new MarketRuleEvent.PriceIncrement(1000, 0.05))));

        List<TableRow> rows = fixture.sink.rows(SessionTables.MARKET_RULES);
        assertEquals(2, rows.size());
        assertEquals("26", rows.get(0).getString("MarketRuleId"));
        assertEquals(0.05, rows.get(1).getDouble("Increment"));
    }

    // ==================== Orders ====================

    @Test
    void unsolicitedExecutionTracksAnExternalOrder() {
        Contract msft = Contract.stock("MSFT", "USD").toBuilder().conId(272093).build();

        fixture.transport.deliver(new ExecutionEvent(-1, msft, "0000e0d5.01", 4242, "20240304 14:31:00", "U1001",
                "ISLAND", "BOT", 10, 401.5, 123456789L, 10, 401.5));
        fixture.transport.deliver(new CommissionReportEvent("0000e0d5.01", 1.0, "USD", 0));

        TableRow row = fixture.sink.lastRow(SessionTables.ORDERS_EXEC_DETAILS).orElseThrow();
        assertNull(row.get("RequestId"));
        assertEquals("ISLAND", row.getString("ExecutionExchange"));
        assertEquals("SMART", row.getString("ContractExchange"));
        assertEquals(1, fixture.sink.size(SessionTables.ORDERS_EXEC_COMMISSION_REPORT));

        TrackedOrder order = fixture.session.getOrderManager().get(4242).orElseThrow();
        assertTrue(order.isExternal());
        assertEquals(OrderState.PARTIALLY_FILLED, order.getState());
    }

    private static BarEvent bar(int requestId, Instant timestamp) {
        return new BarEvent(requestId, timestamp, 187.0, 187.5, 186.9, 187.2, 12000, 187.1, 85);
    }
}
