package com.brokerbridge.engine.router;

import com.brokerbridge.engine.contract.Contract;
import com.brokerbridge.engine.contract.ContractDetails;
import com.brokerbridge.engine.contract.ContractRegistry;
import com.brokerbridge.engine.error.UpstreamProtocolException;
import com.brokerbridge.engine.event.AccountSummaryEvent;
import com.brokerbridge.engine.event.AccountValueEvent;
import com.brokerbridge.engine.event.BarEvent;
import com.brokerbridge.engine.event.BidAskTickEvent;
import com.brokerbridge.engine.event.BrokerEvent;
import com.brokerbridge.engine.event.CommissionReportEvent;
import com.brokerbridge.engine.event.CompletedOrderEvent;
import com.brokerbridge.engine.event.ConnectionStateEvent;
import com.brokerbridge.engine.event.ContractDetailsEvent;
import com.brokerbridge.engine.event.ErrorEvent;
import com.brokerbridge.engine.event.ExecutionEvent;
import com.brokerbridge.engine.event.FamilyCodeEvent;
import com.brokerbridge.engine.event.FinancialAdvisorDataEvent;
import com.brokerbridge.engine.event.HistoricalNewsEvent;
import com.brokerbridge.engine.event.ManagedAccountsEvent;
import com.brokerbridge.engine.event.MarketRuleEvent;
import com.brokerbridge.engine.event.MidPointTickEvent;
import com.brokerbridge.engine.event.NewsArticleEvent;
import com.brokerbridge.engine.event.NewsBulletinEvent;
import com.brokerbridge.engine.event.NewsProviderEvent;
import com.brokerbridge.engine.event.NextValidIdEvent;
import com.brokerbridge.engine.event.OpenOrderEvent;
import com.brokerbridge.engine.event.OrderInfo;
import com.brokerbridge.engine.event.OrderStatusEvent;
import com.brokerbridge.engine.event.PnlEvent;
import com.brokerbridge.engine.event.PositionEvent;
import com.brokerbridge.engine.event.RealtimeBarEvent;
import com.brokerbridge.engine.event.RequestEndEvent;
import com.brokerbridge.engine.event.RequestScopedEvent;
import com.brokerbridge.engine.event.SymbolSampleEvent;
import com.brokerbridge.engine.event.TickGenericEvent;
import com.brokerbridge.engine.event.TickOptionComputationEvent;
import com.brokerbridge.engine.event.TickPriceEvent;
import com.brokerbridge.engine.event.TickSizeEvent;
import com.brokerbridge.engine.event.TickStringEvent;
import com.brokerbridge.engine.event.TradeTickEvent;
import com.brokerbridge.engine.id.NextValidIdQueue;
import com.brokerbridge.engine.order.OrderLifecycleManager;
import com.brokerbridge.engine.order.OrderState;
import com.brokerbridge.engine.order.TrackedOrder;
import com.brokerbridge.engine.request.PendingRequest;
import com.brokerbridge.engine.request.RequestKind;
import com.brokerbridge.engine.request.RequestTracker;
import com.brokerbridge.engine.table.SessionTables;
import com.brokerbridge.engine.transport.InboundEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Dispatches decoded broker events.
 *
 * <p>For each event the router resolves the request, order or contract it refers to,
 * writes its raw row (plus a normalized {@code orders} row when an order changes
 * state) and updates the tracker, order manager or registry. Rows are stamped with
 * the receipt instant, not with any time reported in the event.</p>
 *
 * <p>Every error event produces exactly one {@code errors} row. A correlated,
 * non-informational error additionally fails the pending request or rejects the
 * order it refers to.</p>
 *
 * <p>Events for a request id that is not open are dropped. A failing handler is logged
 * and counted; the router keeps going. The router never blocks: it only appends rows,
 * updates maps and posts commands.</p>
 */
public class EventRouter implements InboundEventListener {

    private static final Logger log = LoggerFactory.getLogger(EventRouter.class);

    public static final String CONTEXT_BAR_SIZE_SECONDS = "barSizeSeconds";
    public static final String CONTEXT_KEEP_UP_TO_DATE = "keepUpToDate";
    public static final String CONTEXT_SNAPSHOT = "snapshot";

    private final String sessionName;
    private final SessionTables tables;
    private final RequestTracker tracker;
    private final OrderLifecycleManager orders;
    private final ContractRegistry registry;
    private final NextValidIdQueue nextValidIds;
    private final ErrorCodes errorCodes;
    private final SessionCallbacks callbacks;

    private final Set<String> managedAccounts = ConcurrentHashMap.newKeySet();
    private final List<String> newsProviders = new CopyOnWriteArrayList<>();

    private final AtomicLong eventsRouted = new AtomicLong();
    private final AtomicLong eventsDropped = new AtomicLong();
    private final AtomicLong handlerFailures = new AtomicLong();
    private final AtomicLong errorEvents = new AtomicLong();

    public EventRouter(String sessionName, SessionTables tables, RequestTracker tracker,
                       OrderLifecycleManager orders, ContractRegistry registry, NextValidIdQueue nextValidIds,
                       ErrorCodes errorCodes, SessionCallbacks callbacks) {
        this.sessionName = sessionName;
        this.tables = tables;
        this.tracker = tracker;
        this.orders = orders;
        this.registry = registry;
        this.nextValidIds = nextValidIds;
        this.errorCodes = errorCodes;
        this.callbacks = callbacks;
    }

    @Override
    public void onEvent(BrokerEvent event) {
        try {
            route(event);
            eventsRouted.incrementAndGet();
        } catch (Exception e) {
            handlerFailures.incrementAndGet();
            log.error("[{}] Error routing {} event: {}", sessionName, event.kind(), event, e);
        }
    }

    private void route(BrokerEvent event) {
        switch (event.kind()) {
            case CONNECTION_STATE -> {
                ConnectionStateEvent e = (ConnectionStateEvent) event;
                callbacks.onConnectionState(e.connected(), e.reason());
            }
            case NEXT_VALID_ID -> nextValidIds.onNextValidId(((NextValidIdEvent) event).orderId());
            case ERROR -> onError((ErrorEvent) event);
            case REQUEST_END -> onRequestEnd((RequestEndEvent) event);

            case CONTRACT_DETAILS -> onContractDetails((ContractDetailsEvent) event);
            case SYMBOL_SAMPLE -> onSymbolSample((SymbolSampleEvent) event);
            case MARKET_RULE -> onMarketRule((MarketRuleEvent) event);

            case TICK_PRICE -> onTickPrice((TickPriceEvent) event);
            case TICK_SIZE -> onTickSize((TickSizeEvent) event);
            case TICK_STRING -> onTickString((TickStringEvent) event);
            case TICK_GENERIC -> onTickGeneric((TickGenericEvent) event);
            case TICK_OPTION_COMPUTATION -> onTickOptionComputation((TickOptionComputationEvent) event);
            case TRADE_TICK -> onTradeTick((TradeTickEvent) event);
            case BID_ASK_TICK -> onBidAskTick((BidAskTickEvent) event);
            case MID_POINT_TICK -> onMidPointTick((MidPointTickEvent) event);
            case HISTORICAL_BAR -> onHistoricalBar((BarEvent) event);
            case REALTIME_BAR -> onRealtimeBar((RealtimeBarEvent) event);

            case ACCOUNT_VALUE -> onAccountValue((AccountValueEvent) event);
            case ACCOUNT_SUMMARY -> onAccountSummary((AccountSummaryEvent) event);
            case POSITION -> onPosition((PositionEvent) event);
            case PNL -> onPnl((PnlEvent) event);
            case MANAGED_ACCOUNTS -> onManagedAccounts((ManagedAccountsEvent) event);
            case FAMILY_CODE -> onFamilyCode((FamilyCodeEvent) event);
            case FINANCIAL_ADVISOR_DATA -> onAdvisorData((FinancialAdvisorDataEvent) event);

            case NEWS_PROVIDER -> onNewsProvider((NewsProviderEvent) event);
            case NEWS_BULLETIN -> onNewsBulletin((NewsBulletinEvent) event);
            case NEWS_ARTICLE -> onNewsArticle((NewsArticleEvent) event);
            case HISTORICAL_NEWS -> onHistoricalNews((HistoricalNewsEvent) event);

            case OPEN_ORDER -> onOpenOrder((OpenOrderEvent) event);
            case COMPLETED_ORDER -> onCompletedOrder((CompletedOrderEvent) event);
            case ORDER_STATUS -> onOrderStatus((OrderStatusEvent) event);
            case EXECUTION -> onExecution((ExecutionEvent) event);
            case COMMISSION_REPORT -> onCommissionReport((CommissionReportEvent) event);
        }
    }

    // ==================== General ====================

    private void onError(ErrorEvent event) {
        errorEvents.incrementAndGet();
        int code = event.errorCode();
        boolean correlated = event.isCorrelated();

        tables.row(SessionTables.ERRORS)
                .add(correlated ? (long) event.requestId() : null)
                .add((long) code)
                .add(errorCodes.describe(code, event.message()))
                .add(event.message())
                .add(errorCodes.note(code))
                .write();

        if (!correlated) {
            log.info("[{}] Broker notice {}: {}", sessionName, code, event.message());
            return;
        }
        if (errorCodes.isInformational(code)) {
            log.info("[{}] Broker notice {} for {}: {}", sessionName, code, event.requestId(), event.message());
            return;
        }

        int id = event.requestId();
        Optional<TrackedOrder> order = orders.get(id);
        if (order.isPresent()) {
            onOrderError(order.get(), event);
            return;
        }
        if (tracker.lookup(id).isPresent()) {
            log.warn("[{}] Broker error {} for request {}: {}", sessionName, code, id, event.message());
            tracker.fail(id, new UpstreamProtocolException(id, code, event.message()));
        } else {
            drop(event, "error for unknown or closed request " + id);
        }
    }

    private void onOrderError(TrackedOrder order, ErrorEvent event) {
        int code = event.errorCode();
        if (errorCodes.isCancelRefusal(code)) {
            log.warn("[{}] Cancel of order {} refused ({}), order stays {}: {}", sessionName,
                    order.getOrderId(), code, order.getState(), event.message());
        } else if (errorCodes.isOrderCancelled(code)) {
            orders.onCancelConfirmed(order.getOrderId());
        } else if (errorCodes.isOrderRejection(code)
                || order.getState() == OrderState.CREATED || order.getState() == OrderState.SUBMITTED) {
            log.warn("[{}] Order {} rejected by broker ({}): {}", sessionName, order.getOrderId(), code,
                    event.message());
            orders.onRejected(order.getOrderId(), code, event.message());
        } else {
            log.warn("[{}] Broker error {} for order {} in state {}: {}", sessionName, code,
                    order.getOrderId(), order.getState(), event.message());
        }
    }

    private void onRequestEnd(RequestEndEvent event) {
        if (!BrokerEvent.isCorrelated(event.requestId())) {
            log.debug("[{}] {} received", sessionName, event.source());
            return;
        }
        Optional<PendingRequest> open = tracker.lookup(event.requestId());
        if (open.isEmpty()) {
            drop(event, event.source() + " for unknown or closed request");
            return;
        }
        PendingRequest request = open.get();
        if (request.getKind() == RequestKind.CONTRACT_DETAILS) {
            registry.onDetailsEnd(request.getId());
        } else if (stillStreaming(request)) {
            log.debug("[{}] {} for streaming request {}, still open", sessionName, event.source(), request.getId());
        } else {
            tracker.complete(request.getId(), request.getEventCount());
        }
    }

    private static boolean stillStreaming(PendingRequest request) {
        if (Boolean.TRUE.equals(request.context(CONTEXT_SNAPSHOT))) {
            return false;
        }
        return request.getKind().isStreaming() || Boolean.TRUE.equals(request.context(CONTEXT_KEEP_UP_TO_DATE));
    }

    // ==================== Contracts ====================

    private void onContractDetails(ContractDetailsEvent event) {
        if (open(event).isEmpty()) {
            return;
        }
        ContractDetails details = event.details();
        tables.row(SessionTables.CONTRACTS_DETAILS)
                .add((long) event.requestId())
                .contract(details.getContract())
                .add(details.getMarketName())
                .add(details.getLongName())
                .add(details.getMinTick())
                .add(details.getValidExchanges())
                .add(details.getMarketRuleIds())
                .add(details.getTimeZoneId())
                .add(details.getIndustry())
                .add(details.getCategory())
                .write();
        registry.onContractDetails(event.requestId(), details);
        registry.requestMarketRules(details);
    }

    private void onSymbolSample(SymbolSampleEvent event) {
        if (open(event).isEmpty()) {
            return;
        }
        tables.row(SessionTables.CONTRACTS_MATCHING)
                .add((long) event.requestId())
                .contract(event.contract())
                .add(event.derivativeSecTypes())
                .write();
    }

    private void onMarketRule(MarketRuleEvent event) {
        for (MarketRuleEvent.PriceIncrement increment : event.increments()) {
            tables.row(SessionTables.MARKET_RULES)
                    .add(Integer.toString(event.marketRuleId()))
                    .add(increment.lowEdge())
                    .add(increment.increment())
                    .write();
        }
    }

    // ==================== Market data ====================

    private void onTickPrice(TickPriceEvent event) {
        if (open(event).isEmpty()) {
            return;
        }
        tables.row(SessionTables.TICKS_PRICE)
                .add((long) event.requestId())
                .add(event.tickType())
                .add(event.price() == 0 ? null : event.price())
                .add(event.canAutoExecute())
                .add(event.pastLimit())
                .add(event.preOpen())
                .write();
    }

    private void onTickSize(TickSizeEvent event) {
        if (open(event).isEmpty()) {
            return;
        }
        tables.row(SessionTables.TICKS_SIZE)
                .add((long) event.requestId())
                .add(event.tickType())
                .add(event.size())
                .write();
    }

    private void onTickString(TickStringEvent event) {
        if (open(event).isEmpty()) {
            return;
        }
        tables.row(SessionTables.TICKS_STRING)
                .add((long) event.requestId())
                .add(event.tickType())
                .add(event.value())
                .write();
    }

    private void onTickGeneric(TickGenericEvent event) {
        if (open(event).isEmpty()) {
            return;
        }
        tables.row(SessionTables.TICKS_GENERIC)
                .add((long) event.requestId())
                .add(event.tickType())
                .add(event.value())
                .write();
    }

    private void onTickOptionComputation(TickOptionComputationEvent event) {
        if (open(event).isEmpty()) {
            return;
        }
        tables.row(SessionTables.TICKS_OPTION_COMPUTATION)
                .add((long) event.requestId())
                .add(event.tickType())
                .add(event.tickAttrib())
                .add(event.impliedVol())
                .add(event.delta())
                .add(event.optPrice())
                .add(event.pvDividend())
                .add(event.gamma())
                .add(event.vega())
                .add(event.theta())
                .add(event.undPrice())
                .write();
    }

    private void onTradeTick(TradeTickEvent event) {
        if (open(event).isEmpty()) {
            return;
        }
        tables.row(SessionTables.TICKS_TRADE)
                .add((long) event.requestId())
                .add(event.timestamp())
                .add(event.price())
                .add(event.size())
                .add(event.exchange())
                .add(event.specialConditions())
                .add(event.pastLimit())
                .add(event.unreported())
                .write();
    }

    private void onBidAskTick(BidAskTickEvent event) {
        if (open(event).isEmpty()) {
            return;
        }
        tables.row(SessionTables.TICKS_BID_ASK)
                .add((long) event.requestId())
                .add(event.timestamp())
                .add(event.bidPrice())
                .add(event.askPrice())
                .add(event.bidSize())
                .add(event.askSize())
                .add(event.bidPastLow())
                .add(event.askPastHigh())
                .write();
    }

    private void onMidPointTick(MidPointTickEvent event) {
        if (open(event).isEmpty()) {
            return;
        }
        tables.row(SessionTables.TICKS_MID_POINT)
                .add((long) event.requestId())
                .add(event.timestamp())
                .add(event.midPoint())
                .write();
    }

    private void onHistoricalBar(BarEvent event) {
        if (open(event).isEmpty()) {
            return;
        }
        tables.row(SessionTables.BARS_HISTORICAL)
                .add((long) event.requestId())
                .add(event.timestamp())
                .add(event.open())
                .add(event.high())
                .add(event.low())
                .add(event.close())
                .add(event.volume())
                .add(event.barCount())
                .add(event.wap())
                .write();
    }

    private void onRealtimeBar(RealtimeBarEvent event) {
        Optional<PendingRequest> request = open(event);
        if (request.isEmpty()) {
            return;
        }
        Integer barSize = request.get().context(CONTEXT_BAR_SIZE_SECONDS);
        Instant end = barSize != null ? event.timestamp().plusSeconds(barSize) : null;
        tables.row(SessionTables.BARS_REALTIME)
                .add((long) event.requestId())
                .add(event.timestamp())
                .add(end)
                .add(event.open())
                .add(event.high())
                .add(event.low())
                .add(event.close())
                .add(event.volume())
                .add(event.wap())
                .add(event.count())
                .write();
    }

    // ==================== Accounts ====================

    private void onAccountValue(AccountValueEvent event) {
        if (open(event).isEmpty()) {
            return;
        }
        tables.row(SessionTables.ACCOUNTS_OVERVIEW)
                .add((long) event.requestId())
                .add(event.account())
                .add(event.modelCode())
                .add(event.currency())
                .add(event.key())
                .add(event.value())
                .write();
    }

    private void onAccountSummary(AccountSummaryEvent event) {
        if (open(event).isEmpty()) {
            return;
        }
        tables.row(SessionTables.ACCOUNTS_SUMMARY)
                .add((long) event.requestId())
                .add(event.account())
                .add(event.tag())
                .add(event.value())
                .add(event.currency())
                .write();
    }

    private void onPosition(PositionEvent event) {
        if (open(event).isEmpty()) {
            return;
        }
        tables.row(SessionTables.ACCOUNTS_POSITIONS)
                .add((long) event.requestId())
                .add(event.account())
                .add(event.modelCode())
                .contract(event.contract())
                .add(event.position())
                .add(event.averageCost())
                .write();
        requestDetails(event.contract());
    }

    private void onPnl(PnlEvent event) {
        if (open(event).isEmpty()) {
            return;
        }
        tables.row(SessionTables.ACCOUNTS_PNL)
                .add((long) event.requestId())
                .add(event.dailyPnl())
                .add(event.unrealizedPnl())
                .add(event.realizedPnl())
                .write();
    }

    private void onManagedAccounts(ManagedAccountsEvent event) {
        for (String account : event.accounts()) {
            String trimmed = account == null ? "" : account.trim();
            if (!trimmed.isEmpty() && managedAccounts.add(trimmed)) {
                tables.row(SessionTables.ACCOUNTS_MANAGED).add(trimmed).write();
                log.info("[{}] Managed account {}", sessionName, trimmed);
                callbacks.onNewAccount(trimmed);
            }
        }
    }

    private void onFamilyCode(FamilyCodeEvent event) {
        tables.row(SessionTables.ACCOUNTS_FAMILY_CODES)
                .add(event.accountId())
                .add(event.familyCode())
                .write();
    }

    private void onAdvisorData(FinancialAdvisorDataEvent event) {
        switch (event.dataType()) {
            case GROUPS -> {
                for (AdvisorXml.Group group : AdvisorXml.parseGroups(event.xml())) {
                    for (String account : group.accounts()) {
                        tables.row(SessionTables.ACCOUNTS_GROUPS)
                                .add(group.name())
                                .add(group.defaultMethod())
                                .add(account)
                                .write();
                    }
                    callbacks.onAdvisorGroup(group.name());
                }
            }
            case ALIASES -> {
                for (AdvisorXml.Alias alias : AdvisorXml.parseAliases(event.xml())) {
                    tables.row(SessionTables.ACCOUNTS_ALIASES)
                            .add(alias.account())
                            .add(alias.alias())
                            .write();
                }
            }
            case PROFILES -> log.debug("[{}] Ignoring advisor allocation profiles", sessionName);
        }
    }

    // ==================== News ====================

    private void onNewsProvider(NewsProviderEvent event) {
        newsProviders.add(event.providerCode());
        tables.row(SessionTables.NEWS_PROVIDERS)
                .add(event.providerCode())
                .add(event.providerName())
                .write();
    }

    private void onNewsBulletin(NewsBulletinEvent event) {
        tables.row(SessionTables.NEWS_BULLETINS)
                .add((long) event.messageId())
                .add(event.messageType())
                .add(event.message())
                .add(event.originExchange())
                .write();
    }

    private void onNewsArticle(NewsArticleEvent event) {
        if (open(event).isEmpty()) {
            return;
        }
        tables.row(SessionTables.NEWS_ARTICLES)
                .add((long) event.requestId())
                .add(event.articleType())
                .add(event.articleText())
                .write();
        // one article per request, no end marker follows
        tracker.complete(event.requestId(), event.articleText());
    }

    private void onHistoricalNews(HistoricalNewsEvent event) {
        if (open(event).isEmpty()) {
            return;
        }
        tables.row(SessionTables.NEWS_HISTORICAL)
                .add((long) event.requestId())
                .add(event.timestamp())
                .add(event.providerCode())
                .add(event.articleId())
                .add(cleanHeadline(event.headline()))
                .write();
    }

    /**
     * Drop the {@code {...}} metadata block some providers put before the headline.
     */
    static String cleanHeadline(String headline) {
        if (headline == null) {
            return null;
        }
        int end = headline.indexOf('}');
        return end < 0 ? headline : headline.substring(end + 1);
    }

    // ==================== Orders ====================

    private void onOpenOrder(OpenOrderEvent event) {
        writeOrderReport(SessionTables.ORDERS_SUBMITTED, event.contract(), event.order(), event.status())
                .write();
        // orders placed outside any API client report id 0
        if (event.orderId() > 0) {
            orders.onOpenOrder(event.orderId(), event.contract(), event.order().permId(), event.status());
        }
        requestDetails(event.contract());
    }

    private void onCompletedOrder(CompletedOrderEvent event) {
        writeOrderReport(SessionTables.ORDERS_COMPLETED, event.contract(), event.order(), event.status())
                .add(event.completedTime())
                .add(event.completedStatus())
                .write();
        int orderId = event.order().orderId();
        if (orderId > 0) {
            orders.onOpenOrder(orderId, event.contract(), event.order().permId(), event.status());
        }
        requestDetails(event.contract());
    }

    private SessionTables.RowBuilder writeOrderReport(String table, Contract contract, OrderInfo order,
                                                      String status) {
        return tables.row(table)
                .contract(contract)
                .add((long) order.orderId())
                .add(order.permId())
                .add((long) order.clientId())
                .add(order.account())
                .add(order.action())
                .add(order.orderType())
                .add(order.totalQuantity())
                .add(order.limitPrice())
                .add(order.auxPrice())
                .add(order.timeInForce())
                .add(order.orderRef())
                .add(status);
    }

    private void onOrderStatus(OrderStatusEvent event) {
        // raw feed row first, also for duplicate and late reports
        tables.row(SessionTables.ORDERS_STATUS)
                .add((long) event.orderId())
                .add(event.status())
                .add(event.filled())
                .add(event.remaining())
                .add(event.avgFillPrice())
                .add(event.permId())
                .add((long) event.parentId())
                .add(event.lastFillPrice())
                .add((long) event.clientId())
                .add(event.whyHeld())
                .add(event.mktCapPrice())
                .write();
        if (event.orderId() > 0) {
            orders.onOrderStatus(event.orderId(), event.status(), event.filled(), event.remaining(),
                    event.avgFillPrice(), event.permId());
        }
    }

    private void onExecution(ExecutionEvent event) {
        if (BrokerEvent.isCorrelated(event.requestId()) && open(event).isEmpty()) {
            return;
        }
        tables.row(SessionTables.ORDERS_EXEC_DETAILS)
                .add(BrokerEvent.isCorrelated(event.requestId()) ? (long) event.requestId() : null)
                .contract(event.contract())
                .add(event.execId())
                .add((long) event.orderId())
                .add(event.time())
                .add(event.account())
                .add(event.exchange())
                .add(event.side())
                .add(event.shares())
                .add(event.price())
                .add(event.permId())
                .add(event.cumQty())
                .add(event.avgPrice())
                .write();
        if (event.orderId() > 0) {
            orders.onExecution(event.orderId(), event.contract(), event.execId(), event.cumQty(), event.avgPrice());
        }
        requestDetails(event.contract());
    }

    private void onCommissionReport(CommissionReportEvent event) {
        tables.row(SessionTables.ORDERS_EXEC_COMMISSION_REPORT)
                .add(event.execId())
                .add(event.commission())
                .add(event.currency())
                .add(event.realizedPnl())
                .write();
    }

    // ==================== Helpers ====================

    private Optional<PendingRequest> open(RequestScopedEvent event) {
        Optional<PendingRequest> request = tracker.route(event.requestId());
        if (request.isEmpty()) {
            drop(event, "request " + event.requestId() + " is not open");
        }
        return request;
    }

    private void drop(BrokerEvent event, String reason) {
        eventsDropped.incrementAndGet();
        log.warn("[{}] Dropping {} event: {}", sessionName, event.kind(), reason);
    }

    private void requestDetails(Contract contract) {
        if (contract != null) {
            registry.requestDetails(contract);
        }
    }

    /**
     * @return managed accounts seen so far
     */
    public List<String> getManagedAccounts() {
        return new ArrayList<>(managedAccounts);
    }

    public List<String> getNewsProviders() {
        return new ArrayList<>(newsProviders);
    }

    public long getEventsRouted() {
        return eventsRouted.get();
    }

    public long getEventsDropped() {
        return eventsDropped.get();
    }

    public long getHandlerFailures() {
        return handlerFailures.get();
    }

    public long getErrorEvents() {
        return errorEvents.get();
    }

    /**
     * Forget per-connection state, e.g. before reconnecting.
     */
    public void reset() {
        managedAccounts.clear();
        newsProviders.clear();
    }
}
