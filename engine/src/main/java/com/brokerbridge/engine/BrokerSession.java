package com.brokerbridge.engine;

import com.brokerbridge.config.ClockProvider;
import com.brokerbridge.config.ConfigLoader;
import com.brokerbridge.engine.contract.Contract;
import com.brokerbridge.engine.contract.ContractRegistry;
import com.brokerbridge.engine.contract.RegisteredContract;
import com.brokerbridge.engine.error.BrokerSessionException;
import com.brokerbridge.engine.error.ConnectionException;
import com.brokerbridge.engine.error.ReadOnlySessionException;
import com.brokerbridge.engine.error.UpstreamProtocolException;
import com.brokerbridge.engine.event.FinancialAdvisorDataEvent.FaDataType;
import com.brokerbridge.engine.id.IncrementingOrderIdAllocator;
import com.brokerbridge.engine.id.NextValidIdQueue;
import com.brokerbridge.engine.id.OrderIdAllocator;
import com.brokerbridge.engine.id.RequestIdSequence;
import com.brokerbridge.engine.market.BarDataType;
import com.brokerbridge.engine.market.BarSize;
import com.brokerbridge.engine.market.HistoryPeriod;
import com.brokerbridge.engine.market.MarketDataType;
import com.brokerbridge.engine.market.TickDataType;
import com.brokerbridge.engine.order.CancelOutcome;
import com.brokerbridge.engine.order.OrderHandle;
import com.brokerbridge.engine.order.OrderLifecycleManager;
import com.brokerbridge.engine.order.OrderSpec;
import com.brokerbridge.engine.order.OrderState;
import com.brokerbridge.engine.order.TrackedOrder;
import com.brokerbridge.engine.request.PendingRequest;
import com.brokerbridge.engine.request.RequestHandle;
import com.brokerbridge.engine.request.RequestKind;
import com.brokerbridge.engine.request.RequestTracker;
import com.brokerbridge.engine.router.ErrorCodes;
import com.brokerbridge.engine.router.EventRouter;
import com.brokerbridge.engine.router.SessionCallbacks;
import com.brokerbridge.engine.shortrate.FtpShortRateSource;
import com.brokerbridge.engine.shortrate.ShortRateLoader;
import com.brokerbridge.engine.shortrate.ShortRateSource;
import com.brokerbridge.engine.table.SessionTables;
import com.brokerbridge.engine.transport.BrokerTransport;
import com.brokerbridge.engine.transport.CommandGateway;
import com.brokerbridge.engine.transport.CommandType;
import com.brokerbridge.engine.transport.OutboundCommand;
import com.brokerbridge.tables.TableSink;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One connection to a broker gateway and the live tables it feeds.
 *
 * <p>The session owns its transport and every piece of per-connection state: the id sequence,
 * the contract cache, the open requests and the tracked orders. Several sessions can run side by
 * side in one process.</p>
 *
 * <p>Request methods are thread-safe. They return as soon as the command is handed to the
 * transport; results arrive as table rows. Calls that need an answer before returning
 * ({@link #registerContract}, order id allocation in {@link #orderPlace}) wait with a deadline on
 * the caller's thread, never on the event receipt path.</p>
 */
public class BrokerSession {

    private static final Logger log = LoggerFactory.getLogger(BrokerSession.class);

    public static final String ALL_ACCOUNTS = "All";

    static final String ACCOUNT_SUMMARY_TAGS = String.join(",",
            "AccountType", "NetLiquidation", "TotalCashValue", "SettledCash", "AccruedCash", "BuyingPower",
            "EquityWithLoanValue", "PreviousDayEquityWithLoanValue", "GrossPositionValue", "RegTEquity",
            "RegTMargin", "SMA", "InitMarginReq", "MaintMarginReq", "AvailableFunds", "ExcessLiquidity",
            "Cushion", "FullInitMarginReq", "FullMaintMarginReq", "FullAvailableFunds", "FullExcessLiquidity",
            "LookAheadNextChange", "LookAheadInitMarginReq", "LookAheadMaintMarginReq",
            "LookAheadAvailableFunds", "LookAheadExcessLiquidity", "HighestSeverity", "DayTradesRemaining",
            "Leverage", "$LEDGER");

    private static final DateTimeFormatter BROKER_TIME =
            DateTimeFormatter.ofPattern("yyyyMMdd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final SessionConfig config;
    private final String name;
    private final BrokerTransport transport;

    private final SessionTables tables;
    private final RequestIdSequence sequence;
    private final CommandGateway gateway;
    private final RequestTracker tracker;
    private final ContractRegistry contracts;
    private final OrderLifecycleManager orders;
    private final NextValidIdQueue nextValidIds;
    private final OrderIdAllocator orderIds;
    private final EventRouter router;
    private volatile ShortRateLoader shortRates;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CREATED);
    private final List<SessionStateListener> stateListeners = new CopyOnWriteArrayList<>();

    public BrokerSession(SessionConfig config, BrokerTransport transport, TableSink sink) {
        this(config, transport, sink, ClockProvider.system());
    }

    public BrokerSession(SessionConfig config, BrokerTransport transport, TableSink sink, ClockProvider clock) {
        this(config, transport, sink, clock,
                ErrorCodes.fromConfig(ConfigLoader.load().getConfig("broker-error-codes")));
    }

    public BrokerSession(SessionConfig config, BrokerTransport transport, TableSink sink, ClockProvider clock,
                         ErrorCodes errorCodes) {
        this.config = config;
        this.name = config.getName();
        this.transport = transport;

        this.tables = new SessionTables(sink, clock);
        this.sequence = new RequestIdSequence();
        this.gateway = new CommandGateway(name, transport, clock, config.getMaxRequestsPerSecond());
        this.tracker = new RequestTracker(name, sequence, gateway, tables.writer(SessionTables.REQUESTS), clock);
        this.contracts = new ContractRegistry(name, tracker, gateway, config.getContractTimeout());
        this.orders = new OrderLifecycleManager(name, tables, gateway, clock);
        this.nextValidIds = new NextValidIdQueue(name);
        this.orderIds = OrderIdAllocator.create(name, config.getOrderIdStrategy(), nextValidIds, sequence, gateway,
                config.getOrderIdMaxAttempts(), config.getOrderIdAttemptTimeout());
        this.router = new EventRouter(name, tables, tracker, orders, contracts, nextValidIds, errorCodes,
                new Callbacks());
        this.shortRates = new ShortRateLoader(name, new FtpShortRateSource(config.getShortRatesHost(),
                config.getShortRatesUser(), config.getShortRatesTimeout()), tables);

        orders.addListener(this::onOrderStateChanged);
    }

    // ==================== Lifecycle ====================

    /**
     * Open the transport and, if configured, subscribe to the account, order and news feeds and
     * download the short rates.
     *
     * @throws ConnectionException if the transport cannot connect
     * @throws IllegalStateException if the session is already connected or connecting
     */
    public void connect() {
        SessionState current = state.get();
        if (current == SessionState.CONNECTING || current == SessionState.CONNECTED
                || !state.compareAndSet(current, SessionState.CONNECTING)) {
            throw new IllegalStateException("[" + name + "] Session is already " + state.get());
        }
        notifyStateChange(current, SessionState.CONNECTING);

        log.info("[{}] Connecting to {}:{} as client {}", name, config.getHost(), config.getPort(),
                config.getClientId());
        try {
            transport.connect(config.getHost(), config.getPort(), config.getClientId(), router);
        } catch (IOException e) {
            setState(SessionState.DISCONNECTED);
            throw new ConnectionException("[" + name + "] Failed to connect to " + config.getHost() + ":"
                    + config.getPort(), e);
        }

        setState(SessionState.CONNECTED);
        log.info("[{}] Connected (readOnly={}, fa={}, orderIds={})", name, config.isReadOnly(),
                config.isFinancialAdvisor(), orderIds.getStrategy());

        if (config.isSubscribeOnConnect()) {
            subscribe();
        }
        if (config.isDownloadShortRates()) {
            shortRates.loadOnce();
        }
    }

    void setShortRateSource(ShortRateSource source) {
        this.shortRates = new ShortRateLoader(name, source, tables);
    }

    /**
     * Download the short-stock availability files into the {@code short_rates} table. Runs on
     * the caller's thread; a failure is logged, not thrown.
     *
     * @return rows written
     */
    public int loadShortRates() {
        return shortRates.load();
    }

    /**
     * Close the transport. Every open request is failed with a {@link ConnectionException}.
     */
    public void disconnect() {
        if (state.get() != SessionState.CONNECTED && state.get() != SessionState.CONNECTING) {
            return;
        }
        log.info("[{}] Disconnecting", name);
        try {
            transport.disconnect();
        } finally {
            onConnectionLost("disconnected by caller");
        }
    }

    private void onConnectionLost(String reason) {
        SessionState previous = state.getAndSet(SessionState.DISCONNECTED);
        if (previous == SessionState.DISCONNECTED) {
            return;
        }
        notifyStateChange(previous, SessionState.DISCONNECTED);

        ConnectionException cause = new ConnectionException("[" + name + "] Connection lost: " + reason);
        int failed = tracker.failAll(cause);
        nextValidIds.reset(cause);
        if (orderIds instanceof IncrementingOrderIdAllocator incrementing) {
            incrementing.reset();
        }
        router.reset();
        log.warn("[{}] Connection lost ({}), failed {} open requests", name, reason, failed);
    }

    private void subscribe() {
        post(OutboundCommand.builder(CommandType.REQUEST_FAMILY_CODES).build());

        if (config.isFinancialAdvisor()) {
            post(OutboundCommand.builder(CommandType.REQUEST_FA).param("faDataType", FaDataType.GROUPS.getCode())
                    .build());
            post(OutboundCommand.builder(CommandType.REQUEST_FA).param("faDataType", FaDataType.ALIASES.getCode())
                    .build());
            subscribeAccountPnl(ALL_ACCOUNTS, "");
        }

        subscribeAccountSummary(ALL_ACCOUNTS);
        subscribeAccountOverview(ALL_ACCOUNTS);
        subscribeAccountPositions(ALL_ACCOUNTS);

        post(OutboundCommand.builder(CommandType.REQUEST_MANAGED_ACCOUNTS).build());
        post(OutboundCommand.builder(CommandType.REQUEST_NEWS_BULLETINS).param("allMessages", true).build());
        subscribeExecutions();
        post(OutboundCommand.builder(CommandType.REQUEST_NEWS_PROVIDERS).build());

        if (!config.isReadOnly()) {
            post(OutboundCommand.builder(CommandType.REQUEST_COMPLETED_ORDERS).param("apiOnly", false).build());
            post(OutboundCommand.builder(CommandType.REQUEST_OPEN_ORDERS).build());
        }
        log.debug("[{}] Subscribed to session feeds", name);
    }

    // ==================== State ====================

    public String getName() {
        return name;
    }

    public SessionState getState() {
        return state.get();
    }

    public boolean isConnected() {
        return state.get().isConnected() && transport.isConnected();
    }

    public boolean isReadOnly() {
        return config.isReadOnly();
    }

    public SessionConfig getConfig() {
        return config;
    }

    public void addStateListener(SessionStateListener listener) {
        stateListeners.add(listener);
    }

    public void removeStateListener(SessionStateListener listener) {
        stateListeners.remove(listener);
    }

    private void setState(SessionState newState) {
        SessionState oldState = state.getAndSet(newState);
        if (oldState != newState) {
            notifyStateChange(oldState, newState);
        }
    }

    private void notifyStateChange(SessionState oldState, SessionState newState) {
        log.debug("[{}] State {} -> {}", name, oldState, newState);
        for (SessionStateListener listener : stateListeners) {
            try {
                listener.onSessionStateChange(this, oldState, newState);
            } catch (Exception e) {
                log.error("[{}] Error notifying state listener", name, e);
            }
        }
    }

    // ==================== Contracts ====================

    /**
     * Resolve a contract once and cache it for the life of the session.
     *
     * @see ContractRegistry#register(Contract)
     */
    public RegisteredContract registerContract(Contract contract) {
        return contracts.register(contract);
    }

    /**
     * Search instruments by symbol or name. Results go to {@code contracts_matching}.
     */
    public RequestHandle requestContractsMatching(String pattern) {
        return issue(RequestKind.MATCHING_SYMBOLS, null, context("pattern", pattern),
                builder -> builder.param("pattern", pattern));
    }

    // ==================== Market data ====================

    /**
     * Select live, frozen or delayed data for subsequent market data requests.
     */
    public void setMarketDataType(MarketDataType type) {
        send(OutboundCommand.builder(CommandType.SET_MARKET_DATA_TYPE).param("marketDataType", type.getCode())
                .build());
        log.info("[{}] Market data type set to {}", name, type);
    }

    public RequestHandle requestMarketData(RegisteredContract contract) {
        return requestMarketData(contract, "", false);
    }

    /**
     * Subscribe to top-of-book ticks. A snapshot request ends by itself; a subscription stays
     * open until cancelled.
     *
     * @param genericTickList comma-separated generic tick ids, empty for the default set
     */
    public RequestHandle requestMarketData(RegisteredContract contract, String genericTickList, boolean snapshot) {
        return issue(RequestKind.MARKET_DATA, contract.getContract(),
                context("genericTickList", genericTickList, EventRouter.CONTEXT_SNAPSHOT, snapshot),
                builder -> builder.param("genericTickList", genericTickList).param("snapshot", snapshot));
    }

    /**
     * Request historical bars ending at {@code end}. With {@code keepUpToDate} the request keeps
     * streaming the forming bar and stays open until cancelled.
     */
    public RequestHandle requestBarsHistorical(RegisteredContract contract, Instant end, HistoryPeriod period,
                                               BarSize barSize, BarDataType barType, MarketDataType marketDataType,
                                               boolean keepUpToDate) {
        Map<String, Object> context = context("end", formatTime(end), "duration", period.toBrokerString(),
                "barSize", barSize.getCode(), "whatToShow", barType.name());
        context.put(EventRouter.CONTEXT_KEEP_UP_TO_DATE, keepUpToDate);
        return issue(RequestKind.HISTORICAL_BARS, contract.getContract(), context,
                builder -> builder.param("endDateTime", keepUpToDate ? "" : formatTime(end))
                        .param("durationStr", period.toBrokerString())
                        .param("barSizeSetting", barSize.getCode())
                        .param("whatToShow", barType.name())
                        .param("useRth", marketDataType == MarketDataType.FROZEN)
                        .param("formatDate", 2)
                        .param("keepUpToDate", keepUpToDate));
    }

    public RequestHandle requestBarsRealtime(RegisteredContract contract, BarDataType barType) {
        return requestBarsRealtime(contract, barType, 5, MarketDataType.FROZEN);
    }

    /**
     * Subscribe to real-time bars.
     *
     * @param barSizeSeconds bar length in seconds, used to stamp each bar's end time
     */
    public RequestHandle requestBarsRealtime(RegisteredContract contract, BarDataType barType, int barSizeSeconds,
                                             MarketDataType marketDataType) {
        if (barSizeSeconds <= 0) {
            throw new IllegalArgumentException("barSizeSeconds must be positive: " + barSizeSeconds);
        }
        Map<String, Object> context = context("whatToShow", barType.name());
        context.put(EventRouter.CONTEXT_BAR_SIZE_SECONDS, barSizeSeconds);
        return issue(RequestKind.REALTIME_BARS, contract.getContract(), context,
                builder -> builder.param("barSize", barSizeSeconds)
                        .param("whatToShow", barType.name())
                        .param("useRth", marketDataType == MarketDataType.FROZEN));
    }

    public RequestHandle requestTickDataRealtime(RegisteredContract contract, TickDataType tickType) {
        return requestTickDataRealtime(contract, tickType, 0, false);
    }

    /**
     * Subscribe to tick-by-tick data. Rows go to {@code ticks_trade}, {@code ticks_bid_ask} or
     * {@code ticks_mid_point}.
     */
    public RequestHandle requestTickDataRealtime(RegisteredContract contract, TickDataType tickType,
                                                 int numberOfTicks, boolean ignoreSize) {
        return issue(RequestKind.TICK_BY_TICK, contract.getContract(),
                context("tickType", tickType.getRealtimeCode()),
                builder -> builder.param("tickType", tickType.getRealtimeCode())
                        .param("numberOfTicks", numberOfTicks)
                        .param("ignoreSize", ignoreSize));
    }

    /**
     * Request historical tick-by-tick data between {@code start} (exclusive) and {@code end}.
     */
    public RequestHandle requestTickDataHistorical(RegisteredContract contract, Instant start, Instant end,
                                                   TickDataType tickType, int numberOfTicks,
                                                   MarketDataType marketDataType, boolean ignoreSize) {
        return issue(RequestKind.HISTORICAL_TICKS, contract.getContract(),
                context("start", formatTime(start), "end", formatTime(end), "whatToShow",
                        tickType.getHistoricalCode()),
                builder -> builder.param("startDateTime", formatTime(start))
                        .param("endDateTime", formatTime(end))
                        .param("numberOfTicks", numberOfTicks)
                        .param("whatToShow", tickType.getHistoricalCode())
                        .param("useRth", marketDataType.getCode())
                        .param("ignoreSize", ignoreSize));
    }

    // ==================== News ====================

    /**
     * Request historical headlines for a contract.
     *
     * @param providerCodes provider codes joined with '+', or null for every known provider
     */
    public RequestHandle requestNewsHistorical(RegisteredContract contract, String providerCodes, Instant start,
                                               Instant end, int totalResults) {
        String providers = providerCodes != null ? providerCodes : String.join("+", router.getNewsProviders());
        return issue(RequestKind.HISTORICAL_NEWS, contract.getContract(),
                context("providerCodes", providers, "start", formatTime(start), "end", formatTime(end)),
                builder -> builder.param("conId", contract.getContract().getConId())
                        .param("providerCodes", providers)
                        .param("startDateTime", formatTime(start))
                        .param("endDateTime", formatTime(end))
                        .param("totalResults", totalResults));
    }

    public RequestHandle requestNewsArticle(String providerCode, String articleId) {
        return issue(RequestKind.NEWS_ARTICLE, null, context("providerCode", providerCode, "articleId", articleId),
                builder -> builder.param("providerCode", providerCode).param("articleId", articleId));
    }

    // ==================== Accounts ====================

    public RequestHandle requestAccountPnl(String account, String modelCode) {
        requireConnected();
        return subscribeAccountPnl(account, modelCode);
    }

    public RequestHandle requestAccountOverview(String account) {
        requireConnected();
        return subscribeAccountOverview(account);
    }

    public RequestHandle requestAccountPositions(String account) {
        requireConnected();
        return subscribeAccountPositions(account);
    }

    /**
     * @param group an advisor group name, or {@value #ALL_ACCOUNTS}
     */
    public RequestHandle requestAccountSummary(String group) {
        requireConnected();
        return subscribeAccountSummary(group);
    }

    /**
     * Replay today's executions into {@code orders_exec_details}.
     */
    public RequestHandle requestExecutions() {
        requireConnected();
        return subscribeExecutions();
    }

    // Subscriptions opened from the receipt path must not wait on the rate limiter, so they post.

    private RequestHandle subscribeAccountPnl(String account, String modelCode) {
        return open(RequestKind.ACCOUNT_PNL, context("account", account, "modelCode", modelCode), true,
                builder -> builder.param("account", account).param("modelCode", modelCode));
    }

    private RequestHandle subscribeAccountOverview(String account) {
        return open(RequestKind.ACCOUNT_OVERVIEW, context("account", account), true,
                builder -> builder.param("account", account).param("modelCode", "").param("ledgerAndNlv", false));
    }

    private RequestHandle subscribeAccountPositions(String account) {
        return open(RequestKind.ACCOUNT_POSITIONS, context("account", account), true,
                builder -> builder.param("account", account).param("modelCode", ""));
    }

    private RequestHandle subscribeAccountSummary(String group) {
        return open(RequestKind.ACCOUNT_SUMMARY, context("group", group), true,
                builder -> builder.param("group", group).param("tags", ACCOUNT_SUMMARY_TAGS));
    }

    private RequestHandle subscribeExecutions() {
        return open(RequestKind.EXECUTIONS, context(), true, builder -> builder);
    }

    // ==================== Orders ====================

    /**
     * Place an order. The returned handle follows the order through its lifecycle.
     *
     * @throws ReadOnlySessionException on a read-only session, before anything is sent or written
     * @throws com.brokerbridge.engine.error.AllocationTimeoutException if no order id could be obtained
     * @throws ConnectionException if the session is not connected
     */
    public OrderHandle orderPlace(RegisteredContract contract, OrderSpec spec) {
        if (config.isReadOnly()) {
            throw new ReadOnlySessionException("orderPlace");
        }
        requireConnected();

        int orderId = orderIds.nextId();
        TrackedOrder order = orders.create(orderId, contract.getContract(), spec);
        try {
            tracker.openWithId(orderId, RequestKind.ORDER_PLACE, contract.getContract(), spec.toParams());
        } catch (RuntimeException e) {
            orders.markRejected(orderId, e.getMessage());
            throw e;
        }
        try {
            gateway.send(OutboundCommand.builder(CommandType.PLACE_ORDER)
                    .requestId(orderId)
                    .contract(contract.getContract())
                    .params(spec.toParams())
                    .build());
        } catch (BrokerSessionException e) {
            tracker.fail(orderId, e);
            orders.markRejected(orderId, e.getMessage());
            throw e;
        }
        orders.markSubmitted(orderId);
        log.info("[{}] Placed order {}: {} {}", name, orderId, spec, contract.getContract().getSymbol());
        return new OrderHandle(order, contract);
    }

    /**
     * Ask the broker to cancel one order.
     *
     * @throws ReadOnlySessionException on a read-only session
     */
    public CancelOutcome orderCancel(OrderHandle handle) {
        if (config.isReadOnly()) {
            throw new ReadOnlySessionException("orderCancel");
        }
        return orders.cancel(handle.getOrderId());
    }

    /**
     * Cancel every order known to this session. Already terminal orders are reported as such.
     *
     * @throws ReadOnlySessionException on a read-only session
     */
    public List<CancelOutcome> orderCancelAll() {
        if (config.isReadOnly()) {
            throw new ReadOnlySessionException("orderCancelAll");
        }
        List<CancelOutcome> outcomes = orders.cancelAll();
        log.info("[{}] Cancel all: {} orders", name, outcomes.size());
        return outcomes;
    }

    private void onOrderStateChanged(TrackedOrder order, OrderState previous, OrderState current) {
        if (order.isExternal()) {
            return;
        }
        int orderId = order.getOrderId();
        switch (current) {
            case ACKNOWLEDGED, PARTIALLY_FILLED, FILLED, CANCELLED -> tracker.lookup(orderId)
                    .ifPresent(request -> tracker.complete(orderId, current));
            case REJECTED -> tracker.lookup(orderId).ifPresent(request -> tracker.fail(orderId,
                    new UpstreamProtocolException(orderId, order.getRejectCode(),
                            "Order " + orderId + " rejected: " + order.getRejectReason())));
            default -> {
            }
        }
    }

    // ==================== Plumbing ====================

    private interface CommandCustomizer {
        OutboundCommand.Builder customize(OutboundCommand.Builder builder);
    }

    private RequestHandle issue(RequestKind kind, Contract contract, Map<String, Object> context,
                                CommandCustomizer customizer) {
        requireConnected();
        return open(kind, contract, context, false, customizer);
    }

    private RequestHandle open(RequestKind kind, Map<String, Object> context, boolean unthrottled,
                               CommandCustomizer customizer) {
        return open(kind, null, context, unthrottled, customizer);
    }

    private RequestHandle open(RequestKind kind, Contract contract, Map<String, Object> context,
                               boolean unthrottled, CommandCustomizer customizer) {
        PendingRequest request = tracker.open(kind, contract, context);
        OutboundCommand command = customizer.customize(
                OutboundCommand.builder(requestCommand(kind)).requestId(request.getId()).contract(contract)).build();
        try {
            if (unthrottled) {
                gateway.post(command);
            } else {
                gateway.send(command);
            }
        } catch (BrokerSessionException e) {
            tracker.fail(request.getId(), e);
            throw e;
        }
        return new RequestHandle(request, tracker);
    }

    private static CommandType requestCommand(RequestKind kind) {
        return switch (kind) {
            case CONTRACT_DETAILS -> CommandType.REQUEST_CONTRACT_DETAILS;
            case MATCHING_SYMBOLS -> CommandType.REQUEST_MATCHING_SYMBOLS;
            case MARKET_DATA -> CommandType.REQUEST_MARKET_DATA;
            case HISTORICAL_BARS -> CommandType.REQUEST_HISTORICAL_DATA;
            case REALTIME_BARS -> CommandType.REQUEST_REALTIME_BARS;
            case TICK_BY_TICK -> CommandType.REQUEST_TICK_BY_TICK;
            case HISTORICAL_TICKS -> CommandType.REQUEST_HISTORICAL_TICKS;
            case HISTORICAL_NEWS -> CommandType.REQUEST_HISTORICAL_NEWS;
            case NEWS_ARTICLE -> CommandType.REQUEST_NEWS_ARTICLE;
            case ACCOUNT_SUMMARY -> CommandType.REQUEST_ACCOUNT_SUMMARY;
            case ACCOUNT_OVERVIEW -> CommandType.REQUEST_ACCOUNT_UPDATES_MULTI;
            case ACCOUNT_POSITIONS -> CommandType.REQUEST_POSITIONS_MULTI;
            case ACCOUNT_PNL -> CommandType.REQUEST_PNL;
            case EXECUTIONS -> CommandType.REQUEST_EXECUTIONS;
            case ORDER_PLACE -> CommandType.PLACE_ORDER;
        };
    }

    private void send(OutboundCommand command) {
        requireConnected();
        gateway.send(command);
    }

    private void post(OutboundCommand command) {
        gateway.post(command);
    }

    private void requireConnected() {
        if (state.get() != SessionState.CONNECTED) {
            throw new ConnectionException("[" + name + "] Session is not connected (" + state.get() + ")");
        }
    }

    private static Map<String, Object> context(Object... keyValues) {
        Map<String, Object> context = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            context.put((String) keyValues[i], keyValues[i + 1]);
        }
        return context;
    }

    private static String formatTime(Instant instant) {
        return instant == null ? "" : BROKER_TIME.format(instant) + " UTC";
    }

    private final class Callbacks implements SessionCallbacks {

        @Override
        public void onConnectionState(boolean connected, String reason) {
            if (!connected) {
                onConnectionLost(reason);
            } else {
                log.debug("[{}] Transport reports connected", name);
            }
        }

        @Override
        public void onNewAccount(String account) {
            if (!state.get().isConnected()) {
                return;
            }
            log.info("[{}] New managed account {}", name, account);
            subscribeAccountPnl(account, "");
            subscribeAccountOverview(account);
            subscribeAccountPositions(account);
        }

        @Override
        public void onAdvisorGroup(String groupName) {
            if (state.get().isConnected()) {
                subscribeAccountSummary(groupName);
            }
        }
    }

    // ==================== Components ====================

    public RequestTracker getRequestTracker() {
        return tracker;
    }

    public ContractRegistry getContractRegistry() {
        return contracts;
    }

    public OrderLifecycleManager getOrderManager() {
        return orders;
    }

    public OrderIdAllocator getOrderIdAllocator() {
        return orderIds;
    }

    public EventRouter getEventRouter() {
        return router;
    }

    public CommandGateway getCommandGateway() {
        return gateway;
    }

    public SessionTables getTables() {
        return tables;
    }

    // ==================== Metrics ====================

    /**
     * Register this session's meters, tagged with the session name.
     */
    public void bindMetrics(MeterRegistry registry) {
        Tags tags = Tags.of("session", name);

        Gauge.builder("brokerbridge.session.state", this, s -> s.getState().code())
                .tags(tags)
                .description("Session state (0=created, 1=connecting, 2=connected, 3=disconnected)")
                .register(registry);
        Gauge.builder("brokerbridge.requests.open", tracker, RequestTracker::getOpenCount)
                .tags(tags)
                .description("Open requests")
                .register(registry);
        Gauge.builder("brokerbridge.orders.live", orders, OrderLifecycleManager::getLiveOrderCount)
                .tags(tags)
                .description("Orders not yet in a terminal state")
                .register(registry);
        Gauge.builder("brokerbridge.contracts.registered", contracts, ContractRegistry::size)
                .tags(tags)
                .description("Registered contracts")
                .register(registry);

        FunctionCounter.builder("brokerbridge.events.routed.total", router, EventRouter::getEventsRouted)
                .tags(tags)
                .description("Inbound events routed")
                .register(registry);
        FunctionCounter.builder("brokerbridge.events.dropped.total", router, EventRouter::getEventsDropped)
                .tags(tags)
                .description("Inbound events for requests that are not open")
                .register(registry);
        FunctionCounter.builder("brokerbridge.router.failures.total", router, EventRouter::getHandlerFailures)
                .tags(tags)
                .description("Event handler failures")
                .register(registry);
        FunctionCounter.builder("brokerbridge.errors.total", router, EventRouter::getErrorEvents)
                .tags(tags)
                .description("Broker error events")
                .register(registry);
        FunctionCounter.builder("brokerbridge.orders.duplicate_terminal.total", orders,
                        OrderLifecycleManager::getDuplicateTerminalEventCount)
                .tags(tags)
                .description("Repeated terminal order events ignored")
                .register(registry);
        FunctionCounter.builder("brokerbridge.commands.sent.total", gateway, CommandGateway::getCommandsSent)
                .tags(tags)
                .description("Commands sent to the broker")
                .register(registry);

        log.info("[{}] Registered session metrics", name);
    }

    @Override
    public String toString() {
        return "BrokerSession[" + name + " " + state.get() + "]";
    }
}
