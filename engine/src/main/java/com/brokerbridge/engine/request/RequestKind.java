package com.brokerbridge.engine.request;

import com.brokerbridge.engine.transport.CommandType;

/**
 * Kinds of tracked requests.
 *
 * <p>Streaming kinds stay open until cancelled; the others complete when the broker
 * signals the end of the data. A kind with a cancel command can be cancelled upstream.</p>
 */
public enum RequestKind {
    CONTRACT_DETAILS("ContractDetails", false, null),
    MATCHING_SYMBOLS("MatchingSymbols", false, null),
    MARKET_DATA("MarketData", true, CommandType.CANCEL_MARKET_DATA),
    HISTORICAL_BARS("HistoricalData", false, CommandType.CANCEL_HISTORICAL_DATA),
    REALTIME_BARS("RealTimeBars", true, CommandType.CANCEL_REALTIME_BARS),
    TICK_BY_TICK("TickByTickData", true, CommandType.CANCEL_TICK_BY_TICK),
    HISTORICAL_TICKS("HistoricalTicks", false, null),
    HISTORICAL_NEWS("HistoricalNews", false, null),
    NEWS_ARTICLE("NewsArticle", false, null),
    ACCOUNT_SUMMARY("AccountSummary", true, CommandType.CANCEL_ACCOUNT_SUMMARY),
    ACCOUNT_OVERVIEW("AccountUpdatesMulti", true, CommandType.CANCEL_ACCOUNT_UPDATES_MULTI),
    ACCOUNT_POSITIONS("PositionsMulti", true, CommandType.CANCEL_POSITIONS_MULTI),
    ACCOUNT_PNL("Pnl", true, CommandType.CANCEL_PNL),
    EXECUTIONS("Executions", false, null),
    ORDER_PLACE("PlaceOrder", false, null);

    private final String displayName;
    private final boolean streaming;
    private final CommandType cancelCommand;

    RequestKind(String displayName, boolean streaming, CommandType cancelCommand) {
        this.displayName = displayName;
        this.streaming = streaming;
        this.cancelCommand = cancelCommand;
    }

    /**
     * Name written to the {@code RequestType} column of the requests table.
     */
    public String getDisplayName() {
        return displayName;
    }

    public boolean isStreaming() {
        return streaming;
    }

    public CommandType getCancelCommand() {
        return cancelCommand;
    }

    public boolean isCancellable() {
        return cancelCommand != null;
    }
}
