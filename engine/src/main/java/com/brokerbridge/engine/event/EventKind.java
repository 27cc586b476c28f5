package com.brokerbridge.engine.event;

/**
 * Kinds of decoded inbound broker events. The {@link com.brokerbridge.engine.router.EventRouter}
 * dispatches on this tag.
 */
public enum EventKind {
    CONNECTION_STATE,
    NEXT_VALID_ID,
    ERROR,
    REQUEST_END,

    CONTRACT_DETAILS,
    SYMBOL_SAMPLE,
    MARKET_RULE,

    TICK_PRICE,
    TICK_SIZE,
    TICK_STRING,
    TICK_GENERIC,
    TICK_OPTION_COMPUTATION,
    TRADE_TICK,
    BID_ASK_TICK,
    MID_POINT_TICK,
    HISTORICAL_BAR,
    REALTIME_BAR,

    ACCOUNT_VALUE,
    ACCOUNT_SUMMARY,
    POSITION,
    PNL,
    MANAGED_ACCOUNTS,
    FAMILY_CODE,
    FINANCIAL_ADVISOR_DATA,

    NEWS_PROVIDER,
    NEWS_BULLETIN,
    NEWS_ARTICLE,
    HISTORICAL_NEWS,

    OPEN_ORDER,
    COMPLETED_ORDER,
    ORDER_STATUS,
    EXECUTION,
    COMMISSION_REPORT
}
