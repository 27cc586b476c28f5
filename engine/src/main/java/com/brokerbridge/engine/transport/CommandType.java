package com.brokerbridge.engine.transport;

/**
 * Decoded outbound commands understood by a {@link BrokerTransport}.
 */
public enum CommandType {
    REQUEST_IDS,
    REQUEST_CONTRACT_DETAILS,
    REQUEST_MATCHING_SYMBOLS,
    REQUEST_MARKET_RULE,
    SET_MARKET_DATA_TYPE,

    REQUEST_MARKET_DATA,
    CANCEL_MARKET_DATA,
    REQUEST_HISTORICAL_DATA,
    CANCEL_HISTORICAL_DATA,
    REQUEST_REALTIME_BARS,
    CANCEL_REALTIME_BARS,
    REQUEST_TICK_BY_TICK,
    CANCEL_TICK_BY_TICK,
    REQUEST_HISTORICAL_TICKS,

    REQUEST_HISTORICAL_NEWS,
    REQUEST_NEWS_ARTICLE,
    REQUEST_NEWS_PROVIDERS,
    REQUEST_NEWS_BULLETINS,

    REQUEST_ACCOUNT_SUMMARY,
    CANCEL_ACCOUNT_SUMMARY,
    REQUEST_ACCOUNT_UPDATES_MULTI,
    CANCEL_ACCOUNT_UPDATES_MULTI,
    REQUEST_POSITIONS_MULTI,
    CANCEL_POSITIONS_MULTI,
    REQUEST_PNL,
    CANCEL_PNL,
    REQUEST_MANAGED_ACCOUNTS,
    REQUEST_FAMILY_CODES,
    REQUEST_FA,

    REQUEST_EXECUTIONS,
    REQUEST_OPEN_ORDERS,
    REQUEST_COMPLETED_ORDERS,
    PLACE_ORDER,
    CANCEL_ORDER
}
