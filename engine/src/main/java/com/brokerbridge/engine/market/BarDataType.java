package com.brokerbridge.engine.market;

public enum BarDataType {
    TRADES,
    MIDPOINT,
    BID,
    ASK,
    BID_ASK,
    ADJUSTED_LAST,
    HISTORICAL_VOLATILITY,
    OPTION_IMPLIED_VOLATILITY,
    FEE_RATE,
    REBATE_RATE
}
