package com.brokerbridge.engine.market;

/**
 * Tick-by-tick data kinds.
 */
public enum TickDataType {
    LAST("Last", "TRADES"),
    BID_ASK("BidAsk", "BID_ASK"),
    MIDPOINT("MidPoint", "MIDPOINT");

    private final String realtimeCode;
    private final String historicalCode;

    TickDataType(String realtimeCode, String historicalCode) {
        this.realtimeCode = realtimeCode;
        this.historicalCode = historicalCode;
    }

    public String getRealtimeCode() {
        return realtimeCode;
    }

    /**
     * The broker names trade ticks differently in historical queries.
     */
    public String getHistoricalCode() {
        return historicalCode;
    }
}
