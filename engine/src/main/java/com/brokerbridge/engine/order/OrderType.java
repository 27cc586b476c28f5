package com.brokerbridge.engine.order;

/**
 * Order types, with the broker's code for each.
 */
public enum OrderType {
    MARKET("MKT", false, false),
    LIMIT("LMT", true, false),
    STOP("STP", false, true),
    STOP_LIMIT("STP LMT", true, true),
    MARKET_ON_CLOSE("MOC", false, false),
    LIMIT_ON_CLOSE("LOC", true, false);

    private final String code;
    private final boolean needsLimitPrice;
    private final boolean needsAuxPrice;

    OrderType(String code, boolean needsLimitPrice, boolean needsAuxPrice) {
        this.code = code;
        this.needsLimitPrice = needsLimitPrice;
        this.needsAuxPrice = needsAuxPrice;
    }

    public String getCode() {
        return code;
    }

    public boolean needsLimitPrice() {
        return needsLimitPrice;
    }

    /**
     * Stop types carry their trigger price in the aux price.
     */
    public boolean needsAuxPrice() {
        return needsAuxPrice;
    }
}
