package com.brokerbridge.engine.market;

/**
 * What market data the broker sends outside live streaming conditions.
 */
public enum MarketDataType {
    /** Live data */
    REAL_TIME(1),
    /** Live during regular trading hours, last values after the close */
    FROZEN(2),
    DELAYED(3),
    DELAYED_FROZEN(4);

    private final int code;

    MarketDataType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
