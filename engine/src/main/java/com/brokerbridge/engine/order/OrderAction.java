package com.brokerbridge.engine.order;

public enum OrderAction {
    BUY,
    SELL
}
