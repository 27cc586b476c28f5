package com.brokerbridge.engine.order;

public enum TimeInForce {
    DAY,
    GTC,
    IOC,
    FOK,
    OPG
}
