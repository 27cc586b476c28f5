package com.brokerbridge.engine.request;

public enum RequestStatus {
    OPEN,
    COMPLETED,
    CANCELLED,
    ERRORED;

    public boolean isTerminal() {
        return this != OPEN;
    }
}
