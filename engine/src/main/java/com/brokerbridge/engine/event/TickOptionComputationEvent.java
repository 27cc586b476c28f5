package com.brokerbridge.engine.event;

public record TickOptionComputationEvent(int requestId, String tickType, String tickAttrib, double impliedVol,
                                         double delta, double optPrice, double pvDividend, double gamma,
                                         double vega, double theta, double undPrice) implements RequestScopedEvent {

    @Override
    public EventKind kind() {
        return EventKind.TICK_OPTION_COMPUTATION;
    }
}
