package com.brokerbridge.engine.event;

import java.util.List;

public record MarketRuleEvent(int marketRuleId, List<PriceIncrement> increments) implements BrokerEvent {

    /**
     * Minimum price increment {@code increment} applies from price {@code lowEdge} up.
     */
    public record PriceIncrement(double lowEdge, double increment) {
    }

    @Override
    public EventKind kind() {
        return EventKind.MARKET_RULE;
    }
}
