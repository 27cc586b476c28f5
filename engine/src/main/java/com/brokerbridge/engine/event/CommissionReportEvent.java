package com.brokerbridge.engine.event;

public record CommissionReportEvent(String execId, double commission, String currency, double realizedPnl)
        implements BrokerEvent {

    @Override
    public EventKind kind() {
        return EventKind.COMMISSION_REPORT;
    }
}
