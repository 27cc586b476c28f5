package com.brokerbridge.engine.event;

/**
 * Financial-advisor account structure, delivered as XML.
 */
public record FinancialAdvisorDataEvent(FaDataType dataType, String xml) implements BrokerEvent {

    public enum FaDataType {
        GROUPS(1),
        PROFILES(2),
        ALIASES(3);

        private final int code;

        FaDataType(int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }

    @Override
    public EventKind kind() {
        return EventKind.FINANCIAL_ADVISOR_DATA;
    }
}
