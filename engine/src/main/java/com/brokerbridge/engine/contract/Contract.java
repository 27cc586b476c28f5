package com.brokerbridge.engine.contract;

import java.util.Objects;

/**
 * Immutable description of a tradable instrument.
 *
 * <p>Two contracts are equivalent when their {@link ContractKey}s are equal, i.e. when
 * all identity fields match after normalization. A contract only needs enough fields
 * for the broker to find a unique instrument, for example
 * {@code symbol=AAPL, secType=STK, exchange=SMART, currency=USD}.</p>
 */
public final class Contract {

    private final int conId;
    private final String symbol;
    private final String secType;
    private final String lastTradeDateOrContractMonth;
    private final double strike;
    private final String right;
    private final String multiplier;
    private final String exchange;
    private final String primaryExchange;
    private final String currency;
    private final String localSymbol;
    private final String tradingClass;

    private Contract(Builder builder) {
        this.conId = builder.conId;
        this.symbol = builder.symbol;
        this.secType = builder.secType;
        this.lastTradeDateOrContractMonth = builder.lastTradeDateOrContractMonth;
        this.strike = builder.strike;
        this.right = builder.right;
        this.multiplier = builder.multiplier;
        this.exchange = builder.exchange;
        this.primaryExchange = builder.primaryExchange;
        this.currency = builder.currency;
        this.localSymbol = builder.localSymbol;
        this.tradingClass = builder.tradingClass;
    }

    /**
     * @return the broker's contract id, or 0 if not known
     */
    public int getConId() {
        return conId;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getSecType() {
        return secType;
    }

    public String getLastTradeDateOrContractMonth() {
        return lastTradeDateOrContractMonth;
    }

    public double getStrike() {
        return strike;
    }

    public String getRight() {
        return right;
    }

    public String getMultiplier() {
        return multiplier;
    }

    public String getExchange() {
        return exchange;
    }

    public String getPrimaryExchange() {
        return primaryExchange;
    }

    public String getCurrency() {
        return currency;
    }

    public String getLocalSymbol() {
        return localSymbol;
    }

    public String getTradingClass() {
        return tradingClass;
    }

    public ContractKey key() {
        return ContractKey.of(this);
    }

    public Builder toBuilder() {
        return builder()
                .conId(conId)
                .symbol(symbol)
                .secType(secType)
                .lastTradeDateOrContractMonth(lastTradeDateOrContractMonth)
                .strike(strike)
                .right(right)
                .multiplier(multiplier)
                .exchange(exchange)
                .primaryExchange(primaryExchange)
                .currency(currency)
                .localSymbol(localSymbol)
                .tradingClass(tradingClass);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shorthand for a stock routed through the broker's smart router.
     */
    public static Contract stock(String symbol, String currency) {
        return builder().symbol(symbol).secType("STK").exchange("SMART").currency(currency).build();
    }

    public static class Builder {
        private int conId;
        private String symbol;
        private String secType;
        private String lastTradeDateOrContractMonth;
        private double strike;
        private String right;
        private String multiplier;
        private String exchange;
        private String primaryExchange;
        private String currency;
        private String localSymbol;
        private String tradingClass;

        public Builder conId(int conId) {
            this.conId = conId;
            return this;
        }

        public Builder symbol(String symbol) {
            this.symbol = symbol;
            return this;
        }

        public Builder secType(String secType) {
            this.secType = secType;
            return this;
        }

        public Builder lastTradeDateOrContractMonth(String lastTradeDateOrContractMonth) {
            this.lastTradeDateOrContractMonth = lastTradeDateOrContractMonth;
            return this;
        }

        public Builder strike(double strike) {
            this.strike = strike;
            return this;
        }

        public Builder right(String right) {
            this.right = right;
            return this;
        }

        public Builder multiplier(String multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public Builder exchange(String exchange) {
            this.exchange = exchange;
            return this;
        }

        public Builder primaryExchange(String primaryExchange) {
            this.primaryExchange = primaryExchange;
            return this;
        }

        public Builder currency(String currency) {
            this.currency = currency;
            return this;
        }

        public Builder localSymbol(String localSymbol) {
            this.localSymbol = localSymbol;
            return this;
        }

        public Builder tradingClass(String tradingClass) {
            this.tradingClass = tradingClass;
            return this;
        }

        public Contract build() {
            return new Contract(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Contract)) {
            return false;
        }
        return key().equals(((Contract) o).key());
    }

    @Override
    public int hashCode() {
        return key().hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Contract[");
        if (conId != 0) {
            sb.append("conId=").append(conId).append(", ");
        }
        sb.append(symbol).append(' ').append(secType);
        if (lastTradeDateOrContractMonth != null) {
            sb.append(' ').append(lastTradeDateOrContractMonth);
        }
        if (strike != 0) {
            sb.append(' ').append(strike);
        }
        if (right != null) {
            sb.append(' ').append(right);
        }
        sb.append(" @").append(Objects.toString(exchange, "?"))
                .append(' ').append(Objects.toString(currency, "?"))
                .append(']');
        return sb.toString();
    }
}
