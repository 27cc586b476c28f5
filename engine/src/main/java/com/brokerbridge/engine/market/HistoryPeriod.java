package com.brokerbridge.engine.market;

/**
 * How far back a historical query reaches, in the broker's {@code "<n> <unit>"} form.
 */
public record HistoryPeriod(int amount, Unit unit) {

    public enum Unit {
        SECONDS("S"),
        DAYS("D"),
        WEEKS("W"),
        MONTHS("M"),
        YEARS("Y");

        private final String code;

        Unit(String code) {
            this.code = code;
        }
    }

    public HistoryPeriod {
        if (amount <= 0) {
            throw new IllegalArgumentException("History period must be positive: " + amount);
        }
    }

    public static HistoryPeriod seconds(int amount) {
        return new HistoryPeriod(amount, Unit.SECONDS);
    }

    public static HistoryPeriod days(int amount) {
        return new HistoryPeriod(amount, Unit.DAYS);
    }

    public static HistoryPeriod weeks(int amount) {
        return new HistoryPeriod(amount, Unit.WEEKS);
    }

    public static HistoryPeriod months(int amount) {
        return new HistoryPeriod(amount, Unit.MONTHS);
    }

    public static HistoryPeriod years(int amount) {
        return new HistoryPeriod(amount, Unit.YEARS);
    }

    public String toBrokerString() {
        return amount + " " + unit.code;
    }
}
