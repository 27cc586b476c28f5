package com.brokerbridge.engine.market;

import java.time.Duration;

public enum BarSize {
    SEC_1("1 sec", Duration.ofSeconds(1)),
    SEC_5("5 secs", Duration.ofSeconds(5)),
    SEC_15("15 secs", Duration.ofSeconds(15)),
    SEC_30("30 secs", Duration.ofSeconds(30)),
    MIN_1("1 min", Duration.ofMinutes(1)),
    MIN_2("2 mins", Duration.ofMinutes(2)),
    MIN_3("3 mins", Duration.ofMinutes(3)),
    MIN_5("5 mins", Duration.ofMinutes(5)),
    MIN_15("15 mins", Duration.ofMinutes(15)),
    MIN_30("30 mins", Duration.ofMinutes(30)),
    HOUR_1("1 hour", Duration.ofHours(1)),
    DAY_1("1 day", Duration.ofDays(1));

    private final String code;
    private final Duration length;

    BarSize(String code, Duration length) {
        this.code = code;
        this.length = length;
    }

    /**
     * The broker's bar size setting, e.g. {@code "5 mins"}.
     */
    public String getCode() {
        return code;
    }

    public Duration getLength() {
        return length;
    }
}
