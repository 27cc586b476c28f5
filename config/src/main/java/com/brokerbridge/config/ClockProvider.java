package com.brokerbridge.config;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Source of time for a broker session.
 *
 * <p>Every row written to a live table is stamped with a receipt instant taken from
 * this provider at translation time. Request creation times and order update times
 * use it as well, so a session driven by a fixed or controllable clock is fully
 * deterministic.</p>
 *
 * <pre>{@code
 * // Production
 * ClockProvider clock = ClockProvider.system();
 *
 * // Tests
 * ClockProvider clock = ClockProvider.of(ControllableClock.createUtc(Instant.parse("2024-01-15T14:30:00Z")));
 * }</pre>
 */
public class ClockProvider {

    private final Clock clock;
    private final NanoTimeSource nanoTimeSource;

    /**
     * Functional interface for providing high-resolution elapsed time.
     */
    @FunctionalInterface
    public interface NanoTimeSource {
        long nanoTime();
    }

    public ClockProvider(Clock clock, NanoTimeSource nanoTimeSource) {
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        if (nanoTimeSource == null) {
            throw new IllegalArgumentException("NanoTimeSource cannot be null");
        }
        this.clock = clock;
        this.nanoTimeSource = nanoTimeSource;
    }

    /**
     * System UTC clock with {@link System#nanoTime()} for elapsed time.
     */
    public static ClockProvider system() {
        return new ClockProvider(Clock.systemUTC(), System::nanoTime);
    }

    /**
     * Wrap an arbitrary clock, e.g. a {@code ControllableClock} in tests.
     */
    public static ClockProvider of(Clock clock) {
        return new ClockProvider(clock, System::nanoTime);
    }

    /**
     * Clock that always returns the same instant.
     */
    public static ClockProvider fixed(Instant fixedInstant) {
        return new ClockProvider(Clock.fixed(fixedInstant, ZoneId.of("UTC")), System::nanoTime);
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * The instant used to stamp received events.
     */
    public Instant instant() {
        return clock.instant();
    }

    public long currentTimeMillis() {
        return clock.millis();
    }

    /**
     * High-resolution time for measuring elapsed durations, not wall-clock time.
     */
    public long nanoTime() {
        return nanoTimeSource.nanoTime();
    }

    public ZoneId getZone() {
        return clock.getZone();
    }

    @Override
    public String toString() {
        return "ClockProvider{clock=" + clock + "}";
    }
}
