package com.jobhist.config;

import com.typesafe.config.Config;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Provider for the wall clock and time zone used to interpret accounting logs.
 *
 * <p>Log timestamps carry no zone, and "today" decides both the default query
 * window and which dates count as the future. Both therefore come from one
 * clock, which tests replace with {@link Clock#fixed(Instant, ZoneId)} or a
 * {@link com.jobhist.config.testing.ControllableClock}.</p>
 *
 * <p>Usage:</p>
 * <pre>{@code
 * // Production - use system clock in the configured zone
 * ClockProvider clockProvider = ClockProvider.fromConfig(config.getConfig("jobhist"));
 *
 * // Testing - use fixed clock
 * ClockProvider testClock = ClockProvider.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneId.of("UTC"));
 *
 * LocalDate today = clockProvider.today();
 * }</pre>
 */
public class ClockProvider {

    private final Clock clock;

    /**
     * Create a ClockProvider with the given clock.
     *
     * @param clock the java.time.Clock for wall-clock time
     */
    public ClockProvider(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        this.clock = clock;
    }

    /**
     * Create a system ClockProvider in the system default zone.
     */
    public static ClockProvider system() {
        return new ClockProvider(Clock.systemDefaultZone());
    }

    /**
     * Create a system ClockProvider in the given zone.
     */
    public static ClockProvider system(ZoneId zone) {
        return new ClockProvider(Clock.system(zone));
    }

    /**
     * Create a fixed ClockProvider for testing that always returns the same instant.
     *
     * @param fixedInstant the instant to return
     * @param zone the time zone
     * @return a ClockProvider fixed at the given instant
     */
    public static ClockProvider fixed(Instant fixedInstant, ZoneId zone) {
        return new ClockProvider(Clock.fixed(fixedInstant, zone));
    }

    /**
     * Create a system ClockProvider from the {@code time-zone} setting of the
     * given config ({@code "system"} selects the JVM default zone).
     *
     * @param config the {@code jobhist} config section
     */
    public static ClockProvider fromConfig(Config config) {
        return system(parseZone(config.getString("time-zone")));
    }

    /**
     * Parse a zone setting, accepting {@code "system"} for the JVM default.
     *
     * @throws java.time.DateTimeException if the zone id is not valid
     */
    public static ZoneId parseZone(String zone) {
        if (zone == null || zone.isBlank() || "system".equalsIgnoreCase(zone)) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(zone);
    }

    /**
     * Get the current calendar date in this clock's zone.
     */
    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Get the time zone of this clock.
     */
    public ZoneId getZone() {
        return clock.getZone();
    }

    @Override
    public String toString() {
        return "ClockProvider{clock=" + clock + "}";
    }
}
