package com.jobhist.config.testing;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A controllable clock for testing that allows time to be advanced programmatically.
 *
 * <p>Usage:</p>
 * <pre>{@code
 * ControllableClock clock = ControllableClock.atStartOfDay(LocalDate.of(2025, 3, 1), ZoneId.of("UTC"));
 * ClockProvider provider = new ClockProvider(clock);
 *
 * clock.advanceDays(1);
 * assertEquals(LocalDate.of(2025, 3, 2), provider.today());
 * }</pre>
 */
public class ControllableClock extends Clock {

    private final AtomicReference<Instant> currentInstant;
    private final ZoneId zone;

    private ControllableClock(Instant initialInstant, ZoneId zone) {
        this.currentInstant = new AtomicReference<>(initialInstant);
        this.zone = zone;
    }

    /**
     * Create a new ControllableClock at midnight of the given date.
     */
    public static ControllableClock atStartOfDay(LocalDate date, ZoneId zone) {
        return new ControllableClock(date.atStartOfDay(zone).toInstant(), zone);
    }

    /**
     * Advance the clock by the specified duration.
     *
     * @return this clock for chaining
     */
    public ControllableClock advance(Duration duration) {
        currentInstant.updateAndGet(instant -> instant.plus(duration));
        return this;
    }

    /**
     * Advance the clock by the specified number of days.
     *
     * @return this clock for chaining
     */
    public ControllableClock advanceDays(long days) {
        return advance(Duration.ofDays(days));
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new ControllableClock(currentInstant.get(), zone);
    }

    @Override
    public Instant instant() {
        return currentInstant.get();
    }

    @Override
    public long millis() {
        return currentInstant.get().toEpochMilli();
    }

    @Override
    public String toString() {
        return "ControllableClock{instant=" + currentInstant.get() + ", zone=" + zone + "}";
    }
}
