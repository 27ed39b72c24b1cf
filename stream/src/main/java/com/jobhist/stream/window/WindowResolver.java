package com.jobhist.stream.window;

import com.jobhist.config.ClockProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;

/**
 * Turns a {@link WindowIntent} into a concrete {@link DateWindow}.
 *
 * <p>An explicit range is used as given. Otherwise the window is
 * {@code [anchor - daysBack, anchor]}: {@code daysBack} whole days before the
 * anchor plus the anchor itself, so {@code daysBack = 0} is the anchor day
 * alone and an anchor of 2025-03-01 with {@code daysBack = 4} covers
 * 2025-02-25 through 2025-03-01. The anchor defaults to today and
 * {@code daysBack} to zero.</p>
 *
 * <p>"Today" is read from the clock once, when the resolver is created, so
 * every window of one run agrees on it. A window whose end lies after today
 * is rejected.</p>
 */
public class WindowResolver {

    private static final Logger log = LoggerFactory.getLogger(WindowResolver.class);

    private final LocalDate today;

    public WindowResolver(ClockProvider clockProvider) {
        this.today = clockProvider.today();
    }

    /**
     * The date this resolver treats as today.
     */
    public LocalDate getToday() {
        return today;
    }

    /**
     * Resolve an intent.
     *
     * @throws InvalidWindowException if the window is empty, has a negative
     *         day count, or ends after today
     */
    public DateWindow resolve(WindowIntent intent) {
        LocalDate start;
        LocalDate end;
        if (intent.hasRange()) {
            start = intent.getRangeStart();
            end = intent.getRangeEnd();
        } else {
            int daysBack = intent.getDaysBack() != null ? intent.getDaysBack() : 0;
            if (daysBack < 0) {
                throw new InvalidWindowException("Day count must not be negative: " + daysBack);
            }
            end = intent.getAnchor() != null ? intent.getAnchor() : today;
            start = end.minusDays(daysBack);
        }
        if (start.isAfter(end)) {
            throw new InvalidWindowException("Window start " + start + " is after end " + end);
        }
        if (end.isAfter(today)) {
            throw new InvalidWindowException("Window end " + end + " is in the future (today is " + today + ")");
        }
        DateWindow window = new DateWindow(start, end, intent.getDirection());
        log.debug("Resolved {} to {}", intent, window);
        return window;
    }

    /**
     * Resolve an anchor and day count, read forward.
     */
    public DateWindow resolve(LocalDate anchor, int daysBack) {
        return resolve(WindowIntent.builder().anchor(anchor).daysBack(daysBack).build());
    }
}
