package com.jobhist.stream.window;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An inclusive {@code [start, end]} range of calendar days plus the order in
 * which they are read. Produced once per query by {@link WindowResolver}.
 *
 * @param start     first day (inclusive)
 * @param end       last day (inclusive), never before {@code start}
 * @param direction read order
 */
public record DateWindow(LocalDate start, LocalDate end, ReadDirection direction) {

    public DateWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(direction, "direction");
        if (start.isAfter(end)) {
            throw new InvalidWindowException("Window start " + start + " is after end " + end);
        }
    }

    /**
     * A single-day window read forward.
     */
    public static DateWindow of(LocalDate day) {
        return new DateWindow(day, day, ReadDirection.FORWARD);
    }

    /**
     * Number of days in the window.
     */
    public long length() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    public boolean contains(LocalDate day) {
        return !day.isBefore(start) && !day.isAfter(end);
    }

    /**
     * The day read first: {@code start} forward, {@code end} in reverse.
     */
    public LocalDate firstDay() {
        return direction == ReadDirection.FORWARD ? start : end;
    }

    /**
     * The day read after {@code day}.
     *
     * @return the following day in read order, or {@code null} after the last day
     */
    public LocalDate nextDay(LocalDate day) {
        if (direction == ReadDirection.FORWARD) {
            return day.isBefore(end) ? day.plusDays(1) : null;
        }
        return day.isAfter(start) ? day.minusDays(1) : null;
    }

    /**
     * The days of the window in read order: oldest first for
     * {@link ReadDirection#FORWARD}, newest first for {@link ReadDirection#REVERSE}.
     * Builds the whole list; streaming code walks {@link #firstDay()} and
     * {@link #nextDay(LocalDate)} instead.
     */
    public List<LocalDate> days() {
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate day = firstDay(); day != null; day = nextDay(day)) {
            days.add(day);
        }
        return days;
    }

    public DateWindow withDirection(ReadDirection direction) {
        return new DateWindow(start, end, direction);
    }

    @Override
    public String toString() {
        return DateTimeFormatter.ISO_LOCAL_DATE.format(start) + ".."
                + DateTimeFormatter.ISO_LOCAL_DATE.format(end) + " " + direction;
    }
}
