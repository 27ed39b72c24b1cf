package com.jobhist.stream.window;

import java.time.LocalDate;

/**
 * The unresolved date arguments of a query, as supplied by the caller.
 *
 * <p>Either an explicit range ({@code rangeStart} and {@code rangeEnd}, which
 * may be the same day), or an anchor day with a number of days to look back.
 * Missing values fall back to today and zero days.</p>
 *
 * <pre>{@code
 * WindowIntent lastWeek = WindowIntent.builder().daysBack(7).build();
 * WindowIntent march = WindowIntent.builder()
 *         .range(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 31))
 *         .direction(ReadDirection.REVERSE)
 *         .build();
 * }</pre>
 */
public final class WindowIntent {

    private final LocalDate rangeStart;
    private final LocalDate rangeEnd;
    private final LocalDate anchor;
    private final Integer daysBack;
    private final ReadDirection direction;

    private WindowIntent(Builder builder) {
        this.rangeStart = builder.rangeStart;
        this.rangeEnd = builder.rangeEnd;
        this.anchor = builder.anchor;
        this.daysBack = builder.daysBack;
        this.direction = builder.direction;
    }

    /**
     * Today only, read forward.
     */
    public static WindowIntent today() {
        return builder().build();
    }

    public boolean hasRange() {
        return rangeStart != null;
    }

    public LocalDate getRangeStart() {
        return rangeStart;
    }

    public LocalDate getRangeEnd() {
        return rangeEnd;
    }

    /**
     * @return the anchor day, or {@code null} for today
     */
    public LocalDate getAnchor() {
        return anchor;
    }

    /**
     * @return days to look back from the anchor, or {@code null} if not given
     */
    public Integer getDaysBack() {
        return daysBack;
    }

    public ReadDirection getDirection() {
        return direction;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private LocalDate rangeStart;
        private LocalDate rangeEnd;
        private LocalDate anchor;
        private Integer daysBack;
        private ReadDirection direction = ReadDirection.FORWARD;

        private Builder() {}

        public Builder range(LocalDate start, LocalDate end) {
            if (start == null || end == null) {
                throw new IllegalArgumentException("Range needs both start and end");
            }
            this.rangeStart = start;
            this.rangeEnd = end;
            return this;
        }

        public Builder day(LocalDate day) {
            return range(day, day);
        }

        public Builder anchor(LocalDate anchor) {
            this.anchor = anchor;
            return this;
        }

        public Builder daysBack(Integer daysBack) {
            this.daysBack = daysBack;
            return this;
        }

        public Builder direction(ReadDirection direction) {
            this.direction = direction;
            return this;
        }

        public WindowIntent build() {
            return new WindowIntent(this);
        }
    }

    @Override
    public String toString() {
        return "WindowIntent{" +
                "rangeStart=" + rangeStart +
                ", rangeEnd=" + rangeEnd +
                ", anchor=" + anchor +
                ", daysBack=" + daysBack +
                ", direction=" + direction +
                '}';
    }
}
