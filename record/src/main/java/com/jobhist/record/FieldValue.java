package com.jobhist.record;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * An immutable, typed field value: one of {@link FieldKind}'s variants plus the
 * raw text it was read from.
 *
 * <p>A value whose coercion failed is kept as {@link FieldKind#TEXT} with
 * {@link #isCoerced()} returning {@code false}, so the record still carries
 * what was logged. Such values never satisfy a typed comparison.</p>
 *
 * <p>Canonical representations:</p>
 * <ul>
 *   <li>{@code INTEGER} - {@code Long}</li>
 *   <li>{@code FLOAT} - {@code Double}</li>
 *   <li>{@code DURATION} - {@link Duration}</li>
 *   <li>{@code MEMORY} - {@code Long} bytes</li>
 *   <li>{@code TIMESTAMP} - {@link LocalDateTime}</li>
 *   <li>{@code TEXT} - {@code String}</li>
 * </ul>
 */
public final class FieldValue implements Comparable<FieldValue> {

    private final FieldKind kind;
    private final Object value;
    private final String raw;
    private final boolean coerced;

    private FieldValue(FieldKind kind, Object value, String raw, boolean coerced) {
        this.kind = kind;
        this.value = Objects.requireNonNull(value, "value");
        this.raw = Objects.requireNonNull(raw, "raw");
        this.coerced = coerced;
    }

    public static FieldValue ofInteger(String raw, long value) {
        return new FieldValue(FieldKind.INTEGER, value, raw, true);
    }

    public static FieldValue ofFloat(String raw, double value) {
        return new FieldValue(FieldKind.FLOAT, value, raw, true);
    }

    public static FieldValue ofDuration(String raw, Duration value) {
        return new FieldValue(FieldKind.DURATION, value, raw, true);
    }

    public static FieldValue ofMemory(String raw, long bytes) {
        return new FieldValue(FieldKind.MEMORY, bytes, raw, true);
    }

    public static FieldValue ofTimestamp(String raw, LocalDateTime value) {
        return new FieldValue(FieldKind.TIMESTAMP, value, raw, true);
    }

    public static FieldValue ofText(String raw) {
        return new FieldValue(FieldKind.TEXT, raw, raw, true);
    }

    /**
     * A value kept as raw text because it could not be read as its field's kind.
     */
    public static FieldValue uncoerced(String raw) {
        return new FieldValue(FieldKind.TEXT, raw, raw, false);
    }

    public FieldKind kind() {
        return kind;
    }

    /**
     * The canonical value (see class docs for the Java type per kind).
     */
    public Object value() {
        return value;
    }

    /**
     * The text this value was read from, exactly as logged.
     */
    public String raw() {
        return raw;
    }

    /**
     * Whether the raw text was successfully read as its declared kind.
     */
    public boolean isCoerced() {
        return coerced;
    }

    public long asLong() {
        requireKind(FieldKind.INTEGER);
        return (Long) value;
    }

    public double asDouble() {
        requireKind(FieldKind.FLOAT);
        return (Double) value;
    }

    public Duration asDuration() {
        requireKind(FieldKind.DURATION);
        return (Duration) value;
    }

    public long asBytes() {
        requireKind(FieldKind.MEMORY);
        return (Long) value;
    }

    public LocalDateTime asTimestamp() {
        requireKind(FieldKind.TIMESTAMP);
        return (LocalDateTime) value;
    }

    /**
     * The text form: the canonical string for {@code TEXT}, the raw text otherwise.
     */
    public String asText() {
        return kind == FieldKind.TEXT ? (String) value : raw;
    }

    /**
     * The value as a number for aggregation: the integer or float itself,
     * seconds for durations, bytes for memory.
     *
     * @throws IllegalStateException if the kind is not numeric
     */
    public double numericValue() {
        return switch (kind) {
            case INTEGER, MEMORY -> (Long) value;
            case FLOAT -> (Double) value;
            case DURATION -> ((Duration) value).getSeconds();
            default -> throw new IllegalStateException("Not a numeric value: " + kind + " '" + raw + "'");
        };
    }

    /**
     * Compare with another value of the same kind.
     *
     * @throws IllegalArgumentException if the kinds differ
     */
    @Override
    public int compareTo(FieldValue other) {
        if (other.kind != kind) {
            throw new IllegalArgumentException("Cannot compare " + kind + " with " + other.kind);
        }
        return switch (kind) {
            case INTEGER, MEMORY -> Long.compare((Long) value, (Long) other.value);
            case FLOAT -> Double.compare((Double) value, (Double) other.value);
            case DURATION -> ((Duration) value).compareTo((Duration) other.value);
            case TIMESTAMP -> ((LocalDateTime) value).compareTo((LocalDateTime) other.value);
            case TEXT -> ((String) value).compareTo((String) other.value);
        };
    }

    private void requireKind(FieldKind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Expected " + expected + " but value is " + kind + " '" + raw + "'");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldValue other)) return false;
        return kind == other.kind && coerced == other.coerced && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, coerced);
    }

    @Override
    public String toString() {
        return raw;
    }
}
