package com.jobhist.format;

import com.jobhist.record.FieldKind;
import com.jobhist.record.FieldValue;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders field values as text according to a {@link ColumnSpec}.
 *
 * <p>Without a style, integers print as is, floats with two decimals,
 * durations as {@code HH:MM:SS}, memory in GiB with two decimals and
 * timestamps as {@code yyyy-MM-dd HH:mm:ss}. Values whose coercion failed
 * always print as logged.</p>
 */
public final class ValueRenderer {

    public static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final int DEFAULT_PRECISION = 2;

    private ValueRenderer() {
    }

    /**
     * Render a value for a column.
     *
     * @return the text, or {@code null} if the value is absent
     */
    public static String render(ColumnSpec column, FieldValue value) {
        if (value == null) {
            return null;
        }
        FieldKind kind = column.getField().kind();
        if (!value.isCoerced() || value.kind() != kind) {
            return value.raw();
        }
        char style = column.getStyle();
        if (style == 's') {
            return truncate(value.raw(), column.getPrecision());
        }
        return switch (kind) {
            case INTEGER -> style == 'f'
                    ? fixed(value.asLong(), precision(column))
                    : Long.toString(value.asLong());
            case FLOAT -> style == 'd'
                    ? Long.toString(Math.round(value.asDouble()))
                    : fixed(value.asDouble(), precision(column));
            case DURATION -> duration(value.asDuration().getSeconds(), column);
            case MEMORY -> memory(value.asBytes(), column);
            case TIMESTAMP -> timestamp(value.asTimestamp());
            case TEXT -> value.asText();
        };
    }

    /**
     * Render an average of a numeric column in that column's format. Durations
     * and memory sizes are rounded to whole seconds and bytes; integer columns
     * show decimals unless styled {@code d}.
     */
    public static String renderAverage(ColumnSpec column, double average) {
        char style = column.getStyle();
        return switch (column.getField().kind()) {
            case INTEGER, FLOAT -> style == 'd'
                    ? Long.toString(Math.round(average))
                    : fixed(average, precision(column));
            case DURATION -> duration(Math.round(average), column);
            case MEMORY -> memory(Math.round(average), column);
            default -> throw new IllegalArgumentException("Not a numeric column: " + column);
        };
    }

    static String duration(long seconds, ColumnSpec column) {
        return switch (column.getStyle()) {
            case 't' -> String.format(Locale.ROOT, "%02d:%02d", seconds / 3600, (seconds % 3600) / 60);
            case 'h' -> fixed(seconds / 3600.0, precision(column));
            case 'd', 's' -> Long.toString(seconds);
            default -> String.format(Locale.ROOT, "%02d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
        };
    }

    static String memory(long bytes, ColumnSpec column) {
        return switch (column.getStyle()) {
            case 'm' -> fixed(bytes / (double) (1L << 20), precision(column));
            case 'k' -> fixed(bytes / (double) (1L << 10), precision(column));
            case 'd', 's' -> Long.toString(bytes);
            default -> fixed(bytes / (double) (1L << 30), precision(column));
        };
    }

    static String timestamp(LocalDateTime time) {
        return DATE_TIME.format(time);
    }

    private static int precision(ColumnSpec column) {
        return column.getPrecision() >= 0 ? column.getPrecision() : DEFAULT_PRECISION;
    }

    private static String fixed(double value, int precision) {
        return String.format(Locale.ROOT, "%." + precision + "f", value);
    }

    private static String truncate(String text, int length) {
        return length >= 0 && text.length() > length ? text.substring(0, length) : text;
    }

    /**
     * Fit text to a column width, padding or cutting as needed.
     */
    static String fit(String text, int width, boolean rightAligned) {
        if (text.length() > width) {
            return text.substring(0, width);
        }
        String padding = " ".repeat(width - text.length());
        return rightAligned ? padding + text : text + padding;
    }
}
