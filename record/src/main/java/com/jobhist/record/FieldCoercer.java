package com.jobhist.record;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads raw field text as the kind a {@link FieldDefinition} declares.
 *
 * <p>Accepted forms:</p>
 * <ul>
 *   <li>{@code INTEGER} - decimal digits, optional sign</li>
 *   <li>{@code FLOAT} - any decimal number</li>
 *   <li>{@code DURATION} - {@code HH:MM:SS}, {@code MM:SS} or whole seconds; hours are unbounded</li>
 *   <li>{@code MEMORY} - {@code <n>[k|m|g|t|p][b|w]}, binary multiples, a word is 8 bytes,
 *       no suffix means bytes</li>
 *   <li>{@code TIMESTAMP} - epoch seconds (as logged), {@code yyyyMMdd}, {@code yyyy-MM-dd},
 *       {@code yyyy-MM-dd'T'HH:mm[:ss]}, {@code yyyy-MM-dd HH:mm[:ss]} or the log header form
 *       {@code MM/dd/yyyy HH:mm:ss}</li>
 * </ul>
 *
 * <p>Coercion is idempotent: {@link #coerce(FieldDefinition, FieldValue)} returns a value that
 * already has the declared kind unchanged.</p>
 */
public final class FieldCoercer {

    /**
     * Timestamp format of the accounting log line header.
     */
    public static final DateTimeFormatter LOG_TIMESTAMP = DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss");

    private static final DateTimeFormatter SPACED_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");

    private static final Pattern MEMORY = Pattern.compile("(\\d+)([kmgtp]?)([bw]?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern EPOCH = Pattern.compile("\\d{1,12}");
    // epoch seconds have had nine or more digits since 1973
    private static final Pattern BASIC_DATE = Pattern.compile("\\d{8}");
    private static final String SCALES = "kmgtp";

    private final ZoneId zone;

    /**
     * @param zone zone in which epoch-second timestamps are presented
     */
    public FieldCoercer(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public ZoneId getZone() {
        return zone;
    }

    /**
     * Read raw text as the definition's kind.
     *
     * @throws FieldCoercionException if the text is not a valid value of that kind
     */
    public FieldValue coerce(FieldDefinition definition, String raw) {
        Objects.requireNonNull(raw, "raw");
        try {
            return switch (definition.kind()) {
                case INTEGER -> FieldValue.ofInteger(raw, Long.parseLong(raw.trim()));
                case FLOAT -> FieldValue.ofFloat(raw, parseFloat(raw));
                case DURATION -> FieldValue.ofDuration(raw, parseDuration(raw));
                case MEMORY -> FieldValue.ofMemory(raw, parseMemory(raw));
                case TIMESTAMP -> FieldValue.ofTimestamp(raw, parseTimestamp(raw));
                case TEXT -> FieldValue.ofText(raw);
            };
        } catch (IllegalArgumentException | DateTimeException | ArithmeticException e) {
            throw new FieldCoercionException(definition.name(), raw, definition.kind(), e);
        }
    }

    /**
     * Coerce an existing value. A coerced value of the declared kind is returned
     * as is; anything else is re-read from its raw text.
     *
     * @throws FieldCoercionException if the raw text is not a valid value of that kind
     */
    public FieldValue coerce(FieldDefinition definition, FieldValue value) {
        if (value.isCoerced() && value.kind() == definition.kind()) {
            return value;
        }
        return coerce(definition, value.raw());
    }

    /**
     * Parse the {@code MM/dd/yyyy HH:mm:ss} timestamp of a log line header.
     *
     * @throws DateTimeParseException if the text is not in that form
     */
    public static LocalDateTime parseLogTimestamp(String text) {
        return LocalDateTime.parse(text.trim(), LOG_TIMESTAMP);
    }

    static double parseFloat(String raw) {
        double value = Double.parseDouble(raw.trim());
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new NumberFormatException("Not a finite number: " + raw);
        }
        return value;
    }

    static Duration parseDuration(String raw) {
        String text = raw.trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Empty duration");
        }
        String[] parts = text.split(":", -1);
        if (parts.length > 3) {
            throw new IllegalArgumentException("Too many duration parts: " + raw);
        }
        long seconds = 0;
        for (int i = 0; i < parts.length; i++) {
            long part = parseUnsigned(parts[i]);
            // only the leading part may exceed its unit
            if (i > 0 && part >= 60) {
                throw new IllegalArgumentException("Duration part out of range: " + raw);
            }
            seconds = Math.addExact(Math.multiplyExact(seconds, 60), part);
        }
        return Duration.ofSeconds(seconds);
    }

    static long parseMemory(String raw) {
        Matcher m = MEMORY.matcher(raw.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a memory size: " + raw);
        }
        long value = Long.parseLong(m.group(1));
        String scale = m.group(2).toLowerCase(Locale.ROOT);
        if (!scale.isEmpty()) {
            int power = SCALES.indexOf(scale.charAt(0)) + 1;
            for (int i = 0; i < power; i++) {
                value = Math.multiplyExact(value, 1024L);
            }
        }
        if ("w".equalsIgnoreCase(m.group(3))) {
            value = Math.multiplyExact(value, 8L);
        }
        return value;
    }

    LocalDateTime parseTimestamp(String raw) {
        String text = raw.trim();
        if (BASIC_DATE.matcher(text).matches()) {
            return LocalDate.parse(text, DateTimeFormatter.BASIC_ISO_DATE).atStartOfDay();
        }
        if (EPOCH.matcher(text).matches()) {
            return LocalDateTime.ofInstant(Instant.ofEpochSecond(Long.parseLong(text)), zone);
        }
        if (text.indexOf('/') > 0) {
            return LocalDateTime.parse(text, LOG_TIMESTAMP);
        }
        if (text.indexOf('T') > 0) {
            return LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        }
        if (text.indexOf(' ') > 0) {
            return LocalDateTime.parse(text, SPACED_DATE_TIME);
        }
        return LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay();
    }

    private static long parseUnsigned(String part) {
        if (part.isEmpty()) {
            throw new IllegalArgumentException("Empty duration part");
        }
        for (int i = 0; i < part.length(); i++) {
            if (!Character.isDigit(part.charAt(i))) {
                throw new IllegalArgumentException("Not a number: " + part);
            }
        }
        return Long.parseLong(part);
    }
}
