package com.jobhist.format;

import java.util.Locale;

/**
 * How records are written to the data output.
 */
public enum OutputMode {
    /** Fixed-width columns under a header row. */
    TABULAR,
    /** One labeled block per record. */
    LONG,
    /** Comma separated values, RFC 4180 quoting. */
    CSV,
    /** A single JSON document. */
    JSON;

    /**
     * Parse a mode name, ignoring case.
     *
     * @throws IllegalArgumentException if the name is not a mode
     */
    public static OutputMode parse(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * The key of this mode in the {@code jobhist.output.fields} config section.
     */
    public String configKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
