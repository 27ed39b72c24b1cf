package com.jobhist.format;

import com.jobhist.record.JobHistoryException;

/**
 * Thrown at formatter setup when a display specifier cannot be parsed or does
 * not suit its field's kind, e.g. {@code user:t} or {@code numcpus:5x}.
 */
public class UnsupportedFormatSpecifierException extends JobHistoryException {

    private final String field;
    private final String specifier;

    public UnsupportedFormatSpecifierException(String field, String specifier, String reason) {
        super("Unsupported format '" + specifier + "' for field '" + field + "': " + reason);
        this.field = field;
        this.specifier = specifier;
    }

    public String getField() {
        return field;
    }

    public String getSpecifier() {
        return specifier;
    }
}
