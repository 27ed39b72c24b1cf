package com.jobhist.record;

import java.util.Objects;

/**
 * A non-fatal problem found while streaming: the query keeps going, and the
 * problem is reported on the diagnostic channel instead of the data output.
 *
 * @param kind    what went wrong
 * @param source  where it happened, e.g. {@code /logs/20250301@1024} or a file path
 * @param message human-readable description
 */
public record Diagnostic(Kind kind, String source, String message) {

    public enum Kind {
        /** A line that could not yield a record; the line was skipped. */
        MALFORMED_RECORD,
        /** A field value that could not be read as its kind; kept as raw text. */
        FIELD_COERCION,
        /** A day's log file that does not exist; the day was skipped. */
        MISSING_FILE
    }

    public Diagnostic {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public Diagnostic withSource(String source) {
        return new Diagnostic(kind, source, message);
    }

    @Override
    public String toString() {
        return source == null ? kind + ": " + message : kind + " [" + source + "]: " + message;
    }
}
