package com.jobhist.record;

/**
 * Thrown when a log line cannot yield a valid record: the header is
 * incomplete, or its timestamp, record type or job id is missing or
 * unparseable.
 */
public class MalformedRecordException extends JobHistoryException {

    private final String line;

    /**
     * @param message what is wrong with the line
     * @param line the offending line (may be {@code null})
     */
    public MalformedRecordException(String message, String line) {
        super(message);
        this.line = line;
    }

    /**
     * Get the line that could not be decoded.
     */
    public String getLine() {
        return line;
    }
}
