package com.jobhist.record;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes diagnostics as WARN events on the {@code com.jobhist.diagnostics} logger,
 * which the logging configuration routes to standard error.
 */
public class LoggingDiagnostics implements Diagnostics {

    public static final String LOGGER_NAME = "com.jobhist.diagnostics";

    private static final Logger log = LoggerFactory.getLogger(LOGGER_NAME);

    private long count;

    @Override
    public void warn(Diagnostic diagnostic) {
        count++;
        if (diagnostic.source() != null) {
            log.warn("{} [{}]: {}", diagnostic.kind(), diagnostic.source(), diagnostic.message());
        } else {
            log.warn("{}: {}", diagnostic.kind(), diagnostic.message());
        }
    }

    /**
     * Number of diagnostics reported so far.
     */
    public long getCount() {
        return count;
    }
}
