package com.jobhist.record;

/**
 * Base class of every error raised while answering a history query.
 *
 * <p>Setup errors (window, filter, output format) are raised before any record
 * is read and end the query. Per-record errors such as
 * {@link MalformedRecordException} are absorbed by the stream readers, which
 * report them through {@link Diagnostics} and keep streaming.</p>
 */
public class JobHistoryException extends RuntimeException {

    public JobHistoryException(String message) {
        super(message);
    }

    public JobHistoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
