package com.jobhist.stream.window;

import com.jobhist.record.JobHistoryException;

/**
 * Thrown when a date window cannot be resolved: it is empty, reaches into the
 * future, or was requested with a negative day count. Raised before any file
 * is opened.
 */
public class InvalidWindowException extends JobHistoryException {

    public InvalidWindowException(String message) {
        super(message);
    }
}
