package com.jobhist.filter;

import com.jobhist.record.JobHistoryException;

/**
 * Thrown when a filter clause is not of the form {@code field op literal},
 * or uses an operator the field's kind does not support.
 */
public class InvalidFilterException extends JobHistoryException {

    private final String clause;

    public InvalidFilterException(String message, String clause) {
        super(message + ": '" + clause + "'");
        this.clause = clause;
    }

    /**
     * Get the offending clause text.
     */
    public String getClause() {
        return clause;
    }
}
