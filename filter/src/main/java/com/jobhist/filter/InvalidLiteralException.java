package com.jobhist.filter;

import com.jobhist.record.FieldKind;
import com.jobhist.record.JobHistoryException;

/**
 * Thrown when a filter literal cannot be read as the kind of the field it is
 * compared with, e.g. {@code numcpus>many}.
 */
public class InvalidLiteralException extends JobHistoryException {

    private final String field;
    private final String literal;
    private final FieldKind kind;

    public InvalidLiteralException(String field, String literal, FieldKind kind, Throwable cause) {
        super("Invalid " + kind.name().toLowerCase() + " value '" + literal + "' for field '" + field + "'", cause);
        this.field = field;
        this.literal = literal;
        this.kind = kind;
    }

    public String getField() {
        return field;
    }

    public String getLiteral() {
        return literal;
    }

    public FieldKind getKind() {
        return kind;
    }
}
