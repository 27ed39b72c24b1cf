package com.jobhist.record;

/**
 * Thrown when a filter or display list names a field the {@link FieldCatalog}
 * does not define.
 */
public class UnknownFieldException extends JobHistoryException {

    private final String field;

    public UnknownFieldException(String field) {
        super("Unknown field: '" + field + "'");
        this.field = field;
    }

    /**
     * Get the unrecognized field name.
     */
    public String getField() {
        return field;
    }
}
