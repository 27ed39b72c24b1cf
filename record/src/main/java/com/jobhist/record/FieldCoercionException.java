package com.jobhist.record;

/**
 * Thrown when a raw value cannot be read as the kind its field declares.
 */
public class FieldCoercionException extends JobHistoryException {

    private final String field;
    private final String raw;
    private final FieldKind kind;

    public FieldCoercionException(String field, String raw, FieldKind kind, Throwable cause) {
        super("Cannot read '" + raw + "' as " + kind + " for field '" + field + "'", cause);
        this.field = field;
        this.raw = raw;
        this.kind = kind;
    }

    public String getField() {
        return field;
    }

    public String getRaw() {
        return raw;
    }

    public FieldKind getKind() {
        return kind;
    }
}
