package com.jobhist.record;

/**
 * Semantic type of a record field. Every field in the {@link FieldCatalog}
 * declares one of these, and {@link FieldCoercer} turns raw log text into a
 * {@link FieldValue} of that kind.
 */
public enum FieldKind {

    /** Counts such as CPUs, nodes, exit status. Held as {@code Long}. */
    INTEGER(true),

    /** Fractional values such as load averages. Held as {@code Double}. */
    FLOAT(true),

    /** Walltime and CPU time. Held as {@link java.time.Duration} (whole seconds). */
    DURATION(true),

    /** Memory sizes, normalized to bytes. Held as {@code Long}. */
    MEMORY(true),

    /** Absolute times. Held as {@link java.time.LocalDateTime} in the log zone. */
    TIMESTAMP(false),

    /** Everything else, kept as logged. */
    TEXT(false);

    private final boolean numeric;

    FieldKind(boolean numeric) {
        this.numeric = numeric;
    }

    /**
     * Whether values of this kind can be summed and averaged.
     */
    public boolean isNumeric() {
        return numeric;
    }
}
