package com.jobhist.record;

import java.util.Objects;

/**
 * One entry of the {@link FieldCatalog}: how a field is named in queries, where
 * it comes from in the log, and what kind of value it holds.
 *
 * @param name         query/display name, e.g. {@code numcpus}
 * @param logKey       key as logged, e.g. {@code Resource_List.ncpus};
 *                     {@code null} for fields taken from the line header
 * @param kind         value kind used for coercion and comparison
 * @param header       short column header for tabular output
 * @param label        descriptive label for long-form output
 * @param defaultWidth tabular column width when none is requested
 */
public record FieldDefinition(String name, String logKey, FieldKind kind,
                              String header, String label, int defaultWidth) {

    public FieldDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(label, "label");
        if (defaultWidth <= 0) {
            throw new IllegalArgumentException("defaultWidth must be positive: " + defaultWidth);
        }
    }

    /**
     * Whether this field is read from the {@code timestamp;type;id} header
     * rather than from a {@code key=value} token.
     */
    public boolean isHeaderField() {
        return logKey == null;
    }
}
