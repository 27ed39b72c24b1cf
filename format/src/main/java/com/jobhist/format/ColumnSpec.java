package com.jobhist.format;

import com.jobhist.record.FieldCatalog;
import com.jobhist.record.FieldDefinition;
import com.jobhist.record.FieldKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One output column: a catalogued field plus an optional display specifier.
 *
 * <p>Columns are written as {@code field[:spec]}, where {@code spec} is
 * {@code [-][width][.precision][style]}. A leading {@code -} left-aligns the
 * column in tabular output. Styles by field kind:</p>
 * <table>
 *   <caption>Display styles</caption>
 *   <tr><th>Kind</th><th>Styles</th></tr>
 *   <tr><td>INTEGER</td><td>{@code d} integer, {@code f} fixed decimals, {@code s} as logged</td></tr>
 *   <tr><td>FLOAT</td><td>{@code f} fixed decimals, {@code d} rounded, {@code s}</td></tr>
 *   <tr><td>DURATION</td><td>{@code t} HH:MM, {@code T} HH:MM:SS, {@code h} hours, {@code d} seconds, {@code s}</td></tr>
 *   <tr><td>MEMORY</td><td>{@code g} GiB, {@code m} MiB, {@code k} KiB, {@code d} bytes, {@code s}</td></tr>
 *   <tr><td>TIMESTAMP</td><td>{@code D} date and time, {@code s}</td></tr>
 *   <tr><td>TEXT</td><td>{@code s}</td></tr>
 * </table>
 *
 * <pre>{@code
 * List<ColumnSpec> columns = ColumnSpec.parseList("user,numcpus:6d,elapsed:t,memory:.1g", FieldCatalog.pbs());
 * }</pre>
 */
public final class ColumnSpec {

    private static final Pattern SPECIFIER = Pattern.compile("^(-)?(\\d+)?(?:\\.(\\d+))?([a-zA-Z])?$");

    private final FieldDefinition field;
    private final String specifier;
    private final boolean leftAligned;
    private final int width;
    private final int precision;
    private final char style;

    private ColumnSpec(FieldDefinition field, String specifier, boolean leftAligned,
                       int width, int precision, char style) {
        this.field = field;
        this.specifier = specifier;
        this.leftAligned = leftAligned;
        this.width = width;
        this.precision = precision;
        this.style = style;
    }

    /**
     * A column with the field's default width and style.
     */
    public static ColumnSpec of(FieldDefinition field) {
        return new ColumnSpec(Objects.requireNonNull(field, "field"), "", false, field.defaultWidth(), -1, '\0');
    }

    /**
     * Parse one {@code field[:spec]} entry.
     *
     * @throws com.jobhist.record.UnknownFieldException if the field is not catalogued
     * @throws UnsupportedFormatSpecifierException if the specifier is malformed or unsuitable
     */
    public static ColumnSpec parse(String entry, FieldCatalog catalog) {
        String text = entry.trim();
        int colon = text.indexOf(':');
        String name = colon < 0 ? text : text.substring(0, colon).trim();
        String spec = colon < 0 ? "" : text.substring(colon + 1).trim();
        FieldDefinition field = catalog.require(name);

        Matcher m = SPECIFIER.matcher(spec);
        if (!m.matches()) {
            throw new UnsupportedFormatSpecifierException(field.name(), spec, "expected [-][width][.precision][style]");
        }
        int width = field.defaultWidth();
        if (m.group(2) != null) {
            width = parseNumber(field, spec, m.group(2));
            if (width == 0) {
                throw new UnsupportedFormatSpecifierException(field.name(), spec, "width must be positive");
            }
        }
        int precision = m.group(3) != null ? parseNumber(field, spec, m.group(3)) : -1;
        char style = m.group(4) != null ? m.group(4).charAt(0) : '\0';
        if (style != '\0' && !supports(field.kind(), style)) {
            throw new UnsupportedFormatSpecifierException(field.name(), spec,
                    "style '" + style + "' does not apply to " + field.kind() + " values");
        }
        return new ColumnSpec(field, spec, m.group(1) != null, width, precision, style);
    }

    /**
     * Parse a comma separated list of {@code field[:spec]} entries.
     *
     * @throws UnsupportedFormatSpecifierException if the list names no field
     */
    public static List<ColumnSpec> parseList(String list, FieldCatalog catalog) {
        List<ColumnSpec> columns = new ArrayList<>();
        if (list != null) {
            for (String entry : list.split(",")) {
                if (!entry.isBlank()) {
                    columns.add(parse(entry, catalog));
                }
            }
        }
        if (columns.isEmpty()) {
            throw new UnsupportedFormatSpecifierException("", list == null ? "" : list, "no fields listed");
        }
        return List.copyOf(columns);
    }

    /**
     * Whether a style letter can be applied to values of a kind.
     */
    public static boolean supports(FieldKind kind, char style) {
        String allowed = switch (kind) {
            case INTEGER -> "dfs";
            case FLOAT -> "fds";
            case DURATION -> "tThds";
            case MEMORY -> "gmkds";
            case TIMESTAMP -> "Ds";
            case TEXT -> "s";
        };
        return allowed.indexOf(style) >= 0;
    }

    private static int parseNumber(FieldDefinition field, String spec, String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new UnsupportedFormatSpecifierException(field.name(), spec, "number too large");
        }
    }

    public FieldDefinition getField() {
        return field;
    }

    public String getName() {
        return field.name();
    }

    public int getWidth() {
        return width;
    }

    /**
     * @return requested decimals or characters, or {@code -1} for the style default
     */
    public int getPrecision() {
        return precision;
    }

    /**
     * @return the style letter, or {@code '\0'} for the kind's default rendering
     */
    public char getStyle() {
        return style;
    }

    public boolean hasStyle() {
        return style != '\0';
    }

    public boolean isLeftAligned() {
        return leftAligned;
    }

    /**
     * Whether tabular cells of this column are right-aligned: numeric fields
     * not shown as raw text, unless {@code -} was given.
     */
    public boolean isRightAligned() {
        return !leftAligned && field.kind().isNumeric() && style != 's';
    }

    @Override
    public String toString() {
        return specifier.isEmpty() ? field.name() : field.name() + ":" + specifier;
    }
}
