package com.jobhist.filter;

import com.jobhist.record.FieldCatalog;
import com.jobhist.record.FieldCoercer;
import com.jobhist.record.FieldCoercionException;
import com.jobhist.record.FieldDefinition;
import com.jobhist.record.FieldValue;
import com.jobhist.record.UnknownFieldException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiles filter text into a {@link CompiledFilter}.
 *
 * <p>Grammar:</p>
 * <pre>
 * filter  := clause (';' clause)*
 * clause  := field op literal
 * field   := [A-Za-z0-9_.]+          (query name or logged key)
 * op      := '==' | '!=' | '&gt;=' | '&lt;=' | '&gt;' | '&lt;' | '~' | '!~'
 * literal := text | '"' text '"'     (\" inside quotes is a quote)
 * </pre>
 *
 * <p>Empty clauses are ignored, so an empty filter matches everything.
 * Whitespace around fields, operators and unquoted literals is ignored. A
 * {@code ;} inside a quoted literal does not end the clause.</p>
 *
 * <p>Each literal is coerced to its field's kind at compile time, so every
 * error surfaces before any record is read:</p>
 * <ul>
 *   <li>{@link UnknownFieldException} - the field is not catalogued</li>
 *   <li>{@link InvalidLiteralException} - the literal is not a value of the field's kind</li>
 *   <li>{@link InvalidFilterException} - no field, no operator, no literal, or an
 *       operator the field's kind does not support</li>
 * </ul>
 *
 * <pre>{@code
 * FilterCompiler compiler = new FilterCompiler(FieldCatalog.pbs(), coercer);
 * CompiledFilter filter = compiler.compile("numcpus>1;user==vanderwb");
 * boolean keep = filter.test(record);
 * }</pre>
 */
public class FilterCompiler {

    private static final Logger log = LoggerFactory.getLogger(FilterCompiler.class);

    private final FieldCatalog catalog;
    private final FieldCoercer coercer;

    public FilterCompiler(FieldCatalog catalog, FieldCoercer coercer) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.coercer = Objects.requireNonNull(coercer, "coercer");
    }

    /**
     * Compile filter text.
     *
     * @param text clauses separated by {@code ;}; {@code null} or blank matches everything
     */
    public CompiledFilter compile(String text) {
        if (text == null || text.isBlank()) {
            return CompiledFilter.matchAll();
        }
        List<FilterClause> clauses = new ArrayList<>();
        for (String clause : splitClauses(text)) {
            if (!clause.isBlank()) {
                clauses.add(compileClause(clause.trim()));
            }
        }
        CompiledFilter filter = new CompiledFilter(clauses);
        log.debug("Compiled filter '{}' into {} clause(s)", text, clauses.size());
        return filter;
    }

    /**
     * Build the text of an equality clause, quoting the value when needed.
     */
    public static String equalsClause(String field, String value) {
        return field + "==" + quote(value);
    }

    /**
     * Quote a literal so that it survives compilation unchanged.
     */
    public static String quote(String value) {
        return '"' + value.replace("\"", "\\\"") + '"';
    }

    /**
     * The field names the clauses of filter text mention, as written and without
     * checking them against a catalog.
     */
    public static List<String> fieldNames(String text) {
        List<String> names = new ArrayList<>();
        if (text == null) {
            return names;
        }
        for (String clause : splitClauses(text)) {
            String trimmed = clause.trim();
            int i = 0;
            while (i < trimmed.length() && isFieldChar(trimmed.charAt(i))) {
                i++;
            }
            if (i > 0) {
                names.add(trimmed.substring(0, i));
            }
        }
        return names;
    }

    FilterClause compileClause(String clause) {
        int i = 0;
        int len = clause.length();
        while (i < len && isFieldChar(clause.charAt(i))) {
            i++;
        }
        String fieldName = clause.substring(0, i);
        if (fieldName.isEmpty()) {
            throw new InvalidFilterException("Clause has no field", clause);
        }
        while (i < len && Character.isWhitespace(clause.charAt(i))) {
            i++;
        }
        Operator operator = null;
        for (Operator candidate : Operator.BY_SYMBOL_LENGTH) {
            if (clause.startsWith(candidate.getSymbol(), i)) {
                operator = candidate;
                break;
            }
        }
        if (operator == null) {
            throw new InvalidFilterException("Clause has no valid operator", clause);
        }
        String rest = clause.substring(i + operator.getSymbol().length()).trim();
        if (rest.isEmpty()) {
            throw new InvalidFilterException("Clause has no value", clause);
        }
        String literal = unquote(rest, clause);

        FieldDefinition field = catalog.require(fieldName);
        if (!operator.supports(field.kind())) {
            throw new InvalidFilterException("Operator " + operator.getSymbol()
                    + " does not apply to " + field.kind() + " field " + field.name(), clause);
        }
        FieldValue value;
        try {
            value = coercer.coerce(field, literal);
        } catch (FieldCoercionException e) {
            throw new InvalidLiteralException(field.name(), literal, field.kind(), e);
        }
        return new FilterClause(operator, field, value);
    }

    private static boolean isFieldChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_' || c == '.';
    }

    private static String unquote(String text, String clause) {
        if (text.charAt(0) != '"') {
            return text;
        }
        StringBuilder value = new StringBuilder();
        int len = text.length();
        for (int i = 1; i < len; i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < len && text.charAt(i + 1) == '"') {
                value.append('"');
                i++;
            } else if (c == '"') {
                if (i != len - 1) {
                    throw new InvalidFilterException("Unexpected text after quoted value", clause);
                }
                return value.toString();
            } else {
                value.append(c);
            }
        }
        throw new InvalidFilterException("Unterminated quoted value", clause);
    }

    static List<String> splitClauses(String text) {
        List<String> clauses = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        int len = text.length();
        for (int i = 0; i < len; i++) {
            char c = text.charAt(i);
            if (inQuotes && c == '\\' && i + 1 < len && text.charAt(i + 1) == '"') {
                current.append(c).append('"');
                i++;
                continue;
            }
            if (c == '"') {
                inQuotes = !inQuotes;
            }
            if (c == ';' && !inQuotes) {
                clauses.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        clauses.add(current.toString());
        return clauses;
    }
}
