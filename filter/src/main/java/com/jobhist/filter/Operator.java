package com.jobhist.filter;

import com.jobhist.record.FieldKind;
import com.jobhist.record.FieldValue;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * The closed set of filter comparison operators.
 *
 * <p>Ordering operators compare values of the field's kind: numbers
 * numerically, durations by length, memory by bytes, timestamps
 * chronologically and text lexicographically. {@link #CONTAINS} and
 * {@link #NOT_CONTAINS} are substring tests and only apply to text fields.</p>
 */
public enum Operator {

    EQ("==", false) {
        @Override
        boolean test(FieldValue actual, FieldValue literal) {
            return actual.compareTo(literal) == 0;
        }
    },
    NE("!=", false) {
        @Override
        boolean test(FieldValue actual, FieldValue literal) {
            return actual.compareTo(literal) != 0;
        }
    },
    GT(">", false) {
        @Override
        boolean test(FieldValue actual, FieldValue literal) {
            return actual.compareTo(literal) > 0;
        }
    },
    GE(">=", false) {
        @Override
        boolean test(FieldValue actual, FieldValue literal) {
            return actual.compareTo(literal) >= 0;
        }
    },
    LT("<", false) {
        @Override
        boolean test(FieldValue actual, FieldValue literal) {
            return actual.compareTo(literal) < 0;
        }
    },
    LE("<=", false) {
        @Override
        boolean test(FieldValue actual, FieldValue literal) {
            return actual.compareTo(literal) <= 0;
        }
    },
    CONTAINS("~", true) {
        @Override
        boolean test(FieldValue actual, FieldValue literal) {
            return actual.asText().contains(literal.asText());
        }
    },
    NOT_CONTAINS("!~", true) {
        @Override
        boolean test(FieldValue actual, FieldValue literal) {
            return !actual.asText().contains(literal.asText());
        }
    };

    /** Symbols longest first, so {@code >=} is matched before {@code >}. */
    static final List<Operator> BY_SYMBOL_LENGTH = Arrays.stream(values())
            .sorted(Comparator.comparingInt((Operator op) -> op.symbol.length()).reversed())
            .toList();

    private final String symbol;
    private final boolean textOnly;

    Operator(String symbol, boolean textOnly) {
        this.symbol = symbol;
        this.textOnly = textOnly;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Whether this operator can be applied to fields of the given kind.
     */
    public boolean supports(FieldKind kind) {
        return !textOnly || kind == FieldKind.TEXT;
    }

    /**
     * Apply to a record value and a literal of the same kind.
     */
    abstract boolean test(FieldValue actual, FieldValue literal);

}
