package com.jobhist.filter;

import com.jobhist.record.FieldDefinition;
import com.jobhist.record.FieldValue;

import java.util.Objects;

/**
 * One typed comparison: a catalogued field, an operator, and a literal
 * already coerced to the field's kind.
 */
public record FilterClause(Operator operator, FieldDefinition field, FieldValue literal) {

    public FilterClause {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(literal, "literal");
        if (literal.kind() != field.kind()) {
            throw new IllegalArgumentException("Literal kind " + literal.kind()
                    + " does not match field " + field.name() + " (" + field.kind() + ")");
        }
    }

    @Override
    public String toString() {
        return field.name() + operator.getSymbol() + literal.raw();
    }
}
