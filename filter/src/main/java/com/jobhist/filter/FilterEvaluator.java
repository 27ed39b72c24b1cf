package com.jobhist.filter;

import com.jobhist.record.FieldValue;
import com.jobhist.record.Record;

import java.util.List;

/**
 * Applies compiled clauses to records.
 */
public final class FilterEvaluator {

    private FilterEvaluator() {
    }

    /**
     * Evaluate clauses with logical AND. A clause whose field is absent from
     * the record, or whose value could not be coerced, is false.
     *
     * @return {@code true} if every clause holds; {@code true} for no clauses
     */
    public static boolean evaluate(Record record, List<FilterClause> clauses) {
        for (FilterClause clause : clauses) {
            if (!evaluate(record, clause)) {
                return false;
            }
        }
        return true;
    }

    public static boolean evaluate(Record record, FilterClause clause) {
        FieldValue actual = record.get(clause.field().name());
        if (actual == null || !actual.isCoerced() || actual.kind() != clause.literal().kind()) {
            return false;
        }
        return clause.operator().test(actual, clause.literal());
    }
}
