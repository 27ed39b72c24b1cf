package com.jobhist.filter;

import com.jobhist.record.FieldCatalog;
import com.jobhist.record.Record;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * A compiled filter: a conjunction of {@link FilterClause}s.
 */
public final class CompiledFilter implements Predicate<Record> {

    private static final CompiledFilter MATCH_ALL = new CompiledFilter(List.of());

    private final List<FilterClause> clauses;

    CompiledFilter(List<FilterClause> clauses) {
        this.clauses = List.copyOf(clauses);
    }

    /**
     * A filter with no clauses, which every record passes.
     */
    public static CompiledFilter matchAll() {
        return MATCH_ALL;
    }

    public List<FilterClause> getClauses() {
        return clauses;
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    @Override
    public boolean test(Record record) {
        return FilterEvaluator.evaluate(record, clauses);
    }

    /**
     * The record type tags this filter pins with {@code record_type==X}
     * clauses. Lines with other tags can never match, so readers may drop
     * them before decoding.
     *
     * @return the pinned tags, or an empty set if the filter does not pin the type
     */
    public Set<String> pushDownTypes() {
        Set<String> tags = new LinkedHashSet<>();
        for (FilterClause clause : clauses) {
            if (clause.operator() == Operator.EQ && FieldCatalog.RECORD_TYPE.equals(clause.field().name())) {
                tags.add(clause.literal().asText());
            }
        }
        return tags;
    }

    /**
     * Combine with another filter; the result requires both.
     */
    public CompiledFilter and(CompiledFilter other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        List<FilterClause> combined = new java.util.ArrayList<>(clauses);
        combined.addAll(other.clauses);
        return new CompiledFilter(combined);
    }

    @Override
    public String toString() {
        return clauses.stream().map(FilterClause::toString).collect(Collectors.joining(";"));
    }
}
