package com.e2eq.filter.model.query;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One object level of a filter expression: an ordered, immutable list of clauses. A tree is built per request,
 * consumed by the compiler and thrown away. {@link #EMPTY} stands for "no filter".
 */
public final class FilterTree {

    public static final FilterTree EMPTY = new FilterTree(List.of());

    private final List<FilterClause> clauses;

    public FilterTree(List<? extends FilterClause> clauses) {
        this.clauses = List.copyOf(clauses);
    }

    public static FilterTree of(FilterClause... clauses) {
        return clauses.length == 0 ? EMPTY : new FilterTree(Arrays.asList(clauses));
    }

    public List<FilterClause> clauses() {
        return clauses;
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    public int size() {
        return clauses.size();
    }

    /**
     * Canonical JSON-like form. When two clauses share a key the later one wins here, which is why the compiler
     * works from {@link #clauses()} rather than from this map.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (FilterClause clause : clauses) {
            map.put(clause.key(), clause.toValue());
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterTree that)) return false;
        return clauses.equals(that.clauses);
    }

    @Override
    public int hashCode() {
        return clauses.hashCode();
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
