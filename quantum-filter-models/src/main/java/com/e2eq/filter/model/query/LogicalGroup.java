package com.e2eq.filter.model.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@code and} / {@code or} over an ordered list of sub-trees, or {@code not} over exactly one.
 */
public final class LogicalGroup implements FilterClause {

    private final LogicalOperator operator;
    private final List<FilterTree> operands;

    public LogicalGroup(LogicalOperator operator, List<FilterTree> operands) {
        this.operator = Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operands, "operands");
        if (operator == LogicalOperator.NOT && operands.size() != 1) {
            throw new IllegalArgumentException("not expects exactly one operand, got " + operands.size());
        }
        if (operands.isEmpty()) {
            throw new IllegalArgumentException(operator.key() + " expects at least one operand");
        }
        this.operands = List.copyOf(operands);
    }

    public static LogicalGroup and(FilterTree... operands) {
        return new LogicalGroup(LogicalOperator.AND, List.of(operands));
    }

    public static LogicalGroup or(FilterTree... operands) {
        return new LogicalGroup(LogicalOperator.OR, List.of(operands));
    }

    public static LogicalGroup not(FilterTree operand) {
        return new LogicalGroup(LogicalOperator.NOT, List.of(operand));
    }

    public LogicalOperator operator() {
        return operator;
    }

    public List<FilterTree> operands() {
        return operands;
    }

    @Override
    public String key() {
        return operator.key();
    }

    @Override
    public Object toValue() {
        if (operator == LogicalOperator.NOT) {
            return operands.get(0).toMap();
        }
        List<Object> values = new ArrayList<>(operands.size());
        for (FilterTree operand : operands) {
            values.add(operand.toMap());
        }
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogicalGroup that)) return false;
        return operator == that.operator && operands.equals(that.operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operands);
    }

    @Override
    public String toString() {
        return operator.key() + operands;
    }
}
