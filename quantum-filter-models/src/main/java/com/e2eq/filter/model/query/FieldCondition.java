package com.e2eq.filter.model.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A condition on a single field. Either an implicit equality ({@code "status": "active"}) or an ordered map of
 * DSL operator name to operand ({@code "age": {"gte": 18, "lt": 65}}).
 *
 * <p>The field name is kept exactly as written, including a trailing cast-escape marker such as
 * {@code external_id*}; resolving it is the compiler's job.</p>
 */
public final class FieldCondition implements FilterClause {

    /** Trailing marker on a field name that suppresses identifier coercion, e.g. {@code external_id*}. */
    public static final String CAST_ESCAPE_MARKER = "*";

    private final String field;
    private final Object value;
    private final Map<String, Object> operators;

    private FieldCondition(String field, Object value, Map<String, Object> operators) {
        this.field = Objects.requireNonNull(field, "field");
        this.value = value;
        this.operators = operators;
    }

    /**
     * Implicit equality; {@code value} may be {@code null}, a scalar or a list.
     */
    public static FieldCondition equalTo(String field, Object value) {
        return new FieldCondition(field, value, null);
    }

    public static FieldCondition withOperators(String field, Map<String, Object> operators) {
        Objects.requireNonNull(operators, "operators");
        if (operators.isEmpty()) {
            throw new IllegalArgumentException("Field condition on " + field + " needs at least one operator");
        }
        return new FieldCondition(field, null, Collections.unmodifiableMap(new LinkedHashMap<>(operators)));
    }

    public String field() {
        return field;
    }

    @Override
    public String key() {
        return field;
    }

    public boolean hasCastEscape() {
        return field.endsWith(CAST_ESCAPE_MARKER);
    }

    /**
     * @return the stored field name, without the cast-escape marker
     */
    public String baseField() {
        return baseFieldName(field);
    }

    public static String baseFieldName(String field) {
        return field != null && field.endsWith(CAST_ESCAPE_MARKER)
                ? field.substring(0, field.length() - CAST_ESCAPE_MARKER.length())
                : field;
    }

    public boolean isImplicitEquality() {
        return operators == null;
    }

    /**
     * @return the equality operand; only meaningful when {@link #isImplicitEquality()}
     */
    public Object value() {
        return value;
    }

    /**
     * @return operator name to operand, in the order supplied; empty for an implicit equality
     */
    public Map<String, Object> operators() {
        return operators == null ? Map.of() : operators;
    }

    @Override
    public Object toValue() {
        return isImplicitEquality() ? value : new LinkedHashMap<>(operators);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldCondition that)) return false;
        return field.equals(that.field) && Objects.equals(value, that.value) && Objects.equals(operators, that.operators);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, value, operators);
    }

    @Override
    public String toString() {
        return field + "=" + toValue();
    }
}
