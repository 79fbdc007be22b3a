package com.e2eq.filter.model.persistent.morphia.sanitizer;

import com.e2eq.filter.model.query.FieldCondition;
import com.e2eq.filter.model.query.FilterClause;
import com.e2eq.filter.model.query.FilterOperators;
import com.e2eq.filter.model.query.FilterTree;
import com.e2eq.filter.model.query.LogicalGroup;
import com.e2eq.filter.model.query.LogicalOperator;
import com.e2eq.filter.model.security.SanitizationResult;
import com.e2eq.filter.model.security.SanitizerOptions;
import io.quarkus.logging.Log;
import org.bson.types.ObjectId;

import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns an untrusted, untyped filter (maps, lists and scalars as parsed from JSON) into a canonical
 * {@link FilterTree} that only uses DSL operators and permitted fields.
 *
 * <p>Clause level problems drop the offending clause and add a violation; sibling clauses survive.
 * Structural limit breaches (depth, array length, object key count, string length) abort the whole call:
 * the result is an empty tree with a single {@code "Sanitization failed: ..."} violation.</p>
 *
 * <p>Stateless; every call gets its own violation list.</p>
 */
public final class FilterSanitizer {

    private static final Object ABSENT = new Object();

    private FilterSanitizer() {}

    public static SanitizationResult sanitize(Object filter) {
        return sanitize(filter, 0, SanitizerOptions.defaults());
    }

    public static SanitizationResult sanitize(Object filter, SanitizerOptions options) {
        return sanitize(filter, 0, options);
    }

    /**
     * @param filter  untrusted input; {@code null} means no filter
     * @param depth   logical nesting depth of {@code filter}, 0 at the root
     * @param options policy and per-call overrides
     * @return the sanitized tree and the violations, never {@code null}
     */
    public static SanitizationResult sanitize(Object filter, int depth, SanitizerOptions options) {
        Objects.requireNonNull(options, "options");
        List<String> violations = new ArrayList<>();
        if (filter == null) {
            return new SanitizationResult(FilterTree.EMPTY, violations);
        }
        try {
            FilterTree tree = sanitizeObject(filter, depth, new Context(options, violations));
            return new SanitizationResult(tree, violations);
        } catch (LimitExceededException e) {
            Log.warnf("Filter sanitization failed: %s (%d clause violation(s) discarded)", e.getMessage(), violations.size());
            return SanitizationResult.failed(e.getMessage());
        }
    }

    private static FilterTree sanitizeObject(Object node, int depth, Context ctx) {
        if (depth > ctx.options.maxDepth()) {
            throw new LimitExceededException("Filter depth exceeds maximum allowed depth of " + ctx.options.maxDepth());
        }
        if (!(node instanceof Map<?, ?> map)) {
            ctx.violations.add("Expected a filter object but found " + typeName(node));
            return FilterTree.EMPTY;
        }
        if (map.size() > ctx.options.maxObjectKeys()) {
            throw new LimitExceededException("Filter object exceeds maximum of " + ctx.options.maxObjectKeys() + " keys");
        }

        List<FilterClause> clauses = new ArrayList<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();

            if (ctx.isNativeOperator(key)) {
                ctx.violations.add(ctx.marker() + " operators not allowed. Use DSL operators instead. Found: " + key);
                Log.warnf("Security: native operator blocked in client filter: %s", key);
                continue;
            }
            if (key.isEmpty()) {
                ctx.violations.add("Empty field name");
                continue;
            }

            Optional<LogicalOperator> logical = LogicalOperator.fromKey(key);
            if (logical.isPresent()) {
                if (!ctx.options.policy().isLogicalOperatorAllowed(key)) {
                    ctx.violations.add("Logical operator not allowed: " + key);
                    continue;
                }
                FilterClause group = logical.get() == LogicalOperator.NOT
                        ? sanitizeNot(value, depth, ctx)
                        : sanitizeLogicalArray(logical.get(), value, depth, ctx);
                if (group != null) {
                    clauses.add(group);
                }
                continue;
            }

            String fieldName = FieldCondition.baseFieldName(key);
            if (isProtectedField(fieldName, ctx.options)) {
                ctx.violations.add("Blocked protected field: " + key);
                continue;
            }
            Optional<Set<String>> whitelist = ctx.options.allowedFields();
            if (whitelist.isPresent() && !whitelist.get().contains(fieldName)) {
                ctx.violations.add("Field not in whitelist: " + key);
                continue;
            }

            if (value instanceof Map<?, ?> operators) {
                FieldCondition condition = sanitizeFieldOperators(key, operators, ctx);
                if (condition != null) {
                    clauses.add(condition);
                }
            } else {
                Object sanitized = sanitizePrimitive(value, key, ctx);
                if (sanitized == ABSENT) {
                    ctx.violations.add("Unsupported value for field " + key + ": " + typeName(value));
                } else {
                    clauses.add(FieldCondition.equalTo(key, sanitized));
                }
            }
        }
        return clauses.isEmpty() ? FilterTree.EMPTY : new FilterTree(clauses);
    }

    private static LogicalGroup sanitizeLogicalArray(LogicalOperator operator, Object value, int depth, Context ctx) {
        if (!(value instanceof List<?> items)) {
            ctx.violations.add(operator.key() + " requires an array value");
            return null;
        }
        if (items.size() > ctx.options.maxArrayLength()) {
            throw new LimitExceededException(operator.key() + " array exceeds maximum length of " + ctx.options.maxArrayLength());
        }
        List<FilterTree> operands = new ArrayList<>();
        for (Object item : items) {
            FilterTree operand = sanitizeObject(item, depth + 1, ctx);
            if (!operand.isEmpty()) {
                operands.add(operand);
            }
        }
        return operands.isEmpty() ? null : new LogicalGroup(operator, operands);
    }

    private static LogicalGroup sanitizeNot(Object value, int depth, Context ctx) {
        if (!(value instanceof Map<?, ?>)) {
            ctx.violations.add("not operator requires an object value");
            return null;
        }
        FilterTree operand = sanitizeObject(value, depth + 1, ctx);
        return operand.isEmpty() ? null : LogicalGroup.not(operand);
    }

    private static FieldCondition sanitizeFieldOperators(String field, Map<?, ?> operators, Context ctx) {
        if (operators.size() > ctx.options.maxObjectKeys()) {
            throw new LimitExceededException("Operators of field " + field + " exceed maximum of " + ctx.options.maxObjectKeys() + " keys");
        }
        if (operators.isEmpty()) {
            ctx.violations.add("Empty operator object in field " + field);
            return null;
        }

        Map<String, Object> sanitized = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : operators.entrySet()) {
            String op = String.valueOf(entry.getKey());
            Object opValue = entry.getValue();

            if (ctx.isNativeOperator(op)) {
                ctx.violations.add(ctx.marker() + " operators not allowed in field " + field + ". Use DSL operators instead. Found: " + op);
                Log.warnf("Security: native operator blocked in client filter field %s: %s", field, op);
                continue;
            }
            String canonical = FilterOperators.normalize(op);
            if (!ctx.options.policy().isFieldOperatorAllowed(canonical)) {
                ctx.violations.add("Unknown DSL operator in field " + field + ": " + op);
                continue;
            }
            if (sanitized.containsKey(canonical)) {
                // operator names are case-insensitive, so GT and gt collide after normalizing
                ctx.violations.add("Duplicate operator " + op + " in field " + field + ", keeping the first occurrence");
                continue;
            }

            switch (canonical) {
                case FilterOperators.LIKE, FilterOperators.NOT_LIKE -> {
                    if (!(opValue instanceof String s)) {
                        ctx.violations.add(op + " expects a string value in field " + field);
                        continue;
                    }
                    if (s.length() > ctx.options.maxStringLength()) {
                        ctx.violations.add(op + " value too long in field " + field + " (max " + ctx.options.maxStringLength() + " chars)");
                        continue;
                    }
                    sanitized.put(canonical, s);
                }
                case FilterOperators.IN, FilterOperators.NIN, FilterOperators.NOT_IN -> {
                    if (!(opValue instanceof List<?> values)) {
                        ctx.violations.add(op + " expects an array in field " + field);
                        continue;
                    }
                    if (values.size() > ctx.options.maxArrayLength()) {
                        ctx.violations.add(op + " array too long in field " + field + " (max " + ctx.options.maxArrayLength() + " items)");
                        continue;
                    }
                    sanitized.put(canonical, sanitizeElements(values, field, ctx));
                }
                case FilterOperators.BETWEEN -> {
                    if (!(opValue instanceof List<?> bounds) || bounds.size() != 2) {
                        ctx.violations.add("between expects [min, max] array in field " + field);
                        continue;
                    }
                    Object min = sanitizePrimitive(bounds.get(0), field, ctx);
                    Object max = sanitizePrimitive(bounds.get(1), field, ctx);
                    if (min == ABSENT || max == ABSENT) {
                        ctx.violations.add("between bounds must be scalar values in field " + field);
                        continue;
                    }
                    sanitized.put(canonical, Collections.unmodifiableList(Arrays.asList(min, max)));
                }
                case FilterOperators.EXISTS -> {
                    if (!(opValue instanceof Boolean)) {
                        ctx.violations.add("exists expects boolean value in field " + field);
                        continue;
                    }
                    sanitized.put(canonical, opValue);
                }
                case FilterOperators.IS_NULL, FilterOperators.IS_NOT_NULL -> sanitized.put(canonical, Boolean.TRUE);
                default -> {
                    Object value = sanitizePrimitive(opValue, field, ctx);
                    if (value == ABSENT) {
                        ctx.violations.add("Unsupported value for operator " + op + " in field " + field + ": " + typeName(opValue));
                        continue;
                    }
                    sanitized.put(canonical, value);
                }
            }
        }
        return sanitized.isEmpty() ? null : FieldCondition.withOperators(field, sanitized);
    }

    /**
     * Scalars, dates, identifiers and arrays of those pass; strings and arrays are length checked (fatal).
     * Anything else, plain objects included, is {@link #ABSENT}.
     */
    private static Object sanitizePrimitive(Object value, String field, Context ctx) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean || value instanceof Number) {
            return value;
        }
        if (value instanceof CharSequence cs) {
            if (cs.length() > ctx.options.maxStringLength()) {
                throw new LimitExceededException("String value exceeds maximum length of " + ctx.options.maxStringLength());
            }
            return cs.toString();
        }
        if (value instanceof Date || value instanceof Temporal || value instanceof ObjectId) {
            return value;
        }
        if (value instanceof List<?> list) {
            if (list.size() > ctx.options.maxArrayLength()) {
                throw new LimitExceededException("Array exceeds maximum length of " + ctx.options.maxArrayLength());
            }
            return sanitizeElements(list, field, ctx);
        }
        return ABSENT;
    }

    private static List<Object> sanitizeElements(List<?> values, String field, Context ctx) {
        List<Object> sanitized = new ArrayList<>(values.size());
        for (Object item : values) {
            Object value = sanitizePrimitive(item, field, ctx);
            if (value == ABSENT) {
                ctx.violations.add("Unsupported array element dropped in field " + field + ": " + typeName(item));
            } else {
                sanitized.add(value);
            }
        }
        return Collections.unmodifiableList(sanitized);
    }

    /**
     * True when the field, with any cast escape stripped, or its first dotted segment is protected.
     */
    public static boolean isProtectedField(String field, SanitizerOptions options) {
        String fieldName = FieldCondition.baseFieldName(field);
        return options.isProtected(fieldName) || options.isProtected(rootSegment(fieldName));
    }

    private static String rootSegment(String field) {
        int dot = field.indexOf('.');
        return dot < 0 ? field : field.substring(0, dot);
    }

    private static String typeName(Object value) {
        if (value == null) return "null";
        if (value instanceof Map) return "object";
        if (value instanceof List) return "array";
        return value.getClass().getSimpleName();
    }

    private record Context(SanitizerOptions options, List<String> violations) {
        String marker() {
            return options.policy().nativeOperatorMarker();
        }

        boolean isNativeOperator(String key) {
            return key.contains(marker());
        }
    }

    /**
     * Structural breach; unwinds the whole sanitize call.
     */
    private static final class LimitExceededException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        LimitExceededException(String message) {
            super(message, null, false, false);
        }
    }
}
