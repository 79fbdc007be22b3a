package com.e2eq.filter.model.persistent.morphia.compiler.mongo;

import com.e2eq.filter.annotations.FilterFieldSchema;
import com.e2eq.filter.exceptions.FilterCompilationException;
import com.e2eq.filter.model.query.FieldCondition;
import com.e2eq.filter.model.query.FilterClause;
import com.e2eq.filter.model.query.FilterOperators;
import com.e2eq.filter.model.query.FilterTree;
import com.e2eq.filter.model.query.LogicalGroup;
import io.quarkus.logging.Log;
import org.bson.Document;
import org.bson.types.ObjectId;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Compiles a sanitized {@link FilterTree} into a MongoDB filter document.
 *
 * <ul>
 *   <li>{@code and} / {@code or} become {@code $and} / {@code $or}; {@code not} becomes a single element {@code $nor}.</li>
 *   <li>Implicit equality compiles to {@code {$eq: v}} so later operators on the same field merge into it.</li>
 *   <li>{@code like} escapes every regex metacharacter and becomes a case-insensitive contains pattern.</li>
 *   <li>Fields ending in the identifier suffix ({@code _id}) have 24 hex character strings coerced to
 *   {@link ObjectId}, unless the field is written with a trailing {@code *}, is listed as "do not cast", or a
 *   {@link FilterFieldSchema} declares it otherwise.</li>
 * </ul>
 *
 * <p>The compiler trusts its input: it must only ever see the output of the sanitizer. Errors are thrown as
 * {@link FilterCompilationException} and are never recovered from here. Instances are immutable and thread safe.</p>
 */
public class MongoFilterCompiler {

    public static final String DEFAULT_IDENTIFIER_SUFFIX = "_id";
    public static final int DEFAULT_MAX_RECURSION_DEPTH = 10;

    private static final String ID_FIELD = "_id";
    private static final String AND = "$and";
    private static final Pattern SPECIAL_REGEX_CHARS = Pattern.compile("[{}()\\[\\].+*?^$\\\\|\\-]");

    private final Set<String> noObjectIdCastFields;
    private final String identifierSuffix;
    private final int maxRecursionDepth;
    private final FilterFieldSchema schema;

    public MongoFilterCompiler() {
        this(builder());
    }

    private MongoFilterCompiler(Builder b) {
        this.noObjectIdCastFields = Set.copyOf(b.noObjectIdCastFields);
        this.identifierSuffix = b.identifierSuffix;
        this.maxRecursionDepth = b.maxRecursionDepth;
        this.schema = b.schema;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a compiler with the same settings that resolves identifier fields through {@code schema}
     */
    public MongoFilterCompiler withSchema(FilterFieldSchema schema) {
        return new Builder()
                .noObjectIdCastFields(noObjectIdCastFields)
                .identifierSuffix(identifierSuffix)
                .maxRecursionDepth(maxRecursionDepth)
                .schema(schema)
                .build();
    }

    public Document compile(FilterTree tree) {
        if (tree == null || tree.isEmpty()) {
            return new Document();
        }
        Document query = compileTree(tree, 0);
        if (Log.isDebugEnabled()) {
            Log.debugf("Compiled client filter: %s", query.toJson());
        }
        return query;
    }

    /**
     * Whether values of the field written as {@code key} are coerced to {@link ObjectId}.
     */
    public boolean castsToObjectId(String key) {
        return shouldConvertToObjectId(FieldCondition.baseFieldName(key), key.endsWith(FieldCondition.CAST_ESCAPE_MARKER));
    }

    private Document compileTree(FilterTree tree, int depth) {
        if (depth > maxRecursionDepth) {
            throw new FilterCompilationException("Query depth exceeds maximum allowed depth of " + maxRecursionDepth);
        }
        Document query = new Document();
        for (FilterClause clause : tree.clauses()) {
            if (clause instanceof LogicalGroup group) {
                compileGroup(query, group, depth);
            } else if (clause instanceof FieldCondition condition) {
                compileField(query, condition);
            } else {
                throw new FilterCompilationException("Unsupported clause type: " + clause.getClass().getName());
            }
        }
        return query;
    }

    @SuppressWarnings("unchecked")
    private void compileGroup(Document query, LogicalGroup group, int depth) {
        List<Document> operands = new ArrayList<>(group.operands().size());
        for (FilterTree operand : group.operands()) {
            operands.add(compileTree(operand, depth + 1));
        }

        String key = group.operator().mongoOperator();
        Object existing = query.get(key);
        if (existing == null) {
            query.put(key, operands);
            return;
        }
        switch (group.operator()) {
            // and-of-ands and nor-of-nors flatten without changing meaning
            case AND, NOT -> ((List<Object>) existing).addAll(operands);
            // a second $or at the same level must still hold on its own
            case OR -> appendToAnd(query, new Document(key, operands));
        }
    }

    @SuppressWarnings("unchecked")
    private static void appendToAnd(Document query, Document clause) {
        Object existing = query.get(AND);
        if (existing instanceof List<?>) {
            ((List<Object>) existing).add(clause);
        } else {
            List<Object> and = new ArrayList<>();
            and.add(clause);
            query.put(AND, and);
        }
    }

    private void compileField(Document query, FieldCondition condition) {
        String fieldName = condition.baseField();
        boolean castToObjectId = shouldConvertToObjectId(fieldName, condition.hasCastEscape());

        Document conditions;
        if (condition.isImplicitEquality()) {
            conditions = new Document("$eq", castValue(condition.value(), castToObjectId));
        } else {
            conditions = new Document();
            for (Map.Entry<String, Object> entry : condition.operators().entrySet()) {
                conditions.putAll(compileOperator(entry.getKey(), entry.getValue(), fieldName, castToObjectId));
            }
        }

        Object existing = query.get(fieldName);
        if (existing instanceof Document merged) {
            merged.putAll(conditions);
        } else {
            query.put(fieldName, conditions);
        }
    }

    private Document compileOperator(String operator, Object value, String fieldName, boolean castToObjectId) {
        String op = FilterOperators.normalize(operator);
        switch (op) {
            case FilterOperators.EQ_SYMBOL:
            case FilterOperators.EQ:
                return new Document("$eq", castValue(value, castToObjectId));
            case FilterOperators.NE_SYMBOL:
            case FilterOperators.NE:
            case FilterOperators.NE_SQL:
                return new Document("$ne", castValue(value, castToObjectId));
            case FilterOperators.GT_SYMBOL:
            case FilterOperators.GT:
                return new Document("$gt", castValue(value, castToObjectId));
            case FilterOperators.GTE_SYMBOL:
            case FilterOperators.GTE:
                return new Document("$gte", castValue(value, castToObjectId));
            case FilterOperators.LT_SYMBOL:
            case FilterOperators.LT:
                return new Document("$lt", castValue(value, castToObjectId));
            case FilterOperators.LTE_SYMBOL:
            case FilterOperators.LTE:
                return new Document("$lte", castValue(value, castToObjectId));
            case FilterOperators.LIKE:
                return containsPattern(value);
            case FilterOperators.NOT_LIKE:
                return new Document("$not", containsPattern(value));
            case FilterOperators.IN:
                return new Document("$in", castValues(value, castToObjectId));
            case FilterOperators.NIN:
            case FilterOperators.NOT_IN:
                return new Document("$nin", castValues(value, castToObjectId));
            case FilterOperators.BETWEEN:
                return between(operator, value, fieldName, castToObjectId);
            case FilterOperators.AFTER_DATE:
                return new Document("$gt", toValidDate(value, fieldName, operator));
            case FilterOperators.BEFORE_DATE:
                return new Document("$lt", toValidDate(value, fieldName, operator));
            case FilterOperators.EXISTS:
                if (!(value instanceof Boolean)) {
                    throw new FilterCompilationException("exists operator expects a boolean value", fieldName, operator);
                }
                return new Document("$exists", value);
            case FilterOperators.IS_NULL:
                return new Document("$eq", null);
            case FilterOperators.IS_NOT_NULL:
                return new Document("$ne", null);
            default:
                throw new FilterCompilationException("Invalid DSL operator: " + operator, fieldName, operator);
        }
    }

    private Document between(String operator, Object value, String fieldName, boolean castToObjectId) {
        if (ID_FIELD.equals(fieldName)) {
            throw new FilterCompilationException("between operator is not supported on _id field", fieldName, operator);
        }
        if (!(value instanceof List<?> bounds)) {
            throw new FilterCompilationException("'between' operator requires an array with exactly 2 values", fieldName, operator);
        }
        if (bounds.size() != 2) {
            throw new FilterCompilationException("'between' operator requires exactly 2 values, got " + bounds.size(), fieldName, operator);
        }

        Object min = castValue(bounds.get(0), castToObjectId);
        Object max = castValue(bounds.get(1), castToObjectId);
        if (min == null || max == null) {
            throw new FilterCompilationException("'between' operator does not accept null bounds", fieldName, operator);
        }
        if (!(min instanceof ObjectId) && !(max instanceof ObjectId) && compareBounds(min, max, fieldName, operator) > 0) {
            throw new FilterCompilationException("'between' operator: first value (" + min
                    + ") must be less than or equal to second value (" + max + ")", fieldName, operator);
        }
        return new Document("$gte", min).append("$lte", max);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compareBounds(Object min, Object max, String fieldName, String operator) {
        if (min instanceof Number a && max instanceof Number b) {
            if (isFloating(a) || isFloating(b)) {
                return Double.compare(a.doubleValue(), b.doubleValue());
            }
            return toBigDecimal(a).compareTo(toBigDecimal(b));
        }
        if (min instanceof Date a && max instanceof Date b) {
            return a.compareTo(b);
        }
        if (min.getClass() == max.getClass() && min instanceof Comparable comparable) {
            return comparable.compareTo(max);
        }
        throw new FilterCompilationException("'between' operator requires both values to be of the same type", fieldName, operator);
    }

    private static boolean isFloating(Number n) {
        return n instanceof Double || n instanceof Float;
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal bd) return bd;
        if (n instanceof BigInteger bi) return new BigDecimal(bi);
        return BigDecimal.valueOf(n.longValue());
    }

    private static Document containsPattern(Object value) {
        return new Document("$regex", ".*" + escapeRegexChars(String.valueOf(value)) + ".*").append("$options", "i");
    }

    static String escapeRegexChars(String inputString) {
        if (inputString == null) {
            return null;
        }
        //. ^ $ * + - ? ( ) [ ] { } \ |
        return SPECIAL_REGEX_CHARS.matcher(inputString).replaceAll("\\\\$0");
    }

    private boolean shouldConvertToObjectId(String fieldName, boolean hasEscape) {
        if (hasEscape) {
            return false;
        }
        if (noObjectIdCastFields.contains(fieldName)) {
            return false;
        }
        if (schema != null && schema.isDeclared(fieldName)) {
            return schema.isIdentifier(fieldName);
        }
        return fieldName.endsWith(identifierSuffix);
    }

    /**
     * Values that do not look like an identifier pass through unchanged so the store rejects them naturally.
     */
    private static Object castValue(Object value, boolean castToObjectId) {
        if (value == null || !castToObjectId || value instanceof ObjectId) {
            return value;
        }
        if (value instanceof String s && ObjectId.isValid(s)) {
            return new ObjectId(s);
        }
        return value;
    }

    private static List<Object> castValues(Object value, boolean castToObjectId) {
        List<Object> values = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                values.add(castValue(item, castToObjectId));
            }
        } else {
            values.add(castValue(value, castToObjectId));
        }
        return values;
    }

    private static Date toValidDate(Object value, String fieldName, String operator) {
        if (value instanceof Date date) return date;
        if (value instanceof Instant instant) return Date.from(instant);
        if (value instanceof ZonedDateTime zdt) return Date.from(zdt.toInstant());
        if (value instanceof OffsetDateTime odt) return Date.from(odt.toInstant());
        if (value instanceof LocalDateTime ldt) return Date.from(ldt.toInstant(ZoneOffset.UTC));
        if (value instanceof LocalDate ld) return Date.from(ld.atStartOfDay(ZoneOffset.UTC).toInstant());
        if (value instanceof Number n && !(isFloating(n) && !Double.isFinite(n.doubleValue()))) {
            return new Date(n.longValue());
        }
        if (value instanceof String s && !s.isBlank()) {
            String text = s.trim();
            try {
                return Date.from(ZonedDateTime.parse(text).toInstant());
            } catch (DateTimeParseException ignored) {
                // not zoned, try the local forms
            }
            try {
                return Date.from(LocalDateTime.parse(text).toInstant(ZoneOffset.UTC));
            } catch (DateTimeParseException ignored) {
                // not a local date-time
            }
            try {
                return Date.from(LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());
            } catch (DateTimeParseException e) {
                throw new FilterCompilationException("Invalid date value: " + s, fieldName, operator, e);
            }
        }
        throw new FilterCompilationException("Invalid date value: " + value, fieldName, operator);
    }

    public static final class Builder {
        private Set<String> noObjectIdCastFields = Set.of();
        private String identifierSuffix = DEFAULT_IDENTIFIER_SUFFIX;
        private int maxRecursionDepth = DEFAULT_MAX_RECURSION_DEPTH;
        private FilterFieldSchema schema;

        private Builder() {}

        /**
         * Fields that keep string values even though their name ends in the identifier suffix.
         */
        public Builder noObjectIdCastFields(Collection<String> fields) {
            this.noObjectIdCastFields = fields == null ? Set.of() : Set.copyOf(fields);
            return this;
        }

        public Builder identifierSuffix(String identifierSuffix) {
            if (identifierSuffix == null || identifierSuffix.isEmpty()) {
                throw new IllegalArgumentException("identifierSuffix is required");
            }
            this.identifierSuffix = identifierSuffix;
            return this;
        }

        public Builder maxRecursionDepth(int maxRecursionDepth) {
            if (maxRecursionDepth < 0) {
                throw new IllegalArgumentException("maxRecursionDepth must not be negative, got: " + maxRecursionDepth);
            }
            this.maxRecursionDepth = maxRecursionDepth;
            return this;
        }

        public Builder schema(FilterFieldSchema schema) {
            this.schema = schema;
            return this;
        }

        public MongoFilterCompiler build() {
            return new MongoFilterCompiler(this);
        }
    }
}
