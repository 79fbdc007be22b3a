package com.e2eq.filter.model.security;

import com.e2eq.filter.model.query.FilterOperators;
import com.e2eq.filter.model.query.LogicalOperator;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable limits and allow/deny sets consulted while sanitizing a client supplied filter.
 * A policy is built once and shared by every request; it has no mutation API.
 *
 * <h2>Presets</h2>
 * <pre>{@code
 * FilterSecurityPolicy policy = FilterSecurityPolicy.defaults();
 *
 * FilterSecurityPolicy custom = FilterSecurityPolicy.builder()
 *     .maxDepth(3)
 *     .addProtectedFields("tenantId")
 *     .build();
 * }</pre>
 *
 * @param allowedLogicalOperators logical keys ({@code and}, {@code or}, {@code not}) a client may use
 * @param allowedFieldOperators   lower case DSL operator names a client may use under a field
 * @param protectedFields         framework bookkeeping fields a client may never filter on
 * @param fieldWhitelist          when present, the only field names a client may filter on
 * @param nativeOperatorMarker    key marker of the database's own operators; such keys are always rejected
 * @param maxDepth                maximum nesting of logical groups
 * @param maxArrayLength          maximum length of any array
 * @param maxStringLength         maximum length of any string value
 * @param maxObjectKeys           maximum key count of any object
 */
public record FilterSecurityPolicy(
        Set<String> allowedLogicalOperators,
        Set<String> allowedFieldOperators,
        Set<String> protectedFields,
        Optional<Set<String>> fieldWhitelist,
        String nativeOperatorMarker,
        int maxDepth,
        int maxArrayLength,
        int maxStringLength,
        int maxObjectKeys
) {

    public static final int DEFAULT_MAX_DEPTH = 5;
    public static final int DEFAULT_MAX_ARRAY_LENGTH = 100;
    public static final int DEFAULT_MAX_STRING_LENGTH = 200;
    public static final int DEFAULT_MAX_OBJECT_KEYS = 50;
    public static final String DEFAULT_NATIVE_OPERATOR_MARKER = "$";

    public static final Set<String> DEFAULT_PROTECTED_FIELDS = Set.of(
            "isDeleted",
            "__v",
            "deletedAt",
            "deletedBy",
            "systemFlags",
            "_bsontype");

    public FilterSecurityPolicy {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative, got: " + maxDepth);
        }
        if (maxArrayLength <= 0) {
            throw new IllegalArgumentException("maxArrayLength must be positive, got: " + maxArrayLength);
        }
        if (maxStringLength <= 0) {
            throw new IllegalArgumentException("maxStringLength must be positive, got: " + maxStringLength);
        }
        if (maxObjectKeys <= 0) {
            throw new IllegalArgumentException("maxObjectKeys must be positive, got: " + maxObjectKeys);
        }
        if (nativeOperatorMarker == null || nativeOperatorMarker.isEmpty()) {
            throw new IllegalArgumentException("nativeOperatorMarker is required");
        }
        allowedLogicalOperators = Set.copyOf(allowedLogicalOperators);
        allowedFieldOperators = allowedFieldOperators.stream()
                .map(FilterOperators::normalize)
                .collect(Collectors.toUnmodifiableSet());
        protectedFields = Set.copyOf(protectedFields);
        fieldWhitelist = fieldWhitelist == null ? Optional.empty() : fieldWhitelist.map(Set::copyOf);
    }

    /**
     * DSL-only policy: all logical and field operators, the framework's protected fields, no whitelist.
     */
    public static FilterSecurityPolicy defaults() {
        return builder().build();
    }

    /**
     * Tighter limits for endpoints open to anonymous callers.
     */
    public static FilterSecurityPolicy strict() {
        return builder()
                .maxDepth(3)
                .maxArrayLength(25)
                .maxStringLength(100)
                .maxObjectKeys(20)
                .build();
    }

    public boolean isLogicalOperatorAllowed(String key) {
        return allowedLogicalOperators.contains(key);
    }

    public boolean isFieldOperatorAllowed(String operator) {
        return allowedFieldOperators.contains(FilterOperators.normalize(operator));
    }

    public boolean isProtected(String field) {
        return protectedFields.contains(field);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.allowedLogicalOperators = new LinkedHashSet<>(allowedLogicalOperators);
        b.allowedFieldOperators = new LinkedHashSet<>(allowedFieldOperators);
        b.protectedFields = new LinkedHashSet<>(protectedFields);
        b.fieldWhitelist = fieldWhitelist.<Set<String>>map(LinkedHashSet::new).orElse(null);
        b.nativeOperatorMarker = nativeOperatorMarker;
        b.maxDepth = maxDepth;
        b.maxArrayLength = maxArrayLength;
        b.maxStringLength = maxStringLength;
        b.maxObjectKeys = maxObjectKeys;
        return b;
    }

    public static final class Builder {
        private Set<String> allowedLogicalOperators = Arrays.stream(LogicalOperator.values())
                .map(LogicalOperator::key)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        private Set<String> allowedFieldOperators = new LinkedHashSet<>(FilterOperators.ALL);
        private Set<String> protectedFields = new LinkedHashSet<>(DEFAULT_PROTECTED_FIELDS);
        private Set<String> fieldWhitelist;
        private String nativeOperatorMarker = DEFAULT_NATIVE_OPERATOR_MARKER;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private int maxArrayLength = DEFAULT_MAX_ARRAY_LENGTH;
        private int maxStringLength = DEFAULT_MAX_STRING_LENGTH;
        private int maxObjectKeys = DEFAULT_MAX_OBJECT_KEYS;

        private Builder() {}

        public Builder allowedLogicalOperators(Collection<String> operators) {
            this.allowedLogicalOperators = new LinkedHashSet<>(operators);
            return this;
        }

        public Builder allowedFieldOperators(Collection<String> operators) {
            this.allowedFieldOperators = new LinkedHashSet<>(operators);
            return this;
        }

        public Builder protectedFields(Collection<String> fields) {
            this.protectedFields = new LinkedHashSet<>(fields);
            return this;
        }

        public Builder addProtectedFields(String... fields) {
            this.protectedFields.addAll(Arrays.asList(fields));
            return this;
        }

        /**
         * @param fields the only filterable fields, or {@code null} to allow any field that is not protected
         */
        public Builder fieldWhitelist(Collection<String> fields) {
            this.fieldWhitelist = fields == null ? null : new LinkedHashSet<>(fields);
            return this;
        }

        public Builder nativeOperatorMarker(String marker) {
            this.nativeOperatorMarker = marker;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder maxArrayLength(int maxArrayLength) {
            this.maxArrayLength = maxArrayLength;
            return this;
        }

        public Builder maxStringLength(int maxStringLength) {
            this.maxStringLength = maxStringLength;
            return this;
        }

        public Builder maxObjectKeys(int maxObjectKeys) {
            this.maxObjectKeys = maxObjectKeys;
            return this;
        }

        public FilterSecurityPolicy build() {
            return new FilterSecurityPolicy(
                    allowedLogicalOperators,
                    allowedFieldOperators,
                    protectedFields,
                    Optional.ofNullable(fieldWhitelist),
                    nativeOperatorMarker,
                    maxDepth,
                    maxArrayLength,
                    maxStringLength,
                    maxObjectKeys);
        }
    }
}
