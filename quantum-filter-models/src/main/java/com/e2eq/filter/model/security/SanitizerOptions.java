package com.e2eq.filter.model.security;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per-call input to the sanitizer: the shared {@link FilterSecurityPolicy} plus caller specific overrides.
 * An override that is not set falls back to the policy value.
 */
public final class SanitizerOptions {

    private final FilterSecurityPolicy policy;
    private final Set<String> allowedFields;
    private final Set<String> customProtectedFields;
    private final Integer maxDepth;
    private final Integer maxArrayLength;
    private final Integer maxStringLength;
    private final Integer maxObjectKeys;

    private SanitizerOptions(Builder b) {
        this.policy = Objects.requireNonNull(b.policy, "policy");
        this.allowedFields = b.allowedFields == null ? null : Set.copyOf(b.allowedFields);
        this.customProtectedFields = Set.copyOf(b.customProtectedFields);
        this.maxDepth = b.maxDepth;
        this.maxArrayLength = b.maxArrayLength;
        this.maxStringLength = b.maxStringLength;
        this.maxObjectKeys = b.maxObjectKeys;
    }

    public static SanitizerOptions defaults() {
        return builder().build();
    }

    public static SanitizerOptions of(FilterSecurityPolicy policy) {
        return builder().policy(policy).build();
    }

    public FilterSecurityPolicy policy() {
        return policy;
    }

    /**
     * Caller whitelist if one was given, else the policy's.
     */
    public Optional<Set<String>> allowedFields() {
        return allowedFields != null ? Optional.of(allowedFields) : policy.fieldWhitelist();
    }

    public Set<String> customProtectedFields() {
        return customProtectedFields;
    }

    public boolean isProtected(String field) {
        return policy.isProtected(field) || customProtectedFields.contains(field);
    }

    public int maxDepth() {
        return maxDepth != null ? maxDepth : policy.maxDepth();
    }

    public int maxArrayLength() {
        return maxArrayLength != null ? maxArrayLength : policy.maxArrayLength();
    }

    public int maxStringLength() {
        return maxStringLength != null ? maxStringLength : policy.maxStringLength();
    }

    public int maxObjectKeys() {
        return maxObjectKeys != null ? maxObjectKeys : policy.maxObjectKeys();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private FilterSecurityPolicy policy = FilterSecurityPolicy.defaults();
        private Set<String> allowedFields;
        private Set<String> customProtectedFields = new LinkedHashSet<>();
        private Integer maxDepth;
        private Integer maxArrayLength;
        private Integer maxStringLength;
        private Integer maxObjectKeys;

        private Builder() {}

        public Builder policy(FilterSecurityPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder allowedFields(Collection<String> fields) {
            this.allowedFields = fields == null ? null : new LinkedHashSet<>(fields);
            return this;
        }

        public Builder customProtectedFields(Collection<String> fields) {
            this.customProtectedFields = fields == null ? new LinkedHashSet<>() : new LinkedHashSet<>(fields);
            return this;
        }

        public Builder maxDepth(Integer maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder maxArrayLength(Integer maxArrayLength) {
            this.maxArrayLength = maxArrayLength;
            return this;
        }

        public Builder maxStringLength(Integer maxStringLength) {
            this.maxStringLength = maxStringLength;
            return this;
        }

        public Builder maxObjectKeys(Integer maxObjectKeys) {
            this.maxObjectKeys = maxObjectKeys;
            return this;
        }

        public SanitizerOptions build() {
            return new SanitizerOptions(this);
        }
    }
}
