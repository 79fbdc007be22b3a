package com.e2eq.filter.model.security;

import com.e2eq.filter.model.query.FilterTree;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of sanitizing one filter: the canonical tree and every reason a clause was dropped.
 * When {@link #failedClosed()} is true the tree is empty and must be treated as "no client filter".
 */
public record SanitizationResult(FilterTree sanitized, List<String> violations) {

    public static final String FAILURE_PREFIX = "Sanitization failed: ";

    public SanitizationResult {
        Objects.requireNonNull(sanitized, "sanitized");
        violations = List.copyOf(violations);
    }

    public static SanitizationResult failed(String cause) {
        return new SanitizationResult(FilterTree.EMPTY, List.of(FAILURE_PREFIX + cause));
    }

    public boolean hasViolations() {
        return !violations.isEmpty();
    }

    public boolean failedClosed() {
        return violations.stream().anyMatch(v -> v.startsWith(FAILURE_PREFIX));
    }
}
