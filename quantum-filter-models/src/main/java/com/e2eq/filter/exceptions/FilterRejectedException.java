package com.e2eq.filter.exceptions;

import java.util.List;

/**
 * The filter was refused as a whole, either because sanitization failed closed or because the caller asked
 * for any violation to be treated as an error.
 */
public class FilterRejectedException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public FilterRejectedException(String message, List<String> violations) {
        super(message);
        this.violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
