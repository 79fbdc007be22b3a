package com.e2eq.filter.exceptions;

/**
 * Raised while compiling a sanitized filter into a native query: malformed {@code between}, unparseable
 * dates, unknown operators, excessive nesting. Never recovered from; it fails the request.
 */
public class FilterCompilationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String field;
    private final String operator;

    public FilterCompilationException(String message) {
        this(message, null, null, null);
    }

    public FilterCompilationException(String message, String field, String operator) {
        this(message, field, operator, null);
    }

    public FilterCompilationException(String message, String field, String operator, Throwable cause) {
        super(message, cause);
        this.field = field;
        this.operator = operator;
    }

    public String getField() {
        return field;
    }

    public String getOperator() {
        return operator;
    }
}
