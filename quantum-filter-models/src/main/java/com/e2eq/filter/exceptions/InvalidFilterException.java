package com.e2eq.filter.exceptions;

/**
 * The filter parameter could not be read as JSON. Distinct from sanitization violations, which apply to
 * well formed input.
 */
public class InvalidFilterException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public InvalidFilterException(String message) {
        super(message);
    }

    public InvalidFilterException(String message, Throwable cause) {
        super(message, cause);
    }
}
