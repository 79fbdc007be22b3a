package com.e2eq.filter.annotations;

/**
 * Declared value kind of a filterable field.
 */
public enum FieldKind {
    STRING,
    NUMBER,
    BOOLEAN,
    DATE,
    /** Holds a database identifier; string values are coerced to {@code ObjectId}. */
    IDENTIFIER,
    OTHER
}
