package com.e2eq.filter.model.query;

import java.util.Optional;

/**
 * Logical combinators of the filter DSL. The key is the literal (lower case) JSON key a client uses.
 */
public enum LogicalOperator {
    AND("and", "$and"),
    OR("or", "$or"),
    NOT("not", "$nor");

    private final String key;
    private final String mongoOperator;

    LogicalOperator(String key, String mongoOperator) {
        this.key = key;
        this.mongoOperator = mongoOperator;
    }

    public String key() {
        return key;
    }

    /**
     * @return the MongoDB operator the group compiles to; {@code NOT} compiles to a single element {@code $nor}
     */
    public String mongoOperator() {
        return mongoOperator;
    }

    public static Optional<LogicalOperator> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        for (LogicalOperator op : values()) {
            if (op.key.equals(key)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
