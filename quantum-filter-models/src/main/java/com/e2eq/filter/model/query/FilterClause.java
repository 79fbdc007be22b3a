package com.e2eq.filter.model.query;

/**
 * One key/value entry of a filter object: either a {@link FieldCondition} or a {@link LogicalGroup}.
 */
public interface FilterClause {

    /**
     * @return the JSON key this clause was written under
     */
    String key();

    /**
     * @return the JSON-like value of this clause (scalars, lists and ordered maps)
     */
    Object toValue();
}
