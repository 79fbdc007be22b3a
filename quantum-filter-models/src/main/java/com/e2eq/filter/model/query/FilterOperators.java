package com.e2eq.filter.model.query;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Names of the field operators understood by the filter DSL. Names are matched case-insensitively;
 * {@link #normalize(String)} yields the canonical lower case form stored in a sanitized tree.
 */
public final class FilterOperators {

    public static final String EQ_SYMBOL = "=";
    public static final String EQ = "eq";
    public static final String NE_SYMBOL = "!=";
    public static final String NE = "ne";
    public static final String NE_SQL = "<>";
    public static final String GT_SYMBOL = ">";
    public static final String GT = "gt";
    public static final String GTE_SYMBOL = ">=";
    public static final String GTE = "gte";
    public static final String LT_SYMBOL = "<";
    public static final String LT = "lt";
    public static final String LTE_SYMBOL = "<=";
    public static final String LTE = "lte";
    public static final String IN = "in";
    public static final String NIN = "nin";
    public static final String NOT_IN = "not in";
    public static final String EXISTS = "exists";
    public static final String LIKE = "like";
    public static final String NOT_LIKE = "not like";
    public static final String BETWEEN = "between";
    public static final String AFTER_DATE = ">*date";
    public static final String BEFORE_DATE = "<*date";
    public static final String IS_NULL = "is null";
    public static final String IS_NOT_NULL = "is not null";

    /** Every field operator of the DSL, in documentation order. */
    public static final Set<String> ALL = Collections.unmodifiableSet(new LinkedHashSet<>(List.of(
            EQ_SYMBOL, EQ,
            NE_SYMBOL, NE, NE_SQL,
            GT_SYMBOL, GT,
            GTE_SYMBOL, GTE,
            LT_SYMBOL, LT,
            LTE_SYMBOL, LTE,
            IN,
            NIN, NOT_IN,
            EXISTS,
            LIKE,
            NOT_LIKE,
            BETWEEN,
            AFTER_DATE,
            BEFORE_DATE,
            IS_NULL,
            IS_NOT_NULL)));

    private FilterOperators() {}

    public static String normalize(String operator) {
        return operator == null ? null : operator.toLowerCase(Locale.ROOT);
    }
}
