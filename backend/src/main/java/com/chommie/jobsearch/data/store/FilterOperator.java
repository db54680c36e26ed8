package com.chommie.jobsearch.data.store;

public enum FilterOperator {
    EQ("eq"),
    NEQ("neq"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    ILIKE("ilike"),
    IN("in"),
    IS_NULL("is");

    private final String token;

    FilterOperator(String token) {
        this.token = token;
    }

    /**
     * Operator token in the PostgREST filter grammar.
     */
    public String token() {
        return token;
    }
}
