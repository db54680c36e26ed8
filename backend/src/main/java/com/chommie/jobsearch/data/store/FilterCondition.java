package com.chommie.jobsearch.data.store;

/**
 * One predicate on a column. For {@link FilterOperator#ILIKE} the value is the bare search
 * term; bindings add the wildcards. For {@link FilterOperator#IN} the value is a collection.
 */
public record FilterCondition(String field, FilterOperator operator, Object value) {
}
