package com.chommie.jobsearch.data.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builder for {@link RequestParams}. Null values skip their condition, so optional search
 * fields can be chained without branching.
 */
public final class QueryFilter {
    private final List<FilterCondition> filters = new ArrayList<>();
    private final List<List<FilterCondition>> anyOf = new ArrayList<>();
    private final List<SortOrder> order = new ArrayList<>();
    private final Map<String, Object> body = new LinkedHashMap<>();
    private Integer limit;
    private Integer offset;
    private boolean countTotal;

    private QueryFilter() {
    }

    public static QueryFilter builder() {
        return new QueryFilter();
    }

    public QueryFilter eq(String field, Object value) {
        return add(field, FilterOperator.EQ, value);
    }

    public QueryFilter neq(String field, Object value) {
        return add(field, FilterOperator.NEQ, value);
    }

    public QueryFilter gt(String field, Object value) {
        return add(field, FilterOperator.GT, value);
    }

    public QueryFilter gte(String field, Object value) {
        return add(field, FilterOperator.GTE, value);
    }

    public QueryFilter lt(String field, Object value) {
        return add(field, FilterOperator.LT, value);
    }

    public QueryFilter lte(String field, Object value) {
        return add(field, FilterOperator.LTE, value);
    }

    public QueryFilter ilike(String field, String term) {
        if (term == null || term.isBlank()) {
            return this;
        }
        return add(field, FilterOperator.ILIKE, term);
    }

    public QueryFilter in(String field, Collection<?> values) {
        if (values == null) {
            return this;
        }
        filters.add(new FilterCondition(field, FilterOperator.IN, List.copyOf(values)));
        return this;
    }

    public QueryFilter isNull(String field) {
        filters.add(new FilterCondition(field, FilterOperator.IS_NULL, null));
        return this;
    }

    /**
     * Matches when any of the given columns contains the term.
     */
    public QueryFilter ilikeAny(Collection<String> fields, String term) {
        if (term == null || term.isBlank() || fields == null || fields.isEmpty()) {
            return this;
        }
        List<FilterCondition> group = new ArrayList<>();
        for (String field : fields) {
            group.add(new FilterCondition(field, FilterOperator.ILIKE, term));
        }
        anyOf.add(group);
        return this;
    }

    public QueryFilter orderBy(String field, boolean ascending) {
        order.add(new SortOrder(field, ascending));
        return this;
    }

    public QueryFilter limit(Integer value) {
        this.limit = value;
        return this;
    }

    public QueryFilter offset(Integer value) {
        this.offset = value;
        return this;
    }

    public QueryFilter withCount() {
        this.countTotal = true;
        return this;
    }

    public QueryFilter body(Map<String, Object> values) {
        if (values != null) {
            body.putAll(values);
        }
        return this;
    }

    public RequestParams build() {
        return new RequestParams(filters, anyOf, order, limit, offset, countTotal, body);
    }

    private QueryFilter add(String field, FilterOperator operator, Object value) {
        if (value == null) {
            return this;
        }
        filters.add(new FilterCondition(field, operator, value));
        return this;
    }
}
