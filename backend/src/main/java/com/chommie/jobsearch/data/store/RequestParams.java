package com.chommie.jobsearch.data.store;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured parameters of a single store request. Conditions in {@code filters} are ANDed;
 * each group in {@code anyOf} is ORed internally and ANDed with everything else.
 */
public record RequestParams(
    List<FilterCondition> filters,
    List<List<FilterCondition>> anyOf,
    List<SortOrder> order,
    Integer limit,
    Integer offset,
    boolean countTotal,
    Map<String, Object> body
) {
    public RequestParams {
        filters = filters == null ? List.of() : List.copyOf(filters);
        anyOf = anyOf == null ? List.of() : anyOf.stream().map(List::copyOf).toList();
        order = order == null ? List.of() : List.copyOf(order);
        body = body == null ? Map.of() : new LinkedHashMap<>(body);
    }

    public static RequestParams none() {
        return new RequestParams(List.of(), List.of(), List.of(), null, null, false, Map.of());
    }

    public boolean hasFilters() {
        return !filters.isEmpty() || !anyOf.isEmpty();
    }
}
