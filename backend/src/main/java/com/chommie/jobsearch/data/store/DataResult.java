package com.chommie.jobsearch.data.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rows returned by the store. {@code totalCount} is only set when the request asked for it.
 */
public record DataResult(List<Map<String, Object>> rows, Long totalCount) {
    public DataResult {
        rows = rows == null ? List.of() : rows;
    }

    public static DataResult of(List<Map<String, Object>> rows) {
        return new DataResult(rows, null);
    }

    public Optional<Map<String, Object>> firstRow() {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
