package com.chommie.jobsearch.data.util;

import java.util.ArrayList;
import java.util.List;

public final class Batches {
    private Batches() {
    }

    /**
     * Splits {@code items} into consecutive chunks of at most {@code size} elements.
     */
    public static <T> List<List<T>> partition(List<T> items, int size) {
        int safeSize = Math.max(1, size);
        List<List<T>> out = new ArrayList<>((items.size() + safeSize - 1) / safeSize);
        for (int start = 0; start < items.size(); start += safeSize) {
            out.add(List.copyOf(items.subList(start, Math.min(items.size(), start + safeSize))));
        }
        return out;
    }
}
