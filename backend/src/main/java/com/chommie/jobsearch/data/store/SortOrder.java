package com.chommie.jobsearch.data.store;

public record SortOrder(String field, boolean ascending) {
}
