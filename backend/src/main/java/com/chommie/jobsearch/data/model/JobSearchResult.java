package com.chommie.jobsearch.data.model;

import java.util.List;

public record JobSearchResult(List<Job> jobs, long total, boolean rateLimited) {
    public static JobSearchResult of(JobSearchPage page) {
        return new JobSearchResult(page.jobs(), page.total(), false);
    }

    public static JobSearchResult limited() {
        return new JobSearchResult(List.of(), 0, true);
    }
}
