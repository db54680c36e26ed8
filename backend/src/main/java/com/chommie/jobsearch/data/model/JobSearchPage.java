package com.chommie.jobsearch.data.model;

import java.util.List;

public record JobSearchPage(List<Job> jobs, long total) {
    public static JobSearchPage empty() {
        return new JobSearchPage(List.of(), 0);
    }
}
