package com.chommie.jobsearch.data.model;

import java.util.List;

public record TrendingJobsResult(List<TrendingJob> jobs) {
}
