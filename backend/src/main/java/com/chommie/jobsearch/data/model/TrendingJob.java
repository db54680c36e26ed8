package com.chommie.jobsearch.data.model;

public record TrendingJob(Job job, long applicationCount) {
}
