package com.chommie.jobsearch.data.model;

public record JobSearchFilters(
    String query,
    String location,
    JobType jobType,
    Integer salaryMin,
    Integer salaryMax,
    boolean remoteOnly,
    Integer limit,
    Integer offset
) {
    public static JobSearchFilters ofQuery(String query, Integer limit) {
        return new JobSearchFilters(query, null, null, null, null, false, limit, null);
    }
}
