package com.chommie.jobsearch.data.model;

/**
 * An application with its job attached; {@code job} is null when the job no longer resolves.
 */
public record ApplicationWithJob(Application application, Job job) {
}
